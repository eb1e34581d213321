package org.schachregeln.notation;

import org.schachregeln.model.AppliedMove;
import org.schachregeln.model.GameStatus;
import org.schachregeln.model.PieceType;
import org.schachregeln.model.Position;
import org.schachregeln.rules.GameStatusEvaluator;

/**
 * Renders a played move in algebraic notation, e.g. {@code Nf3}, {@code exd5}, {@code e8=Q+}, {@code O-O}.
 * <p>
 * No disambiguation is added when two pieces of the same type can reach the destination, so {@code Rd1}
 * may stand for either rook.
 */
public final class NotationFormatter {
    private NotationFormatter() {
    }

    /**
     * @param applied the move as applied to the position before it
     * @param after   the full position that resulted, with the opponent to move
     */
    public static String format(AppliedMove applied, Position after) {
        // castling is written bare, without a check marker
        if (applied.castling() != null) {
            return applied.castling().notation();
        }
        return body(applied) + suffix(after);
    }

    private static String body(AppliedMove applied) {
        PieceType type = applied.movedPiece().getType();
        StringBuilder notation = new StringBuilder(8);
        notation.append(type.notationLetter());
        if (applied.isCapture()) {
            if (type == PieceType.PAWN) {
                notation.append(applied.move().from().file());
            }
            notation.append('x');
        }
        notation.append(applied.move().to().toAlgebraic());
        if (applied.promotion() != null) {
            notation.append('=').append(applied.promotion().notationLetter());
        }
        return notation.toString();
    }

    private static String suffix(Position after) {
        if (!GameStatusEvaluator.isInCheck(after)) {
            return "";
        }
        return GameStatusEvaluator.status(after) == GameStatus.CHECKMATE ? "#" : "+";
    }
}
