package org.schachregeln.rules;

import org.schachregeln.model.AppliedMove;
import org.schachregeln.model.Board;
import org.schachregeln.model.CastlingRights;
import org.schachregeln.model.CastlingSide;
import org.schachregeln.model.Move;
import org.schachregeln.model.Piece;
import org.schachregeln.model.PieceColor;
import org.schachregeln.model.PieceType;
import org.schachregeln.model.Position;
import org.schachregeln.model.Square;

/**
 * Applies a move that has already been validated. The input position is left untouched.
 * <p>
 * Side to move, half-move clock and full-move number are not advanced here; see
 * {@link org.schachregeln.game.TurnSequencer}.
 */
public final class MoveApplier {
    private MoveApplier() {
    }

    public static AppliedMove apply(Position position, Move move) {
        Square from = move.from();
        Square to = move.to();
        Piece piece = position.pieceAt(from);
        if (piece == null) {
            throw new IllegalStateException("No piece at from square: " + from);
        }
        PieceColor color = piece.getColor();
        Board.Editor editor = position.board().edit();

        Piece captured = editor.get(to);
        boolean enPassant = piece.getType() == PieceType.PAWN
                && to.equals(position.enPassantTarget())
                && from.col() != to.col();
        if (enPassant) {
            Square victim = Square.of(to.row() - color.forward(), to.col());
            captured = editor.get(victim);
            editor.clear(victim);
        }

        editor.relocate(from, to);

        PieceType promotion = null;
        if (piece.getType() == PieceType.PAWN && to.row() == color.promotionRow()) {
            promotion = move.promotion() != null ? move.promotion() : PieceType.QUEEN;
            editor.put(to, Piece.of(promotion, color));
        }

        CastlingSide castling = null;
        if (piece.getType() == PieceType.KING && Math.abs(to.col() - from.col()) == 2) {
            castling = to.col() > from.col() ? CastlingSide.KINGSIDE : CastlingSide.QUEENSIDE;
            editor.relocate(castling.rookHome(color), Square.of(from.row(), castling.rookTargetCol()));
        }

        CastlingRights rights = updateCastlingRights(position.castlingRights(), piece, from, to);

        Square enPassantTarget = null;
        if (piece.getType() == PieceType.PAWN && Math.abs(to.row() - from.row()) == 2) {
            enPassantTarget = Square.of(from.row() + color.forward(), from.col());
        }

        return new AppliedMove(move, piece, editor.build(), rights, enPassantTarget,
                captured, enPassant, castling, promotion);
    }

    private static CastlingRights updateCastlingRights(CastlingRights rights, Piece piece, Square from, Square to) {
        CastlingRights updated = rights;
        if (piece.getType() == PieceType.KING) {
            updated = updated.withoutColor(piece.getColor());
        }
        // a rook leaving its corner, or anything landing on a corner, ends that right
        for (PieceColor color : PieceColor.values()) {
            for (Square touched : new Square[]{from, to}) {
                CastlingSide side = CastlingSide.forRookHome(color, touched);
                if (side != null) {
                    updated = updated.without(color, side);
                }
            }
        }
        return updated;
    }
}
