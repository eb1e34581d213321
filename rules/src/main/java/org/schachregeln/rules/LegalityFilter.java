package org.schachregeln.rules;

import org.schachregeln.model.AppliedMove;
import org.schachregeln.model.Board;
import org.schachregeln.model.Move;
import org.schachregeln.model.Piece;
import org.schachregeln.model.PieceType;
import org.schachregeln.model.Position;
import org.schachregeln.model.Square;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes pseudo-legal candidates that would leave the mover's king attacked. Each candidate is played on a
 * throwaway copy of the board; pins and checks are handled only here.
 */
public final class LegalityFilter {
    private LegalityFilter() {
    }

    /**
     * Legal destinations of the piece on {@code square}. Empty if the square is empty or holds a piece of the
     * side not to move.
     */
    public static List<Square> legalMoves(Square square, Position position) {
        Piece piece = position.pieceAt(square);
        List<Square> legal = new ArrayList<>();
        if (piece == null || piece.getColor() != position.sideToMove()) {
            return legal;
        }
        for (Square target : PseudoLegalGenerator.destinations(position, square)) {
            if (keepsKingSafe(position, simulatedMove(piece, square, target))) {
                legal.add(target);
            }
        }
        return legal;
    }

    /**
     * Every legal move of the side to move, one per origin/destination pair. Promotions carry no explicit
     * piece and therefore promote to a queen.
     */
    public static List<Move> allLegalMoves(Position position) {
        List<Move> moves = new ArrayList<>();
        for (int row = 0; row < Board.SIZE; row++) {
            for (int col = 0; col < Board.SIZE; col++) {
                Square from = Square.of(row, col);
                for (Square to : legalMoves(from, position)) {
                    moves.add(Move.of(from, to));
                }
            }
        }
        return moves;
    }

    public static boolean isLegal(Position position, Move move) {
        return legalMoves(move.from(), position).contains(move.to());
    }

    private static Move simulatedMove(Piece piece, Square from, Square to) {
        boolean promotes = piece.getType() == PieceType.PAWN && to.row() == piece.getColor().promotionRow();
        return new Move(from, to, promotes ? PieceType.QUEEN : null);
    }

    private static boolean keepsKingSafe(Position position, Move move) {
        AppliedMove applied = MoveApplier.apply(position, move);
        return !AttackOracle.isKingAttacked(applied.board(), position.sideToMove());
    }
}
