package org.schachregeln.rules;

import org.schachregeln.model.Board;
import org.schachregeln.model.Piece;
import org.schachregeln.model.PieceColor;
import org.schachregeln.model.PieceType;
import org.schachregeln.model.Square;

/**
 * Raw square-attack tests. Only occupancy is consulted (to stop sliding pieces); pins, turn and the
 * attacker's own king safety are ignored.
 */
public final class AttackOracle {

    static final int[][] KNIGHT_OFFSETS = {
            {-2, -1}, {-2, 1}, {-1, -2}, {-1, 2},
            {1, -2}, {1, 2}, {2, -1}, {2, 1}
    };
    static final int[][] KING_OFFSETS = {
            {-1, -1}, {-1, 0}, {-1, 1},
            {0, -1}, {0, 1},
            {1, -1}, {1, 0}, {1, 1}
    };
    static final int[][] ORTHOGONALS = {{-1, 0}, {1, 0}, {0, -1}, {0, 1}};
    static final int[][] DIAGONALS = {{-1, -1}, {-1, 1}, {1, -1}, {1, 1}};
    static final int[][] ALL_DIRECTIONS = {
            {-1, 0}, {1, 0}, {0, -1}, {0, 1},
            {-1, -1}, {-1, 1}, {1, -1}, {1, 1}
    };
    private static final int[][] NONE = {};

    private AttackOracle() {
    }

    /**
     * Ray directions of a sliding piece; empty for pieces that do not slide.
     */
    static int[][] slidingDirections(PieceType type) {
        return switch (type) {
            case BISHOP -> DIAGONALS;
            case ROOK -> ORTHOGONALS;
            case QUEEN -> ALL_DIRECTIONS;
            case PAWN, KNIGHT, KING -> NONE;
        };
    }

    public static boolean attacksSquare(Square attackerSquare, Piece attacker, Square target, Board board) {
        if (attackerSquare.equals(target)) {
            return false;
        }
        int dRow = target.row() - attackerSquare.row();
        int dCol = target.col() - attackerSquare.col();

        return switch (attacker.getType()) {
            case PAWN -> dRow == attacker.getColor().forward() && Math.abs(dCol) == 1;
            case KNIGHT -> matchesOffset(KNIGHT_OFFSETS, dRow, dCol);
            case KING -> matchesOffset(KING_OFFSETS, dRow, dCol);
            case BISHOP, ROOK, QUEEN -> rayReaches(attackerSquare, target, board, slidingDirections(attacker.getType()));
        };
    }

    public static boolean isSquareAttacked(Square square, PieceColor byColor, Board board) {
        for (int row = 0; row < Board.SIZE; row++) {
            for (int col = 0; col < Board.SIZE; col++) {
                Piece piece = board.pieceAt(row, col);
                if (piece != null && piece.getColor() == byColor
                        && attacksSquare(Square.of(row, col), piece, square, board)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Whether the king of {@code kingColor} is attacked by the other side. A board without that king is never
     * in check.
     */
    public static boolean isKingAttacked(Board board, PieceColor kingColor) {
        Square king = board.findKing(kingColor);
        return king != null && isSquareAttacked(king, kingColor.opposite(), board);
    }

    private static boolean matchesOffset(int[][] offsets, int dRow, int dCol) {
        for (int[] offset : offsets) {
            if (offset[0] == dRow && offset[1] == dCol) {
                return true;
            }
        }
        return false;
    }

    private static boolean rayReaches(Square from, Square target, Board board, int[][] directions) {
        for (int[] direction : directions) {
            Square next = from.offset(direction[0], direction[1]);
            while (next != null) {
                if (next.equals(target)) {
                    return true;
                }
                if (!board.isEmpty(next)) {
                    break;
                }
                next = next.offset(direction[0], direction[1]);
            }
        }
        return false;
    }
}
