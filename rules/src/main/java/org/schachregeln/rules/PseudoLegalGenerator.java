package org.schachregeln.rules;

import org.schachregeln.model.Board;
import org.schachregeln.model.CastlingSide;
import org.schachregeln.model.Piece;
import org.schachregeln.model.PieceColor;
import org.schachregeln.model.PieceType;
import org.schachregeln.model.Position;
import org.schachregeln.model.Square;

import java.util.ArrayList;
import java.util.List;

/**
 * Candidate destinations per piece type. Whether the move leaves the mover's king attacked is not checked
 * here; see {@link LegalityFilter}.
 */
public final class PseudoLegalGenerator {
    private PseudoLegalGenerator() {
    }

    /**
     * Candidate destinations of the piece on {@code from}; empty when the square is empty.
     */
    public static List<Square> destinations(Position position, Square from) {
        Piece piece = position.pieceAt(from);
        if (piece == null) {
            return new ArrayList<>();
        }

        List<Square> moves = new ArrayList<>();
        return switch (piece.getType()) {
            case PAWN -> addPawnMoves(position, from, piece, moves);
            case KNIGHT -> addSteps(position.board(), from, piece, AttackOracle.KNIGHT_OFFSETS, moves);
            case BISHOP, ROOK, QUEEN -> addSlides(position.board(), from, piece, moves);
            case KING -> addCastling(position, from, piece,
                    addSteps(position.board(), from, piece, AttackOracle.KING_OFFSETS, moves));
        };
    }

    private static List<Square> addPawnMoves(Position position, Square from, Piece pawn, List<Square> moves) {
        Board board = position.board();
        PieceColor color = pawn.getColor();
        int forward = color.forward();

        Square oneStep = from.offset(forward, 0);
        if (oneStep != null && board.isEmpty(oneStep)) {
            moves.add(oneStep);
            Square twoSteps = from.offset(2 * forward, 0);
            if (from.row() == color.pawnHomeRow() && twoSteps != null && board.isEmpty(twoSteps)) {
                moves.add(twoSteps);
            }
        }

        for (int side : new int[]{-1, 1}) {
            Square target = from.offset(forward, side);
            if (target == null) {
                continue;
            }
            Piece occupant = board.pieceAt(target);
            if (occupant != null && occupant.getColor() != color) {
                moves.add(target);
            } else if (occupant == null && target.equals(position.enPassantTarget())
                    && color == position.sideToMove()) {
                moves.add(target);
            }
        }
        return moves;
    }

    private static List<Square> addSteps(Board board, Square from, Piece piece, int[][] offsets, List<Square> moves) {
        for (int[] offset : offsets) {
            Square target = from.offset(offset[0], offset[1]);
            if (target == null) {
                continue;
            }
            Piece occupant = board.pieceAt(target);
            if (occupant == null || occupant.getColor() != piece.getColor()) {
                moves.add(target);
            }
        }
        return moves;
    }

    private static List<Square> addSlides(Board board, Square from, Piece piece, List<Square> moves) {
        for (int[] direction : AttackOracle.slidingDirections(piece.getType())) {
            Square target = from.offset(direction[0], direction[1]);
            while (target != null) {
                Piece occupant = board.pieceAt(target);
                if (occupant != null) {
                    if (occupant.getColor() != piece.getColor()) {
                        moves.add(target);
                    }
                    break;
                }
                moves.add(target);
                target = target.offset(direction[0], direction[1]);
            }
        }
        return moves;
    }

    private static List<Square> addCastling(Position position, Square from, Piece king, List<Square> moves) {
        PieceColor color = king.getColor();
        if (!from.equals(Square.of(color.backRankRow(), 4))) {
            return moves;
        }
        Board board = position.board();
        PieceColor opponent = color.opposite();
        if (AttackOracle.isSquareAttacked(from, opponent, board)) {
            return moves;
        }

        for (CastlingSide side : CastlingSide.values()) {
            if (!position.castlingRights().has(color, side)) {
                continue;
            }
            Square rookHome = side.rookHome(color);
            Piece rook = board.pieceAt(rookHome);
            if (rook == null || !rook.is(PieceType.ROOK, color) || !pathIsEmpty(board, from, rookHome)) {
                continue;
            }
            int step = Integer.signum(side.kingTargetCol() - from.col());
            Square transit = from.offset(0, step);
            Square destination = from.offset(0, 2 * step);
            if (!AttackOracle.isSquareAttacked(transit, opponent, board)
                    && !AttackOracle.isSquareAttacked(destination, opponent, board)) {
                moves.add(destination);
            }
        }
        return moves;
    }

    private static boolean pathIsEmpty(Board board, Square king, Square rook) {
        int step = Integer.signum(rook.col() - king.col());
        for (int col = king.col() + step; col != rook.col(); col += step) {
            if (board.pieceAt(king.row(), col) != null) {
                return false;
            }
        }
        return true;
    }
}
