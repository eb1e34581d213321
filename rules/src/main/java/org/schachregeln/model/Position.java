package org.schachregeln.model;

import java.util.Objects;

public record Position(Board board,
                       PieceColor sideToMove,
                       CastlingRights castlingRights,
                       Square enPassantTarget,
                       int halfMoveClock,
                       int fullMoveNumber) {

    public static final String INITIAL_FEN = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    private static final PieceType[] BACK_RANK = {
            PieceType.ROOK, PieceType.KNIGHT, PieceType.BISHOP, PieceType.QUEEN,
            PieceType.KING, PieceType.BISHOP, PieceType.KNIGHT, PieceType.ROOK
    };

    public Position {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(sideToMove, "sideToMove");
        Objects.requireNonNull(castlingRights, "castlingRights");
        if (halfMoveClock < 0) {
            throw new IllegalArgumentException("Negative half-move clock: " + halfMoveClock);
        }
        if (fullMoveNumber < 1) {
            throw new IllegalArgumentException("Full-move number must be positive: " + fullMoveNumber);
        }
    }

    public static Position initial() {
        Board.Editor editor = Board.empty().edit();
        for (PieceColor color : PieceColor.values()) {
            for (int col = 0; col < Board.SIZE; col++) {
                editor.put(Square.of(color.backRankRow(), col), Piece.of(BACK_RANK[col], color));
                editor.put(Square.of(color.pawnHomeRow(), col), Piece.of(PieceType.PAWN, color));
            }
        }
        return new Position(editor.build(), PieceColor.WHITE, CastlingRights.ALL, null, 0, 1);
    }

    public Piece pieceAt(Square square) {
        return board.pieceAt(square);
    }
}
