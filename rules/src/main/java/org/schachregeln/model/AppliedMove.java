package org.schachregeln.model;

public record AppliedMove(Move move,
                          Piece movedPiece,
                          Board board,
                          CastlingRights castlingRights,
                          Square enPassantTarget,
                          Piece capturedPiece,
                          boolean enPassant,
                          CastlingSide castling,
                          PieceType promotion) {

    public boolean isCapture() {
        return capturedPiece != null;
    }

    public boolean isCastlingKingside() {
        return castling == CastlingSide.KINGSIDE;
    }

    public boolean isCastlingQueenside() {
        return castling == CastlingSide.QUEENSIDE;
    }

    public boolean isPawnMove() {
        return movedPiece.getType() == PieceType.PAWN;
    }
}
