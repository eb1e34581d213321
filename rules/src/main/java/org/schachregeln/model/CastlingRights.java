package org.schachregeln.model;

public record CastlingRights(boolean whiteKingside, boolean whiteQueenside,
                             boolean blackKingside, boolean blackQueenside) {

    public static final CastlingRights ALL = new CastlingRights(true, true, true, true);
    public static final CastlingRights NONE = new CastlingRights(false, false, false, false);

    public boolean has(PieceColor color, CastlingSide side) {
        if (color == PieceColor.WHITE) {
            return side == CastlingSide.KINGSIDE ? whiteKingside : whiteQueenside;
        }
        return side == CastlingSide.KINGSIDE ? blackKingside : blackQueenside;
    }

    public CastlingRights without(PieceColor color, CastlingSide side) {
        boolean wk = whiteKingside;
        boolean wq = whiteQueenside;
        boolean bk = blackKingside;
        boolean bq = blackQueenside;
        if (color == PieceColor.WHITE) {
            if (side == CastlingSide.KINGSIDE) wk = false; else wq = false;
        } else {
            if (side == CastlingSide.KINGSIDE) bk = false; else bq = false;
        }
        return new CastlingRights(wk, wq, bk, bq);
    }

    public CastlingRights withoutColor(PieceColor color) {
        return without(color, CastlingSide.KINGSIDE).without(color, CastlingSide.QUEENSIDE);
    }

    public String toFen() {
        StringBuilder sb = new StringBuilder(4);
        if (whiteKingside) sb.append('K');
        if (whiteQueenside) sb.append('Q');
        if (blackKingside) sb.append('k');
        if (blackQueenside) sb.append('q');
        return sb.length() == 0 ? "-" : sb.toString();
    }

    @Override
    public String toString() {
        return toFen();
    }
}
