package org.schachregeln.model;

public enum CastlingSide {
    KINGSIDE(7, 6, 5, "O-O"),
    QUEENSIDE(0, 2, 3, "O-O-O");

    private final int rookHomeCol;
    private final int kingTargetCol;
    private final int rookTargetCol;
    private final String notation;

    CastlingSide(int rookHomeCol, int kingTargetCol, int rookTargetCol, String notation) {
        this.rookHomeCol = rookHomeCol;
        this.kingTargetCol = kingTargetCol;
        this.rookTargetCol = rookTargetCol;
        this.notation = notation;
    }

    public int rookHomeCol() {
        return rookHomeCol;
    }

    public int kingTargetCol() {
        return kingTargetCol;
    }

    public int rookTargetCol() {
        return rookTargetCol;
    }

    public String notation() {
        return notation;
    }

    public Square rookHome(PieceColor color) {
        return Square.of(color.backRankRow(), rookHomeCol);
    }

    public static CastlingSide forRookHome(PieceColor color, Square square) {
        if (square.row() != color.backRankRow()) {
            return null;
        }
        for (CastlingSide side : values()) {
            if (side.rookHomeCol == square.col()) {
                return side;
            }
        }
        return null;
    }
}
