package org.schachregeln.model;

public enum PieceColor {
    WHITE('w', -1, 7),
    BLACK('b', 1, 0);

    private final char fenLetter;
    private final int forward;
    private final int backRankRow;

    PieceColor(char fenLetter, int forward, int backRankRow) {
        this.fenLetter = fenLetter;
        this.forward = forward;
        this.backRankRow = backRankRow;
    }

    public char fenLetter() {
        return fenLetter;
    }

    public int forward() {
        return forward;
    }

    public int backRankRow() {
        return backRankRow;
    }

    public int pawnHomeRow() {
        return backRankRow + forward;
    }

    public int promotionRow() {
        return 7 - backRankRow;
    }

    public PieceColor opposite() {
        return this == WHITE ? BLACK : WHITE;
    }

    public static PieceColor fromFenLetter(String text) {
        return switch (text) {
            case "w" -> WHITE;
            case "b" -> BLACK;
            default -> throw new NotationFormatException("Invalid side to move: " + text);
        };
    }
}
