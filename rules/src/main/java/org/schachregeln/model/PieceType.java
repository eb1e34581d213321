package org.schachregeln.model;

public enum PieceType {
    PAWN('p'),
    KNIGHT('n'),
    BISHOP('b'),
    ROOK('r'),
    QUEEN('q'),
    KING('k');

    private final char letter;

    PieceType(char letter) {
        this.letter = letter;
    }

    public char letter() {
        return letter;
    }

    public String notationLetter() {
        return this == PAWN ? "" : String.valueOf(Character.toUpperCase(letter));
    }

    public boolean isPromotionTarget() {
        return this == KNIGHT || this == BISHOP || this == ROOK || this == QUEEN;
    }

    public static PieceType fromLetter(char letter) {
        return switch (Character.toLowerCase(letter)) {
            case 'p' -> PAWN;
            case 'n' -> KNIGHT;
            case 'b' -> BISHOP;
            case 'r' -> ROOK;
            case 'q' -> QUEEN;
            case 'k' -> KING;
            default -> throw new NotationFormatException("Unknown piece letter: " + letter);
        };
    }
}
