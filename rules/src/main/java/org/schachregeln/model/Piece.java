package org.schachregeln.model;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

public final class Piece {
    private static final Map<PieceColor, Map<PieceType, Piece>> CACHE = new EnumMap<>(PieceColor.class);

    static {
        for (PieceColor color : PieceColor.values()) {
            Map<PieceType, Piece> byType = new EnumMap<>(PieceType.class);
            for (PieceType type : PieceType.values()) {
                byType.put(type, new Piece(type, color));
            }
            CACHE.put(color, byType);
        }
    }

    private final PieceType type;
    private final PieceColor color;

    private Piece(PieceType type, PieceColor color) {
        this.type = type;
        this.color = color;
    }

    public static Piece of(PieceType type, PieceColor color) {
        return CACHE.get(Objects.requireNonNull(color, "color")).get(Objects.requireNonNull(type, "type"));
    }

    public static Piece fromFenChar(char c) {
        PieceType type = PieceType.fromLetter(c);
        return of(type, Character.isUpperCase(c) ? PieceColor.WHITE : PieceColor.BLACK);
    }

    public PieceType getType() {
        return type;
    }

    public PieceColor getColor() {
        return color;
    }

    public boolean is(PieceType type, PieceColor color) {
        return this.type == type && this.color == color;
    }

    public char getFenChar() {
        return color == PieceColor.WHITE ? Character.toUpperCase(type.letter()) : type.letter();
    }

    public String getSymbol() {
        return switch (type) {
            case KING -> color == PieceColor.WHITE ? "♔" : "♚";
            case QUEEN -> color == PieceColor.WHITE ? "♕" : "♛";
            case ROOK -> color == PieceColor.WHITE ? "♖" : "♜";
            case BISHOP -> color == PieceColor.WHITE ? "♗" : "♝";
            case KNIGHT -> color == PieceColor.WHITE ? "♘" : "♞";
            case PAWN -> color == PieceColor.WHITE ? "♙" : "♟";
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Piece other)) return false;
        return type == other.type && color == other.color;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, color);
    }

    @Override
    public String toString() {
        return color + " " + type;
    }
}
