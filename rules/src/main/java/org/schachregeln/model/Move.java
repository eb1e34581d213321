package org.schachregeln.model;

import java.util.Objects;

/**
 * A requested move. {@code promotion} is only meaningful for a pawn reaching its last rank and may be
 * {@code null}, in which case a queen is placed.
 */
public record Move(Square from, Square to, PieceType promotion) {

    public Move {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (promotion != null && !promotion.isPromotionTarget()) {
            throw new IllegalArgumentException("Cannot promote to " + promotion);
        }
    }

    public static Move of(Square from, Square to) {
        return new Move(from, to, null);
    }

    public static Move of(String from, String to) {
        return new Move(Square.fromAlgebraic(from), Square.fromAlgebraic(to), null);
    }

    public String toCoordinate() {
        String text = from.toAlgebraic() + to.toAlgebraic();
        return promotion == null ? text : text + promotion.letter();
    }

    @Override
    public String toString() {
        return toCoordinate();
    }
}
