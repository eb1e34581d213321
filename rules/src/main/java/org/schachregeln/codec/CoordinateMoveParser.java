package org.schachregeln.codec;

import org.schachregeln.model.Move;
import org.schachregeln.model.NotationFormatException;
import org.schachregeln.model.PieceType;
import org.schachregeln.model.Square;

public final class CoordinateMoveParser {
    private CoordinateMoveParser() {
    }

    public static Move parse(String text) {
        if (text == null) {
            throw new NotationFormatException("Move text is null");
        }
        String trimmed = text.trim();
        if (trimmed.length() != 4 && trimmed.length() != 5) {
            throw new NotationFormatException("Invalid coordinate move: " + text);
        }
        Square from = Square.fromAlgebraic(trimmed.substring(0, 2));
        Square to = Square.fromAlgebraic(trimmed.substring(2, 4));
        PieceType promotion = null;
        if (trimmed.length() == 5) {
            promotion = PieceType.fromLetter(trimmed.charAt(4));
            if (!promotion.isPromotionTarget()) {
                throw new NotationFormatException("Invalid promotion piece in move: " + text);
            }
        }
        return new Move(from, to, promotion);
    }
}
