package org.schachregeln.game;

import org.schachregeln.codec.FenCodec;
import org.schachregeln.model.Move;
import org.schachregeln.model.Piece;
import org.schachregeln.model.Position;

public record PlayedMove(Move move, Piece piece, Piece capturedPiece, String notation,
                         Position before, Position after) {

    public String fenAfter() {
        return FenCodec.encode(after);
    }

    @Override
    public String toString() {
        if (capturedPiece != null) {
            return move.from() + " x " + move.to() + " (" + notation + ")";
        }
        return move.from() + " -> " + move.to() + " (" + notation + ")";
    }
}
