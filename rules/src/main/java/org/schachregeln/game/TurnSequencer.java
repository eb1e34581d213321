package org.schachregeln.game;

import org.schachregeln.model.AppliedMove;
import org.schachregeln.model.PieceColor;
import org.schachregeln.model.Position;

public final class TurnSequencer {
    private TurnSequencer() {
    }

    public static Position advance(Position before, AppliedMove applied) {
        int halfMoveClock = applied.isPawnMove() || applied.isCapture() ? 0 : before.halfMoveClock() + 1;
        int fullMoveNumber = before.sideToMove() == PieceColor.BLACK
                ? before.fullMoveNumber() + 1
                : before.fullMoveNumber();
        return new Position(applied.board(),
                before.sideToMove().opposite(),
                applied.castlingRights(),
                applied.enPassantTarget(),
                halfMoveClock,
                fullMoveNumber);
    }
}
