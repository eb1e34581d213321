package org.schachregeln.game;

import org.schachregeln.model.PieceColor;

import java.util.ArrayList;
import java.util.List;

/**
 * Numbers a list of move notations the way a score sheet does: {@code 1. e4 e5}, {@code 2. Nf3 Nc6}.
 */
public final class MoveLog {
    private MoveLog() {
    }

    public static List<String> format(List<String> notations, PieceColor firstMover, int firstMoveNumber) {
        List<String> lines = new ArrayList<>();
        int moveNumber = firstMoveNumber;
        int index = 0;

        if (firstMover == PieceColor.BLACK && !notations.isEmpty()) {
            lines.add(String.format("%d. ... %s", moveNumber, notations.get(0)));
            moveNumber++;
            index = 1;
        }
        for (; index < notations.size(); index += 2) {
            if (index + 1 < notations.size()) {
                lines.add(String.format("%d. %s %s", moveNumber, notations.get(index), notations.get(index + 1)));
            } else {
                lines.add(String.format("%d. %s", moveNumber, notations.get(index)));
            }
            moveNumber++;
        }
        return lines;
    }
}
