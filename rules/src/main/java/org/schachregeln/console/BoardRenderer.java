package org.schachregeln.console;

import org.schachregeln.model.Board;
import org.schachregeln.model.Piece;
import org.schachregeln.settings.DisplaySettings;

public class BoardRenderer {
    private final DisplaySettings settings;

    public BoardRenderer(DisplaySettings settings) {
        this.settings = settings;
    }

    public String render(Board board) {
        StringBuilder sb = new StringBuilder();
        if (settings.isShowCoordinates()) {
            appendFileLabels(sb);
        }
        for (int row = 0; row < Board.SIZE; row++) {
            if (settings.isShowCoordinates()) {
                sb.append(8 - row).append(' ');
            }
            for (int col = 0; col < Board.SIZE; col++) {
                Piece piece = board.pieceAt(row, col);
                sb.append(piece == null ? emptySquare(row, col) : glyph(piece));
                if (col < Board.SIZE - 1) {
                    sb.append(' ');
                }
            }
            if (settings.isShowCoordinates()) {
                sb.append(' ').append(8 - row);
            }
            sb.append('\n');
        }
        if (settings.isShowCoordinates()) {
            appendFileLabels(sb);
        }
        return sb.toString();
    }

    private String glyph(Piece piece) {
        return settings.isUnicodePieces() ? piece.getSymbol() : String.valueOf(piece.getFenChar());
    }

    private static String emptySquare(int row, int col) {
        boolean isLight = (row + col) % 2 == 0;
        return isLight ? "." : ":";
    }

    private static void appendFileLabels(StringBuilder sb) {
        sb.append("  ");
        for (int col = 0; col < Board.SIZE; col++) {
            sb.append((char) ('a' + col));
            if (col < Board.SIZE - 1) {
                sb.append(' ');
            }
        }
        sb.append('\n');
    }
}
