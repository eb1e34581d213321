package org.schachregeln.console;

import org.schachregeln.model.Board;
import org.schachregeln.model.Position;
import org.schachregeln.settings.DisplaySettings;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BoardRendererTest {

    private static DisplaySettings display(boolean unicode, boolean coordinates) {
        DisplaySettings settings = new DisplaySettings();
        settings.setUnicodePieces(unicode);
        settings.setShowCoordinates(coordinates);
        return settings;
    }

    @Test
    void rendersInitialPositionWithCoordinates() {
        String[] lines = new BoardRenderer(display(false, true)).render(Position.initial().board()).split("\n");

        assertEquals(10, lines.length);
        assertEquals("  a b c d e f g h", lines[0]);
        assertEquals("8 r n b q k b n r 8", lines[1]);
        assertEquals("5 : . : . : . : . 5", lines[4]);
        assertEquals("4 . : . : . : . : 4", lines[5]);
        assertEquals("1 R N B Q K B N R 1", lines[8]);
        assertEquals(lines[0], lines[9]);
    }

    @Test
    void plainBoardHasOnlyEightRanks() {
        String[] lines = new BoardRenderer(display(false, false)).render(Board.empty()).split("\n");

        assertEquals(8, lines.length);
        assertEquals(". : . : . : . :", lines[0]);
        assertEquals(": . : . : . : .", lines[7]);
    }

    @Test
    void unicodeGlyphsForPieces() {
        String rendered = new BoardRenderer(display(true, false)).render(Position.initial().board());

        assertTrue(rendered.startsWith("♜ ♞ ♝ ♛ ♚ ♝ ♞ ♜"));
        assertTrue(rendered.contains("♖ ♘ ♗ ♕ ♔ ♗ ♘ ♖"));
    }
}
