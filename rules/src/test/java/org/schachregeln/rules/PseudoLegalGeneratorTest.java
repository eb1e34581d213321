package org.schachregeln.rules;

import org.schachregeln.codec.FenCodec;
import org.schachregeln.model.Position;
import org.schachregeln.model.Square;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PseudoLegalGeneratorTest {

    private static Set<String> destinations(String fen, String square) {
        List<Square> squares = PseudoLegalGenerator.destinations(FenCodec.decode(fen), Square.fromAlgebraic(square));
        return squares.stream().map(Square::toAlgebraic).collect(Collectors.toSet());
    }

    @Test
    void pawnAdvancesOneOrTwoFromHomeRank() {
        assertEquals(Set.of("e3", "e4"), destinations(Position.INITIAL_FEN, "e2"));
        assertEquals(Set.of("d6", "d5"), destinations(Position.INITIAL_FEN, "d7"));
    }

    @Test
    void pawnDoublePushNeedsBothSquaresEmpty() {
        assertEquals(Set.of("e3"), destinations("4k3/8/8/8/4n3/8/4P3/4K3 w - - 0 1", "e2"));
        assertEquals(Set.of(), destinations("4k3/8/8/8/8/4n3/4P3/4K3 w - - 0 1", "e2"));
    }

    @Test
    void pawnCapturesDiagonallyAndEnPassant() {
        assertEquals(Set.of("e5", "d5"), destinations("4k3/8/8/3p4/4P3/8/8/4K3 w - - 0 1", "e4"));
        assertEquals(Set.of("e6", "d6"),
                destinations("rnbqkbnr/ppp1pppp/8/3pP3/8/8/PPPP1PPP/RNBQKBNR w KQkq d6 0 3", "e5"));
    }

    @Test
    void knightSkipsOwnPieces() {
        assertEquals(Set.of("f3", "h3"), destinations(Position.INITIAL_FEN, "g1"));
    }

    @Test
    void slidersStopAtBlockersAndIncludeCaptures() {
        Set<String> rook = destinations("4k3/8/8/8/1p1R2P1/8/8/4K3 w - - 0 1", "d4");
        assertEquals(Set.of("c4", "b4", "e4", "f4",
                "d5", "d6", "d7", "d8", "d3", "d2", "d1"), rook);

        assertEquals(Set.of(), destinations(Position.INITIAL_FEN, "c1"));
        assertEquals(Set.of(), destinations(Position.INITIAL_FEN, "d1"));
    }

    @Test
    void kingOffersCastlingWhenRightsAndPathAllow() {
        String fen = "r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1";
        assertEquals(Set.of("d1", "d2", "e2", "f2", "f1", "g1", "c1"), destinations(fen, "e1"));
        assertEquals(Set.of("d8", "d7", "e7", "f7", "f8", "g8", "c8"),
                destinations(fen.replace(" w ", " b "), "e8"));
    }

    @Test
    void noCastlingWithoutRightsOrWithBlockedPath() {
        assertFalse(destinations("r3k2r/8/8/8/8/8/8/R3K2R w Qkq - 0 1", "e1").contains("g1"));
        assertFalse(destinations("r3k2r/8/8/8/8/8/8/RN2K2R w KQkq - 0 1", "e1").contains("c1"));
        assertFalse(destinations("r3k2r/8/8/8/8/8/8/R3K1NR w KQkq - 0 1", "e1").contains("g1"));
    }

    @Test
    void noCastlingWhenRookIsMissing() {
        assertFalse(destinations("4k3/8/8/8/8/8/8/4K3 w KQ - 0 1", "e1").contains("g1"));
        assertFalse(destinations("4k3/8/8/8/8/8/8/4K3 w KQ - 0 1", "e1").contains("c1"));
    }

    @Test
    void emptySquareHasNoCandidates() {
        assertTrue(destinations(Position.INITIAL_FEN, "e4").isEmpty());
    }
}
