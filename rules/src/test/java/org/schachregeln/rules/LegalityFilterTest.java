package org.schachregeln.rules;

import org.schachregeln.codec.FenCodec;
import org.schachregeln.game.TurnSequencer;
import org.schachregeln.model.AppliedMove;
import org.schachregeln.model.Move;
import org.schachregeln.model.PieceColor;
import org.schachregeln.model.Position;
import org.schachregeln.model.Square;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LegalityFilterTest {

    private static Set<String> legal(String fen, String square) {
        return LegalityFilter.legalMoves(Square.fromAlgebraic(square), FenCodec.decode(fen)).stream()
                .map(Square::toAlgebraic)
                .collect(Collectors.toSet());
    }

    @Test
    void initialPositionHasTwentyMoves() {
        assertEquals(20, LegalityFilter.allLegalMoves(Position.initial()).size());
    }

    @Test
    void opponentPiecesAndEmptySquaresHaveNoMoves() {
        assertTrue(legal(Position.INITIAL_FEN, "e7").isEmpty());
        assertTrue(legal(Position.INITIAL_FEN, "e4").isEmpty());
    }

    @Test
    void pinnedPieceCannotLeaveTheLine() {
        assertTrue(legal("4r1k1/8/8/8/8/8/4B3/4K3 w - - 0 1", "e2").isEmpty());
        assertEquals(Set.of("e3", "e4", "e5", "e6", "e7", "e8"), legal("4r1k1/8/8/8/8/8/4R3/4K3 w - - 0 1", "e2"));
    }

    @Test
    void checkMustBeAnswered() {
        String fen = "4r1k1/8/8/8/8/8/3B4/R3K3 w Q - 0 1";
        assertEquals(Set.of("e3"), legal(fen, "d2"));
        assertTrue(legal(fen, "a1").isEmpty());
        assertEquals(Set.of("d1", "f1", "f2"), legal(fen, "e1"));
    }

    @Test
    void kingCannotStepIntoAttack() {
        assertEquals(Set.of("d1", "f1"), legal("4k3/8/8/8/8/8/r7/4K3 w - - 0 1", "e1"));
    }

    @Test
    void castlingExcludedWhenTransitSquareAttacked() {
        String fen = "r3kr2/8/8/8/8/8/8/R3K2R w KQq - 0 1";
        Set<String> moves = legal(fen, "e1");
        assertFalse(moves.contains("g1"));
        assertTrue(moves.contains("c1"));
    }

    @Test
    void castlingExcludedWhenDestinationAttacked() {
        assertFalse(legal("r3k1r1/8/8/8/8/8/8/R3K2R w KQq - 0 1", "e1").contains("g1"));
        assertFalse(legal("2r1k3/8/8/8/8/8/8/R3K2R w KQ - 0 1", "e1").contains("c1"));
    }

    @Test
    void castlingExcludedWhileInCheck() {
        Set<String> moves = legal("r3k2r/8/8/4r3/8/8/8/R3K2R w KQkq - 0 1", "e1");
        assertFalse(moves.contains("g1"));
        assertFalse(moves.contains("c1"));
    }

    @Test
    void queensideCastlingIgnoresAttackOnRookPassage() {
        assertTrue(legal("1r2k2r/8/8/8/8/8/8/R3K2R w KQk - 0 1", "e1").contains("c1"));
    }

    @Test
    void enPassantThatExposesKingIsIllegal() {
        // capturing on d6 would clear the fifth rank between the rook and the king
        String fen = "4k3/8/8/K2pP2r/8/8/8/8 w - d6 0 2";
        assertEquals(Set.of("e6"), legal(fen, "e5"));
    }

    @Test
    void legalMovesNeverLeaveOwnKingAttacked() {
        Random random = new Random(20241019L);
        for (int game = 0; game < 10; game++) {
            Position position = Position.initial();
            for (int ply = 0; ply < 60; ply++) {
                List<Move> moves = LegalityFilter.allLegalMoves(position);
                if (moves.isEmpty()) {
                    break;
                }
                PieceColor mover = position.sideToMove();
                String fen = FenCodec.encode(position);
                for (Move move : moves) {
                    AppliedMove applied = MoveApplier.apply(position, move);
                    assertFalse(AttackOracle.isKingAttacked(applied.board(), mover),
                            () -> move + " leaves king attacked in " + fen);
                }
                Move chosen = moves.get(random.nextInt(moves.size()));
                position = TurnSequencer.advance(position, MoveApplier.apply(position, chosen));
            }
        }
    }

    @Test
    void inputPositionIsNotModified() {
        Position position = FenCodec.decode("r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1");
        String before = FenCodec.encode(position);
        LegalityFilter.allLegalMoves(position);
        assertEquals(before, FenCodec.encode(position));
    }

    @Test
    void isLegalMatchesMoveList() {
        assertTrue(LegalityFilter.isLegal(Position.initial(), Move.of("e2", "e4")));
        assertFalse(LegalityFilter.isLegal(Position.initial(), Move.of("e2", "e5")));
    }
}
