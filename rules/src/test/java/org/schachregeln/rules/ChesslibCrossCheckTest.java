package org.schachregeln.rules;

import com.github.bhlangonijr.chesslib.Board;
import com.github.bhlangonijr.chesslib.Piece;
import com.github.bhlangonijr.chesslib.PieceType;
import org.schachregeln.codec.FenCodec;
import org.schachregeln.game.TurnSequencer;
import org.schachregeln.model.Move;
import org.schachregeln.model.Position;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Walks the game tree of well-known positions with both this engine and chesslib and compares, at every
 * node, the set of legal (from, to) pairs and the piece placement reached after each move.
 */
class ChesslibCrossCheckTest {

    @ParameterizedTest(name = "{0} depth {1}")
    @CsvSource(delimiter = ';', value = {
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1;3",
            "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q2/PPPBBPPP/R3K2R w KQkq - 0 1;2",
            "8/2p5/3p4/KP5r/1R3p1k/8/4P1P1/8 w - - 0 1;3",
            "r3k2r/Pppp1ppp/1b3nbN/nP6/BBP1P3/q4N2/Pp1P2PP/R2Q1RK1 w kq - 0 1;2",
            "rnbq1k1r/pp1Pbppp/2p5/8/2B5/8/PPP1NnPP/RNBQK2R w KQ - 1 8;2"
    })
    void legalMovesAgreeWithChesslib(String fen, int depth) {
        Board oracle = new Board();
        oracle.loadFromFen(fen);
        walk(FenCodec.decode(fen), oracle, depth);
    }

    private static void walk(Position position, Board oracle, int depth) {
        assertEquals(placementAndTurn(oracle.getFen()), placementAndTurn(FenCodec.encode(position)));
        assertEquals(oracleMoves(oracle), engineMoves(position), () -> "Legal moves differ at " + oracle.getFen());
        if (depth == 0) {
            return;
        }

        for (com.github.bhlangonijr.chesslib.move.Move oracleMove : oracle.legalMoves()) {
            Piece promotion = oracleMove.getPromotion();
            if (promotion != Piece.NONE && promotion.getPieceType() != PieceType.QUEEN) {
                continue;
            }
            Move move = Move.of(squareName(oracleMove.getFrom()), squareName(oracleMove.getTo()));
            Position next = TurnSequencer.advance(position, MoveApplier.apply(position, move));

            oracle.doMove(oracleMove);
            walk(next, oracle, depth - 1);
            oracle.undoMove();
        }
    }

    private static Set<String> engineMoves(Position position) {
        Set<String> moves = new TreeSet<>();
        for (Move move : LegalityFilter.allLegalMoves(position)) {
            moves.add(move.from().toAlgebraic() + move.to().toAlgebraic());
        }
        return moves;
    }

    private static Set<String> oracleMoves(Board oracle) {
        Set<String> moves = new TreeSet<>();
        for (com.github.bhlangonijr.chesslib.move.Move move : oracle.legalMoves()) {
            moves.add(squareName(move.getFrom()) + squareName(move.getTo()));
        }
        return moves;
    }

    private static String squareName(com.github.bhlangonijr.chesslib.Square square) {
        return square.name().toLowerCase(Locale.ROOT);
    }

    private static String placementAndTurn(String fen) {
        String[] fields = fen.trim().split("\\s+");
        return fields[0] + " " + fields[1];
    }
}
