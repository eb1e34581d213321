package org.schachregeln.game;

import org.schachregeln.model.CastlingRights;
import org.schachregeln.model.PieceColor;
import org.schachregeln.model.Square;

import java.util.List;

public record GameSummary(String fen,
                          PieceColor turn,
                          CastlingRights castlingRights,
                          Square enPassantTarget,
                          int halfMoveClock,
                          int fullMoveNumber,
                          boolean check,
                          boolean checkmate,
                          boolean stalemate,
                          boolean draw,
                          PieceColor winner,
                          List<String> moves) {

    public GameSummary {
        moves = List.copyOf(moves);
    }
}
