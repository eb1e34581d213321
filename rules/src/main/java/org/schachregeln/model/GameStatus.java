package org.schachregeln.model;

public enum GameStatus {
    ONGOING,
    CHECKMATE,
    STALEMATE;

    public boolean isTerminal() {
        return this != ONGOING;
    }
}
