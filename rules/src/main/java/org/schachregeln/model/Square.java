package org.schachregeln.model;

public record Square(int row, int col) {

    public Square {
        if (!isOnBoard(row, col)) {
            throw new IllegalArgumentException("Square out of board: row=" + row + ", col=" + col);
        }
    }

    public static Square of(int row, int col) {
        return new Square(row, col);
    }

    public static boolean isOnBoard(int row, int col) {
        return row >= 0 && row < 8 && col >= 0 && col < 8;
    }

    public static Square fromAlgebraic(String text) {
        if (text == null || text.length() != 2) {
            throw new NotationFormatException("Invalid square: " + text);
        }
        char file = text.charAt(0);
        char rank = text.charAt(1);
        if (file < 'a' || file > 'h' || rank < '1' || rank > '8') {
            throw new NotationFormatException("Invalid square: " + text);
        }
        return new Square(8 - (rank - '0'), file - 'a');
    }

    public Square offset(int dRow, int dCol) {
        int r = row + dRow;
        int c = col + dCol;
        return isOnBoard(r, c) ? new Square(r, c) : null;
    }

    public char file() {
        return (char) ('a' + col);
    }

    public int rank() {
        return 8 - row;
    }

    public String toAlgebraic() {
        return "" + file() + rank();
    }

    @Override
    public String toString() {
        return toAlgebraic();
    }
}
