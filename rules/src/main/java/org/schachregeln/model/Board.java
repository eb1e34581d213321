package org.schachregeln.model;

import java.util.Arrays;

public final class Board {
    public static final int SIZE = 8;

    private final Piece[][] squares;

    private Board(Piece[][] squares) {
        this.squares = squares;
    }

    public static Board empty() {
        return new Board(new Piece[SIZE][SIZE]);
    }

    public Piece pieceAt(Square square) {
        return squares[square.row()][square.col()];
    }

    public Piece pieceAt(int row, int col) {
        return squares[row][col];
    }

    public boolean isEmpty(Square square) {
        return pieceAt(square) == null;
    }

    public Square findKing(PieceColor color) {
        for (int row = 0; row < SIZE; row++) {
            for (int col = 0; col < SIZE; col++) {
                Piece piece = squares[row][col];
                if (piece != null && piece.is(PieceType.KING, color)) {
                    return Square.of(row, col);
                }
            }
        }
        return null;
    }

    public Editor edit() {
        return new Editor(copy(squares));
    }

    private static Piece[][] copy(Piece[][] squares) {
        Piece[][] copy = new Piece[SIZE][];
        for (int row = 0; row < SIZE; row++) {
            copy[row] = Arrays.copyOf(squares[row], SIZE);
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Board other)) return false;
        return Arrays.deepEquals(squares, other.squares);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(squares);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int row = 0; row < SIZE; row++) {
            for (int col = 0; col < SIZE; col++) {
                Piece piece = squares[row][col];
                sb.append(piece == null ? '.' : piece.getFenChar());
            }
            if (row < SIZE - 1) {
                sb.append('/');
            }
        }
        return sb.toString();
    }

    public static final class Editor {
        private final Piece[][] squares;

        private Editor(Piece[][] squares) {
            this.squares = squares;
        }

        public Piece get(Square square) {
            return squares[square.row()][square.col()];
        }

        public Editor put(Square square, Piece piece) {
            squares[square.row()][square.col()] = piece;
            return this;
        }

        public Editor clear(Square square) {
            return put(square, null);
        }

        public Editor relocate(Square from, Square to) {
            Piece piece = get(from);
            clear(from);
            return put(to, piece);
        }

        public Board build() {
            return new Board(copy(squares));
        }
    }
}
