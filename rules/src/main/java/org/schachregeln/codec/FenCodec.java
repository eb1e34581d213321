package org.schachregeln.codec;

import org.schachregeln.model.Board;
import org.schachregeln.model.CastlingRights;
import org.schachregeln.model.NotationFormatException;
import org.schachregeln.model.Piece;
import org.schachregeln.model.PieceColor;
import org.schachregeln.model.Position;
import org.schachregeln.model.Square;

/**
 * Converts between FEN records and {@link Position} values.
 * <p>
 * {@link #encode(Position)} is the exact inverse of {@link #decode(String)} for every decoded position.
 *
 * @see <a href="https://en.wikipedia.org/wiki/Forsyth%E2%80%93Edwards_Notation">Forsyth-Edwards Notation</a>
 */
public final class FenCodec {
    private FenCodec() {
    }

    public static Position decode(String fen) {
        if (fen == null) {
            throw new NotationFormatException("FEN record is null");
        }
        String[] fields = fen.trim().split("\\s+");
        if (fields.length != 6) {
            throw new NotationFormatException("FEN record must have 6 fields but has " + fields.length + ": " + fen);
        }

        Board board = decodePiecePlacement(fields[0]);
        PieceColor sideToMove = PieceColor.fromFenLetter(fields[1]);
        CastlingRights castlingRights = decodeCastlingRights(fields[2]);
        Square enPassantTarget = "-".equals(fields[3]) ? null : Square.fromAlgebraic(fields[3]);
        int halfMoveClock = decodeCounter("half-move clock", fields[4], 0);
        int fullMoveNumber = decodeCounter("full-move number", fields[5], 1);

        return new Position(board, sideToMove, castlingRights, enPassantTarget, halfMoveClock, fullMoveNumber);
    }

    public static String encode(Position position) {
        StringBuilder fen = new StringBuilder(90);
        encodePiecePlacement(position.board(), fen);
        fen.append(' ').append(position.sideToMove().fenLetter());
        fen.append(' ').append(position.castlingRights().toFen());
        fen.append(' ').append(position.enPassantTarget() == null ? "-" : position.enPassantTarget().toAlgebraic());
        fen.append(' ').append(position.halfMoveClock());
        fen.append(' ').append(position.fullMoveNumber());
        return fen.toString();
    }

    private static Board decodePiecePlacement(String placement) {
        String[] ranks = placement.split("/", -1);
        if (ranks.length != Board.SIZE) {
            throw new NotationFormatException("Piece placement must have 8 ranks: " + placement);
        }
        Board.Editor editor = Board.empty().edit();
        for (int row = 0; row < Board.SIZE; row++) {
            int col = 0;
            boolean lastWasDigit = false;
            for (char c : ranks[row].toCharArray()) {
                if (c >= '1' && c <= '8') {
                    if (lastWasDigit) {
                        throw new NotationFormatException("Consecutive empty-square digits in rank: " + ranks[row]);
                    }
                    col += c - '0';
                    lastWasDigit = true;
                } else {
                    if (col >= Board.SIZE) {
                        throw new NotationFormatException("Rank has more than 8 files: " + ranks[row]);
                    }
                    editor.put(Square.of(row, col), Piece.fromFenChar(c));
                    col++;
                    lastWasDigit = false;
                }
                if (col > Board.SIZE) {
                    throw new NotationFormatException("Rank has more than 8 files: " + ranks[row]);
                }
            }
            if (col != Board.SIZE) {
                throw new NotationFormatException("Rank does not cover 8 files: " + ranks[row]);
            }
        }
        return editor.build();
    }

    private static void encodePiecePlacement(Board board, StringBuilder fen) {
        for (int row = 0; row < Board.SIZE; row++) {
            if (row > 0) {
                fen.append('/');
            }
            int empty = 0;
            for (int col = 0; col < Board.SIZE; col++) {
                Piece piece = board.pieceAt(row, col);
                if (piece == null) {
                    empty++;
                    continue;
                }
                if (empty > 0) {
                    fen.append(empty);
                    empty = 0;
                }
                fen.append(piece.getFenChar());
            }
            if (empty > 0) {
                fen.append(empty);
            }
        }
    }

    private static CastlingRights decodeCastlingRights(String field) {
        if ("-".equals(field)) {
            return CastlingRights.NONE;
        }
        boolean[] flags = new boolean[4];
        for (char c : field.toCharArray()) {
            int index = "KQkq".indexOf(c);
            if (index < 0) {
                throw new NotationFormatException("Invalid castling rights: " + field);
            }
            if (flags[index]) {
                throw new NotationFormatException("Repeated castling right in: " + field);
            }
            flags[index] = true;
        }
        return new CastlingRights(flags[0], flags[1], flags[2], flags[3]);
    }

    private static int decodeCounter(String name, String field, int minimum) {
        int value;
        try {
            value = Integer.parseInt(field);
        } catch (NumberFormatException e) {
            throw new NotationFormatException("Invalid " + name + ": " + field, e);
        }
        if (value < minimum) {
            throw new NotationFormatException("Invalid " + name + ": " + field);
        }
        return value;
    }
}
