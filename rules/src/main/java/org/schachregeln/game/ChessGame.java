package org.schachregeln.game;

import org.schachregeln.codec.CoordinateMoveParser;
import org.schachregeln.codec.FenCodec;
import org.schachregeln.model.AppliedMove;
import org.schachregeln.model.GameStatus;
import org.schachregeln.model.Move;
import org.schachregeln.model.Piece;
import org.schachregeln.model.PieceColor;
import org.schachregeln.model.PieceType;
import org.schachregeln.model.Position;
import org.schachregeln.model.Square;
import org.schachregeln.notation.NotationFormatter;
import org.schachregeln.rules.GameStatusEvaluator;
import org.schachregeln.rules.LegalityFilter;
import org.schachregeln.rules.MoveApplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * A single game: the current position plus the history that led to it. Not thread safe.
 */
public class ChessGame {
    private static final Logger logger = LoggerFactory.getLogger(ChessGame.class);

    private Position startPosition;
    private Position position;
    private GameStatus status;
    private final List<PlayedMove> moveHistory;
    private final Deque<PlayedMove> redoStack;

    public ChessGame() {
        this(Position.initial());
    }

    public ChessGame(String fen) {
        this(FenCodec.decode(fen));
    }

    public ChessGame(Position position) {
        logger.debug("Initializing game from {}", FenCodec.encode(position));
        moveHistory = new ArrayList<>();
        redoStack = new ArrayDeque<>();
        start(position);
    }

    public Position getPosition() {
        return position;
    }

    public Piece getPiece(Square square) {
        return position.pieceAt(square);
    }

    public PieceColor getCurrentTurn() {
        return position.sideToMove();
    }

    public List<Square> getLegalMovesFrom(Square from) {
        return LegalityFilter.legalMoves(from, position);
    }

    public List<Move> getAllLegalMoves() {
        return LegalityFilter.allLegalMoves(position);
    }

    public boolean isValidMove(Square from, Square to) {
        return getLegalMovesFrom(from).contains(to);
    }

    public boolean isPromotion(Square from, Square to) {
        Piece piece = getPiece(from);
        return piece != null
                && piece.getType() == PieceType.PAWN
                && to.row() == piece.getColor().promotionRow();
    }

    public boolean makeMove(Square from, Square to) {
        return makeMove(new Move(from, to, null));
    }

    public boolean makeMove(Square from, Square to, PieceType promotion) {
        return makeMove(new Move(from, to, promotion));
    }

    public boolean makeMove(String coordinateMove) {
        return makeMove(CoordinateMoveParser.parse(coordinateMove));
    }

    public boolean makeMove(Move move) {
        if (status.isTerminal()) {
            logger.debug("Ignoring move {}, game is over ({})", move, status);
            return false;
        }
        if (!isValidMove(move.from(), move.to())) {
            logger.debug("Rejected illegal move {} in {}", move, getFen());
            return false;
        }

        Position before = position;
        AppliedMove applied = MoveApplier.apply(before, move);
        Position after = TurnSequencer.advance(before, applied);
        String notation = NotationFormatter.format(applied, after);

        if (applied.isCapture()) {
            logger.debug("Piece captured: {}", applied.capturedPiece());
        }
        moveHistory.add(new PlayedMove(move, applied.movedPiece(), applied.capturedPiece(), notation, before, after));
        redoStack.clear();
        setPosition(after);
        logger.debug("Move made: {} ({}), total moves: {}", move, notation, moveHistory.size());
        return true;
    }

    public boolean undo() {
        if (moveHistory.isEmpty()) {
            return false;
        }
        PlayedMove last = moveHistory.remove(moveHistory.size() - 1);
        redoStack.push(last);
        setPosition(last.before());
        logger.debug("Undid {}", last.notation());
        return true;
    }

    public boolean redo() {
        if (redoStack.isEmpty()) {
            return false;
        }
        PlayedMove next = redoStack.pop();
        moveHistory.add(next);
        setPosition(next.after());
        logger.debug("Redid {}", next.notation());
        return true;
    }

    public boolean canUndo() {
        return !moveHistory.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public void reset() {
        logger.info("Resetting board to initial position");
        start(Position.initial());
    }

    public void loadFen(String fen) {
        Position loaded = FenCodec.decode(fen);
        logger.info("Loading position {}", fen);
        start(loaded);
    }

    public boolean isInCheck() {
        return GameStatusEvaluator.isInCheck(position);
    }

    public GameStatus getStatus() {
        return status;
    }

    public boolean isCheckmate() {
        return status == GameStatus.CHECKMATE;
    }

    public boolean isStalemate() {
        return status == GameStatus.STALEMATE;
    }

    /**
     * Only stalemate counts as a draw; repetition and the fifty-move rule are not tracked.
     */
    public boolean isDraw() {
        return isStalemate();
    }

    public PieceColor getWinner() {
        return isCheckmate() ? position.sideToMove().opposite() : null;
    }

    public String getFen() {
        return FenCodec.encode(position);
    }

    public List<PlayedMove> getMoveHistory() {
        return new ArrayList<>(moveHistory);
    }

    public List<String> getNotations() {
        List<String> notations = new ArrayList<>(moveHistory.size());
        for (PlayedMove played : moveHistory) {
            notations.add(played.notation());
        }
        return notations;
    }

    public List<String> getMoveLog() {
        return MoveLog.format(getNotations(), startPosition.sideToMove(), startPosition.fullMoveNumber());
    }

    public PlayedMove getLastMove() {
        return moveHistory.isEmpty() ? null : moveHistory.get(moveHistory.size() - 1);
    }

    public List<Piece> getCapturedPieces(PieceColor color) {
        List<Piece> captured = new ArrayList<>();
        for (PlayedMove played : moveHistory) {
            Piece piece = played.capturedPiece();
            if (piece != null && piece.getColor() == color) {
                captured.add(piece);
            }
        }
        return captured;
    }

    public GameSummary summary() {
        return new GameSummary(
                getFen(),
                position.sideToMove(),
                position.castlingRights(),
                position.enPassantTarget(),
                position.halfMoveClock(),
                position.fullMoveNumber(),
                isInCheck(),
                isCheckmate(),
                isStalemate(),
                isDraw(),
                getWinner(),
                getNotations());
    }

    private void start(Position start) {
        startPosition = start;
        moveHistory.clear();
        redoStack.clear();
        setPosition(start);
    }

    private void setPosition(Position next) {
        position = next;
        status = GameStatusEvaluator.status(next);
        if (status.isTerminal()) {
            logger.info("Game over: {} with {} to move", status, next.sideToMove());
        }
    }
}
