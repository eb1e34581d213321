package org.schachregeln.console;

import org.schachregeln.codec.CoordinateMoveParser;
import org.schachregeln.codec.FenCodec;
import org.schachregeln.game.ChessGame;
import org.schachregeln.game.PlayedMove;
import org.schachregeln.model.Move;
import org.schachregeln.model.NotationFormatException;
import org.schachregeln.model.PieceColor;
import org.schachregeln.model.Position;
import org.schachregeln.model.Square;
import org.schachregeln.opponent.OpponentController;
import org.schachregeln.settings.AppSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

public class ConsoleGame {
    private static final Logger logger = LoggerFactory.getLogger(ConsoleGame.class);

    private static final String HELP = String.join("\n",
            "Commands:",
            "  e2e4, e7e8q      play a move in coordinate notation",
            "  moves <square>   list legal destinations of a piece",
            "  board            show the board",
            "  fen              print the current position as FEN",
            "  load <fen>       start from the given position",
            "  undo / redo      step through the game",
            "  history          show the numbered move list",
            "  new              start a new game",
            "  quit             leave");

    private final AppSettings settings;
    private final ChessGame game;
    private final OpponentController opponent;
    private final BoardRenderer renderer;
    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleGame(AppSettings settings, OpponentController opponent, BufferedReader in, PrintStream out) {
        this.settings = settings;
        this.opponent = opponent;
        this.in = in;
        this.out = out;
        this.game = new ChessGame(startFen());
        this.renderer = new BoardRenderer(settings.getDisplay());
        opponent.applySettings(settings.getOpponent());
    }

    public ChessGame getGame() {
        return game;
    }

    public void run() throws IOException {
        logger.info("Starting console game");
        out.println(renderer.render(game.getPosition().board()));
        printStatus();
        maybePlayOpponent();

        String line;
        while ((line = in.readLine()) != null) {
            String command = line.trim();
            if (command.isEmpty()) {
                continue;
            }
            if (!handle(command)) {
                break;
            }
        }
        logger.info("Console game finished");
    }

    boolean handle(String command) {
        String[] parts = command.split("\\s+", 2);
        String argument = parts.length > 1 ? parts[1].trim() : "";
        try {
            switch (parts[0].toLowerCase(Locale.ROOT)) {
                case "quit", "exit" -> {
                    return false;
                }
                case "help" -> out.println(HELP);
                case "board" -> out.println(renderer.render(game.getPosition().board()));
                case "fen" -> out.println(game.getFen());
                case "moves" -> printLegalMoves(argument);
                case "history" -> game.getMoveLog().forEach(out::println);
                case "undo" -> stepBack();
                case "redo" -> stepForward();
                case "new" -> {
                    game.loadFen(startFen());
                    out.println(renderer.render(game.getPosition().board()));
                    printStatus();
                    maybePlayOpponent();
                }
                case "load" -> {
                    game.loadFen(argument);
                    out.println(renderer.render(game.getPosition().board()));
                    printStatus();
                    maybePlayOpponent();
                }
                default -> playHumanMove(parts[0]);
            }
        } catch (NotationFormatException e) {
            logger.warn("Rejected input '{}': {}", command, e.getMessage());
            out.println("Error: " + e.getMessage());
        }
        return true;
    }

    private void playHumanMove(String text) {
        Move move = CoordinateMoveParser.parse(text);
        if (opponent.isOpponentToMove(game.getPosition())) {
            out.println("It is the opponent's turn.");
            return;
        }
        if (move.promotion() == null && !settings.getGame().isAutoQueen()
                && game.isPromotion(move.from(), move.to()) && game.isValidMove(move.from(), move.to())) {
            out.println("Promotion piece required: append q, r, b or n.");
            return;
        }
        if (!game.makeMove(move)) {
            out.println("Illegal move: " + text);
            return;
        }
        afterMove(game.getLastMove(), "");
        maybePlayOpponent();
    }

    private void maybePlayOpponent() {
        while (opponent.isOpponentToMove(game.getPosition()) && !game.getStatus().isTerminal()) {
            Move move;
            try {
                move = opponent.chooseMove(game.getPosition()).join();
            } catch (CompletionException e) {
                logger.error("Opponent move failed", e.getCause());
                out.println("Opponent failed to move: " + e.getCause().getMessage());
                return;
            }
            if (!game.makeMove(move)) {
                logger.error("Failed to apply opponent move: {}", move);
                out.println("Opponent produced an illegal move: " + move);
                return;
            }
            afterMove(game.getLastMove(), "Opponent plays ");
        }
    }

    private void afterMove(PlayedMove played, String prefix) {
        out.println(prefix + played.notation());
        out.println(renderer.render(game.getPosition().board()));
        printStatus();
    }

    private void stepBack() {
        if (!game.undo()) {
            out.println("Nothing to undo.");
            return;
        }
        // take back the opponent's reply together with the player's move
        if (opponent.isOpponentToMove(game.getPosition())) {
            game.undo();
        }
        out.println(renderer.render(game.getPosition().board()));
        printStatus();
        // the opponent may still be to move at the start of the game
        maybePlayOpponent();
    }

    private void stepForward() {
        if (!game.redo()) {
            out.println("Nothing to redo.");
            return;
        }
        if (opponent.isOpponentToMove(game.getPosition()) && game.canRedo()) {
            game.redo();
        }
        out.println(renderer.render(game.getPosition().board()));
        printStatus();
        maybePlayOpponent();
    }

    private String startFen() {
        String fen = settings.getGame().getStartFen();
        try {
            FenCodec.decode(fen);
            return fen;
        } catch (NotationFormatException e) {
            logger.warn("Configured start position is invalid, using the standard one: {}", e.getMessage());
            return Position.INITIAL_FEN;
        }
    }

    private void printLegalMoves(String squareText) {
        Square square = Square.fromAlgebraic(squareText);
        List<Square> targets = game.getLegalMovesFrom(square);
        if (targets.isEmpty()) {
            out.println("No legal moves from " + square);
            return;
        }
        out.println(square + ": " + targets.stream().map(Square::toAlgebraic).collect(Collectors.joining(" ")));
    }

    private void printStatus() {
        if (game.isCheckmate()) {
            PieceColor winner = game.getWinner();
            out.println("Checkmate - " + winner + " wins.");
        } else if (game.isStalemate()) {
            out.println("Stalemate - game drawn.");
        } else if (game.isInCheck()) {
            out.println(game.getCurrentTurn() + " to move (in check).");
        } else {
            out.println(game.getCurrentTurn() + " to move.");
        }
    }
}
