package org.schachregeln.opponent;

import org.schachregeln.codec.FenCodec;
import org.schachregeln.model.Move;
import org.schachregeln.model.PieceColor;
import org.schachregeln.model.Position;
import org.schachregeln.rules.LegalityFilter;
import org.schachregeln.settings.OpponentSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import java.util.random.RandomGenerator;

/**
 * Runs the computer opponent: enumerates the legal moves of a position and lets {@link RandomMovePolicy}
 * pick one, off the caller's thread.
 */
public class OpponentController {
    private static final Logger logger = LoggerFactory.getLogger(OpponentController.class);

    private final ExecutorService executor;
    private final Function<Long, RandomGenerator> randomFactory;
    private OpponentSettings settings;
    private RandomGenerator random;

    public OpponentController() {
        this(seed -> seed == null ? new Random() : new Random(seed));
    }

    public OpponentController(Function<Long, RandomGenerator> randomFactory) {
        this.randomFactory = randomFactory;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "opponent-move-thread");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void applySettings(OpponentSettings newSettings) {
        logger.debug("Applying opponent settings");
        if (newSettings == null || !newSettings.isEnabled()) {
            logger.info("Opponent disabled by settings");
            settings = newSettings == null ? null : newSettings.copy();
            random = null;
            return;
        }
        settings = newSettings.copy();
        random = randomFactory.apply(settings.getSeed());
        logger.info("Opponent enabled, plays as {}{}", settings.getPlayAs(),
                settings.getSeed() == null ? "" : " (seed " + settings.getSeed() + ")");
    }

    public synchronized boolean isReady() {
        return settings != null && settings.isEnabled() && random != null;
    }

    public synchronized PieceColor getOpponentSide() {
        if (settings == null || !settings.isEnabled()) {
            return null;
        }
        String value = settings.getPlayAs();
        if (value == null) {
            return null;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "white" -> PieceColor.WHITE;
            case "black" -> PieceColor.BLACK;
            default -> null;
        };
    }

    public boolean playsAsOpponent() {
        return getOpponentSide() != null && isReady();
    }

    public boolean isOpponentToMove(Position position) {
        return playsAsOpponent() && position.sideToMove() == getOpponentSide();
    }

    public CompletableFuture<Move> chooseMove(Position position) {
        CompletableFuture<Move> future = new CompletableFuture<>();
        if (!isReady()) {
            logger.warn("Move requested but opponent is not enabled");
            future.completeExceptionally(new IllegalStateException("Opponent is disabled"));
            return future;
        }

        logger.debug("Submitting position for opponent move: {}", FenCodec.encode(position));
        executor.submit(() -> {
            try {
                List<Move> legalMoves = LegalityFilter.allLegalMoves(position);
                Move move = pick(legalMoves).orElseThrow(
                        () -> new IllegalStateException("No legal moves in " + FenCodec.encode(position)));
                logger.debug("Opponent chose {} out of {} moves", move, legalMoves.size());
                future.complete(move);
            } catch (Exception ex) {
                logger.error("Exception while choosing opponent move", ex);
                future.completeExceptionally(ex);
            }
        });
        return future;
    }

    private synchronized Optional<Move> pick(List<Move> legalMoves) {
        return RandomMovePolicy.choose(legalMoves, random);
    }

    public void shutdown() {
        logger.info("Shutting down opponent controller");
        executor.shutdownNow();
    }
}
