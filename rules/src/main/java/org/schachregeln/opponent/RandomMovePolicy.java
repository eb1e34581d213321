package org.schachregeln.opponent;

import org.schachregeln.model.Move;

import java.util.List;
import java.util.Optional;
import java.util.random.RandomGenerator;

public final class RandomMovePolicy {
    private RandomMovePolicy() {
    }

    public static Optional<Move> choose(List<Move> legalMoves, RandomGenerator random) {
        if (legalMoves.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(legalMoves.get(random.nextInt(legalMoves.size())));
    }
}
