package org.schachregeln.rules;

import org.schachregeln.model.Board;
import org.schachregeln.model.GameStatus;
import org.schachregeln.model.Piece;
import org.schachregeln.model.Position;
import org.schachregeln.model.Square;

public final class GameStatusEvaluator {
    private GameStatusEvaluator() {
    }

    public static GameStatus status(Position position) {
        if (hasAnyLegalMove(position)) {
            return GameStatus.ONGOING;
        }
        return isInCheck(position) ? GameStatus.CHECKMATE : GameStatus.STALEMATE;
    }

    public static boolean isInCheck(Position position) {
        return AttackOracle.isKingAttacked(position.board(), position.sideToMove());
    }

    public static boolean hasAnyLegalMove(Position position) {
        for (int row = 0; row < Board.SIZE; row++) {
            for (int col = 0; col < Board.SIZE; col++) {
                Piece piece = position.board().pieceAt(row, col);
                if (piece != null && piece.getColor() == position.sideToMove()
                        && !LegalityFilter.legalMoves(Square.of(row, col), position).isEmpty()) {
                    return true;
                }
            }
        }
        return false;
    }
}
