package reversi.contracts;

import reversi.records.GameState;
import reversi.records.Move;

/**
 * Anything that picks a move for the side to move.
 */
@FunctionalInterface
public interface Player {
    Move nextMove(GameState state);
}
