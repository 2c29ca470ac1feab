package reversi.contracts;

import reversi.records.GameState;
import reversi.records.NodeStats;

public interface Evaluator {
    /**
     * Desirability of reaching {@code state} for the player who just moved
     * into it, given the statistics recorded for it.
     */
    double evaluate(GameState state, NodeStats stats);
}
