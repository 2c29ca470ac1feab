package reversi.contracts;

import reversi.records.GameState;
import reversi.records.TimeAllocation;

/**
 * Splits the remaining game clock into a budget for the current turn.
 */
public interface TimeManager {

    /**
     * @param state       position about to be searched; its turn selects the share
     * @param remainingMs game clock left, {@code >= 0}
     */
    TimeAllocation calculate(GameState state, long remainingMs);
}
