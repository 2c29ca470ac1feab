package reversi.impl;

import static reversi.constants.SearchConstants.TIME_FRACTIONS;

import reversi.contracts.TimeManager;
import reversi.records.GameState;
import reversi.records.TimeAllocation;

/**
 * Table-driven clock split: turn {@code i} gets {@code TIME_FRACTIONS[i]} of
 * whatever is left. The table front-loads the middle game, where the tree
 * pays off most, and keeps a reserve for the last moves.
 */
public final class TimeManagerImpl implements TimeManager {

    public TimeManagerImpl() {}

    @Override
    public TimeAllocation calculate(GameState state, long remainingMs) {
        if (remainingMs < 0) throw new IllegalArgumentException("negative remaining time: " + remainingMs);

        long turnMs = (long) (remainingMs * fraction(state.turn()));
        return new TimeAllocation(turnMs, remainingMs - turnMs);
    }

    /** Share for {@code turn}; turns beyond the table reuse its last entry. */
    public static double fraction(int turn) {
        if (turn < 0) throw new IllegalArgumentException("negative turn: " + turn);
        return TIME_FRACTIONS[Math.min(turn, TIME_FRACTIONS.length - 1)];
    }
}
