package reversi.records;

/**
 * Thinking time granted for one turn.
 *
 * @param turnMs           milliseconds the search may use this turn
 * @param remainingAfterMs game clock left once {@code turnMs} is spent
 */
public record TimeAllocation(long turnMs, long remainingAfterMs) {}
