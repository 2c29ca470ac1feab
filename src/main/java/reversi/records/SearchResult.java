package reversi.records;

/**
 * Outcome of one engine turn.
 *
 * @param bestMove   the move to play
 * @param iterations MCTS iterations completed this turn, all workers combined
 * @param treeSize   distinct states recorded in the long-lived tree afterwards
 * @param timeMs     wall-clock time spent
 */
public record SearchResult(Move bestMove, long iterations, int treeSize, long timeMs) {}
