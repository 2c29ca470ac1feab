package reversi.contracts;

import reversi.records.GameState;
import reversi.records.Move;
import reversi.records.NodeStats;

import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Flat Monte Carlo statistics keyed by {@link PositionFactory#hash}. There are
 * no parent or child links; paths are rebuilt on every {@link #search} call.
 *
 * <p>A tree is owned by one thread at a time. Handing it to {@link #merge}
 * transfers its contents to the receiver and leaves it empty.</p>
 */
public interface SearchTree {

    /** One select / expand / simulate / backpropagate pass. No-op on a finished game. */
    void search(GameState root);

    /** Highest-valued legal move, first in enumeration order on ties; a pass if there is none. */
    Move bestMove(GameState state);

    /** As {@link #bestMove(GameState)}, logging every candidate's value when {@code report} is set. */
    Move bestMove(GameState state, boolean report);

    /** Heuristic value of {@code state} for the player who moved into it. */
    double evaluate(GameState state);

    /** Adds {@code other}'s statistics into this tree and empties {@code other}. */
    void merge(SearchTree other);

    Optional<NodeStats> stats(long key);

    boolean contains(long key);

    int size();

    long iterations();

    void forEachNode(BiConsumer<Long, NodeStats> action);

    /** Unmodifiable copy of the current statistics. */
    Map<Long, NodeStats> snapshot();

    void clear();
}
