package reversi.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import reversi.contracts.PositionFactory;
import reversi.contracts.Search;
import reversi.contracts.SearchTree;
import reversi.contracts.TimeManager;
import reversi.contracts.WorkerPool;
import reversi.records.GameState;
import reversi.records.Move;
import reversi.records.SearchResult;
import reversi.records.TimeAllocation;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Turn controller for the MCTS player. Between turns it is the only owner of
 * the long-lived tree and the game clock; workers never touch either.
 */
public final class SearchImpl implements Search {

    private static final Logger LOGGER = LogManager.getLogger();

    /* immutable engine parts */
    private final PositionFactory positionFactory;
    private final WorkerPool workerPool;
    private final TimeManager timeManager;

    /* carried across turns */
    private final SearchTree tree;
    private long remainingMs;
    private long totalIterations;

    public SearchImpl(PositionFactory pf,
                      WorkerPool pool,
                      TimeManager tm,
                      SearchTree tree,
                      long totalTimeMs) {
        this.positionFactory = pf;
        this.workerPool = pool;
        this.timeManager = tm;
        this.tree = tree;
        this.remainingMs = totalTimeMs;
    }

    @Override
    public SearchResult search(GameState state) {
        long t0 = System.nanoTime();
        List<Move> legal = positionFactory.legalMoves(state);
        if (legal.isEmpty()) {
            return new SearchResult(Move.PASS, 0, tree.size(), 0);
        }

        TimeAllocation ta = timeManager.calculate(state, remainingMs);
        remainingMs = ta.remainingAfterMs();
        long deadline = t0 + TimeUnit.MILLISECONDS.toNanos(ta.turnMs());
        LOGGER.debug("Turn {}: {} ms allotted, {} ms left after", state.turn(), ta.turnMs(), remainingMs);

        SearchTree round = workerPool.searchUntil(state, deadline);
        long iterations = round.iterations();
        tree.merge(round);
        totalIterations += iterations;

        Move best = tree.bestMove(state, true);
        if (!legal.contains(best)) {
            LOGGER.warn("Tree proposed illegal move {}; playing {} instead", best, legal.get(0));
            best = legal.get(0);
        }

        long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
        LOGGER.info("Total search iterations this game: {}", totalIterations);
        LOGGER.info("Sending move {} after {} ms", best, ms);
        return new SearchResult(best, iterations, tree.size(), ms);
    }

    @Override public long remainingMs() { return remainingMs; }
    @Override public long totalIterations() { return totalIterations; }
    @Override public SearchTree tree() { return tree; }

    @Override
    public void close() {
        workerPool.close();
    }
}
