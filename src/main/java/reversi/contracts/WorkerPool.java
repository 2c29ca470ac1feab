package reversi.contracts;

import reversi.records.GameState;

/**
 * Runs independent searches of one root in parallel and folds the results.
 */
public interface WorkerPool extends AutoCloseable {

    void setParallelism(int workers);

    int getParallelism();

    /**
     * Lets every worker grow a private tree from {@code root} until
     * {@link System#nanoTime()} reaches {@code deadlineNanos}, then merges the
     * trees on the calling thread.
     *
     * @return a fresh tree holding the combined statistics of all workers
     */
    SearchTree searchUntil(GameState root, long deadlineNanos);

    @Override void close();
}
