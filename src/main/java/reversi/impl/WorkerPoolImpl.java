package reversi.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import reversi.contracts.SearchTree;
import reversi.contracts.SearchTreeFactory;
import reversi.contracts.TaskPool;
import reversi.contracts.WorkerPool;
import reversi.records.GameState;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Root-parallel search: every worker grows its own tree from the same root
 * and nothing is shared until the join. The trees are then merged one after
 * another on the calling thread.
 */
public final class WorkerPoolImpl implements WorkerPool {

    private static final Logger LOGGER = LogManager.getLogger();

    private final TaskPool tasks;
    private final SearchTreeFactory factory;
    private int parallelism;

    public WorkerPoolImpl(TaskPool tasks, SearchTreeFactory factory, int parallelism) {
        this.tasks = tasks;
        this.factory = factory;
        setParallelism(parallelism);
    }

    public WorkerPoolImpl(TaskPool tasks, SearchTreeFactory factory) {
        this(tasks, factory, tasks.parallelism());
    }

    @Override
    public void setParallelism(int workers) {
        if (workers < 1) throw new IllegalArgumentException("need at least one worker: " + workers);
        this.parallelism = workers;
    }

    @Override
    public int getParallelism() {
        return parallelism;
    }

    @Override
    public SearchTree searchUntil(GameState root, long deadlineNanos) {
        List<Future<SearchTree>> futures = new ArrayList<>(parallelism);
        for (int i = 0; i < parallelism; i++) {
            futures.add(tasks.submit(() -> runWorker(root, deadlineNanos)));
        }

        // every worker is joined even after a failure, so none outlives this call
        SearchTree merged = factory.create();
        IllegalStateException failure = null;
        long total = 0;
        for (int i = 0; i < futures.size(); i++) {
            try {
                SearchTree local = await(futures.get(i));
                LOGGER.debug("Worker {} completed {} iterations", i, local.iterations());
                total += local.iterations();
                if (failure == null) merged.merge(local);
            } catch (IllegalStateException e) {
                LOGGER.error("Worker {} failed", i, e);
                if (failure == null) failure = e;
                else failure.addSuppressed(e);
            }
        }
        if (failure != null) throw failure;
        LOGGER.info("Search iterations this turn: {} across {} workers", total, futures.size());
        return merged;
    }

    /** Deadline is checked between iterations only; the running one always finishes. */
    private SearchTree runWorker(GameState root, long deadlineNanos) {
        SearchTree tree = factory.create();
        while (System.nanoTime() - deadlineNanos < 0) {
            tree.search(root);
        }
        return tree;
    }

    private static SearchTree await(Future<SearchTree> f) {
        try {
            return f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for search workers", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("search worker failed", e.getCause());
        }
    }

    @Override
    public void close() {
        tasks.close();
    }
}
