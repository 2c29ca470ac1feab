package reversi.impl;

import reversi.contracts.TaskPool;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;

/**
 * Default {@link TaskPool} backed by a work-stealing {@link ForkJoinPool}.
 * <p>
 * Worker threads are daemons, so an abandoned pool never keeps the process
 * alive.
 * </p>
 */
public final class TaskPoolImpl implements TaskPool {

    /** Guard for shutdown. */
    private final Object lifecycleLock = new Object();

    /** The live worker pool; {@code null} once {@link #shutdownNow()} ran. */
    private volatile ForkJoinPool pool;

    /**
     * @param parallelism desired number of worker threads (≥ 1).
     */
    public TaskPoolImpl(int parallelism) {
        if (parallelism < 1) throw new IllegalArgumentException("parallelism must be >= 1: " + parallelism);
        this.pool = newForkJoin(parallelism);
    }

    public TaskPoolImpl() {
        this(Runtime.getRuntime().availableProcessors());
    }

    @Override
    public <T> Future<T> submit(Callable<T> task) {
        Objects.requireNonNull(task, "task");
        ForkJoinPool p = pool;
        if (p == null) {
            throw new IllegalStateException("TaskPool is shut down");
        }
        return p.submit(task);
    }

    @Override
    public int parallelism() {
        ForkJoinPool p = pool;
        return p == null ? 0 : p.getParallelism();
    }

    @Override
    public void shutdownNow() {
        synchronized (lifecycleLock) {
            ForkJoinPool current = pool;
            pool = null;                      // mark closed, future submits will fail
            if (current != null) {
                current.shutdownNow();
            }
        }
    }

    /** Build a {@link ForkJoinPool} in async (FIFO) mode. */
    private static ForkJoinPool newForkJoin(int parallelism) {
        return new ForkJoinPool(
                parallelism,
                ForkJoinPool.defaultForkJoinWorkerThreadFactory,
                /* handler */ null,
                /* asyncMode */ true);
    }
}
