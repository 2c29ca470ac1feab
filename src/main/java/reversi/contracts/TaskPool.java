package reversi.contracts;

import java.util.concurrent.Callable;
import java.util.concurrent.Future;

/**
 * Threads the search workers run on. Kept behind an interface so the worker
 * pool never creates threads itself.
 */
public interface TaskPool extends AutoCloseable {

    <T> Future<T> submit(Callable<T> task);

    /** Workers that can run at once; 0 after shutdown. */
    int parallelism();

    /** Interrupts running workers and refuses further submissions. */
    void shutdownNow();

    @Override default void close() { shutdownNow(); }
}
