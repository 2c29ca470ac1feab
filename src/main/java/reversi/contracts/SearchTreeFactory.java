package reversi.contracts;

/**
 * Creates empty {@link SearchTree}s sharing one configuration, so the
 * {@link WorkerPool} can hand each worker a private tree.
 */
@FunctionalInterface
public interface SearchTreeFactory {
    SearchTree create();
}
