package reversi.contracts;

import reversi.records.GameState;
import reversi.records.SearchResult;

/**
 * Per-game move selection: owns the long-lived tree and the game clock.
 */
public interface Search extends AutoCloseable {

    SearchResult search(GameState state);

    long remainingMs();

    /** Iterations over every turn searched so far. */
    long totalIterations();

    SearchTree tree();

    @Override
    void close();
}
