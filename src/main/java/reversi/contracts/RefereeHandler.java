package reversi.contracts;

import java.io.IOException;

/**
 * Drives one game against the line-oriented referee: handshake, then moves
 * in both directions until neither side can play.
 */
public interface RefereeHandler {

    /**
     * Runs the game to completion.
     *
     * @throws IOException if the handshake is malformed or the referee stream ends early
     */
    void runLoop() throws IOException;
}
