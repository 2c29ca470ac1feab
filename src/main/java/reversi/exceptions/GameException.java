package reversi.exceptions;

/**
 * A rule violation reported by the board engine. The state the caller passed
 * in is left as it was.
 */
public abstract class GameException extends Exception {

    protected GameException(String message) {
        super(message);
    }
}
