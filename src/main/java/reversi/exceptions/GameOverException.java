package reversi.exceptions;

/** Attempt to advance a game neither side can move in. */
public final class GameOverException extends GameException {

    public GameOverException(int turn) {
        super("Game over at turn " + turn);
    }
}
