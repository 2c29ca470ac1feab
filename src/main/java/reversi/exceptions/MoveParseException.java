package reversi.exceptions;

/** A referee move line that does not decode to a move. */
public final class MoveParseException extends Exception {

    public MoveParseException(String message) {
        super(message);
    }

    public MoveParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
