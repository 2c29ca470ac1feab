package reversi.exceptions;

import reversi.records.Move;

/** A placement that is not among the legal moves of the position. */
public final class InvalidMoveException extends GameException {

    private final transient Move move;

    public InvalidMoveException(Move move) {
        super("Invalid move: " + move);
        this.move = move;
    }

    public Move getMove() {
        return move;
    }
}
