package reversi.records;

/**
 * A position plus the side to move and the number of turns played so far.
 * Values are shared freely between threads; nothing mutates them.
 *
 * @param board  disc placement
 * @param toMove player whose turn it is
 * @param turn   plies played, passes included ({@code >= 0})
 */
public record GameState(Board board, Color toMove, int turn) {

    public GameState {
        if (board == null || toMove == null) throw new IllegalArgumentException("board and toMove are required");
        if (turn < 0) throw new IllegalArgumentException("negative turn: " + turn);
    }

    public static GameState initial() {
        return new GameState(Board.initial(), Color.BLACK, 0);
    }

    /** Same board, other player to move, turn counter untouched. */
    public GameState withOtherMover() {
        return new GameState(board, toMove.opponent(), turn);
    }
}
