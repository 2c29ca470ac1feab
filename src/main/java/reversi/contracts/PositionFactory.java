package reversi.contracts;

import reversi.exceptions.GameOverException;
import reversi.exceptions.InvalidMoveException;
import reversi.records.Color;
import reversi.records.FeatureCount;
import reversi.records.GameState;
import reversi.records.Move;

import java.util.List;
import java.util.Optional;
import java.util.random.RandomGenerator;

/**
 * Game-level view of the board engine: turn progression, end of game,
 * scoring and the positional feature counters.
 */
public interface PositionFactory {

    GameState initial();

    MoveGenerator moveGenerator();

    default List<Move> legalMoves(GameState state) {
        return moveGenerator().legalMoves(state);
    }

    /**
     * Plays {@code move} for the side to move.
     *
     * @return the successor: turn + 1, other player to move
     * @throws GameOverException    if neither side can move in {@code state}
     * @throws InvalidMoveException if {@code move} is a placement outside the legal set
     */
    GameState advance(GameState state, Move move) throws GameOverException, InvalidMoveException;

    /** Neither player has a legal placement on this board. */
    boolean isOver(GameState state);

    /** Playing the first legal move from {@code state} ends the game. */
    boolean isTerminal(GameState state);

    /** Black discs minus white discs, whoever is to move. */
    int score(GameState state);

    /** Leader by disc count; empty on a tie. */
    Optional<Color> winner(GameState state);

    /** Tree key: the union of occupied cells. */
    long hash(GameState state);

    int emptySquares(GameState state);

    /** Uniformly random legal move, or a pass when there is none. */
    Move randomMove(GameState state, RandomGenerator rng);

    /** Legal move leaving the opponent the fewest replies, or a pass. */
    Move lowestOpponentMobilityMove(GameState state);

    /* ───────── Positional features ───────── */

    FeatureCount cornersHeld(GameState state);

    FeatureCount edgesHeld(GameState state);

    FeatureCount xMovesHeld(GameState state);

    FeatureCount diagonalsHeld(GameState state);

    FeatureCount center4Held(GameState state);

    FeatureCount innerBoardHeld(GameState state);

    /** Eight lines of {@code B}, {@code W} or {@code .}, space separated. */
    String render(GameState state);
}
