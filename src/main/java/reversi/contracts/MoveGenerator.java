package reversi.contracts;

import reversi.records.Board;
import reversi.records.Color;
import reversi.records.GameState;
import reversi.records.Move;

import java.util.List;

/**
 * Bitboard move generation and capture resolution.
 */
public interface MoveGenerator {

    /** Bit set of every cell {@code mover} may legally place a disc on. */
    long legalMask(Board board, Color mover);

    /** Legal placements for the side to move, ascending cell order. Never contains a pass. */
    List<Move> legalMoves(GameState state);

    /**
     * Discs that placing on {@code cell} would recolour. Zero means the
     * placement captures nothing and is illegal.
     */
    long flips(Board board, Color mover, int cell);

    /**
     * Places {@code mover}'s disc and recolours the captured runs.
     * The move must be legal; a pass returns {@code board} unchanged.
     */
    Board apply(Board board, Color mover, Move move);

    default int mobility(Board board, Color mover) {
        return Long.bitCount(legalMask(board, mover));
    }
}
