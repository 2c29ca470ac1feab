package reversi.impl;

import static reversi.constants.BoardConstants.*;

import reversi.contracts.MoveGenerator;
import reversi.records.Board;
import reversi.records.Color;
import reversi.records.GameState;
import reversi.records.Move;

import java.util.ArrayList;
import java.util.List;

/**
 * Shift-and-mask move generator. Stateless and thread-safe.
 *
 * <p>Every direction is a single {@code (x & mask) << k} or
 * {@code (x & mask) >>> k}; the mask clears the discs that would otherwise
 * wrap around the board edge, so no per-cell bounds checks are needed.</p>
 */
public final class MoveGeneratorImpl implements MoveGenerator {

    /* ───────── shift kernel ───────── */

    /** Moves every set bit of {@code x} one step in direction {@code dir} (0..7). */
    static long shift(long x, int dir) {
        return dir < 4
                ? (x & DIRECTION_MASKS[dir]) << DIRECTION_OFFSETS[dir]
                : (x & DIRECTION_MASKS[dir]) >>> DIRECTION_OFFSETS[dir - 4];
    }

    @Override
    public long legalMask(Board board, Color mover) {
        long own = board.discs(mover);
        long opp = board.discs(mover.opponent());
        long empty = board.empty();
        long legal = 0L;

        for (int dir = 0; dir < DIRECTIONS; dir++) {
            long run = shift(own, dir) & opp;
            while (run != 0) {
                long next = shift(run, dir);
                legal |= next & empty;
                run = next & opp;
            }
        }
        return legal;
    }

    @Override
    public List<Move> legalMoves(GameState state) {
        long mask = legalMask(state.board(), state.toMove());
        List<Move> moves = new ArrayList<>(Long.bitCount(mask));
        while (mask != 0) {
            moves.add(Move.at(Long.numberOfTrailingZeros(mask)));
            mask &= mask - 1;
        }
        return moves;
    }

    @Override
    public long flips(Board board, Color mover, int cell) {
        long own = board.discs(mover);
        long opp = board.discs(mover.opponent());
        long origin = 1L << cell;
        if ((board.occupied() & origin) != 0) return 0L;

        long flipped = 0L;
        for (int dir = 0; dir < DIRECTIONS; dir++) {
            long run = 0L;
            long cursor = shift(origin, dir);
            while ((cursor & opp) != 0) {
                run |= cursor;
                cursor = shift(cursor, dir);
            }
            // the run only counts when capped by one of our own discs
            if ((cursor & own) != 0) flipped |= run;
        }
        return flipped;
    }

    @Override
    public Board apply(Board board, Color mover, Move move) {
        if (move.isPass()) return board;

        long flipped = flips(board, mover, move.cell());
        long own = board.discs(mover) | move.mask() | flipped;
        long opp = board.discs(mover.opponent()) & ~flipped;
        return Board.of(mover, own, opp);
    }
}
