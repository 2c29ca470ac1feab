package reversi.impl;

import static reversi.constants.BoardConstants.*;

import reversi.contracts.MoveGenerator;
import reversi.contracts.PositionFactory;
import reversi.exceptions.GameOverException;
import reversi.exceptions.InvalidMoveException;
import reversi.records.Board;
import reversi.records.Color;
import reversi.records.FeatureCount;
import reversi.records.GameState;
import reversi.records.Move;

import java.util.List;
import java.util.Optional;
import java.util.random.RandomGenerator;

public final class PositionFactoryImpl implements PositionFactory {

    private final MoveGenerator gen;

    public PositionFactoryImpl(MoveGenerator gen) {
        this.gen = gen;
    }

    public PositionFactoryImpl() {
        this(new MoveGeneratorImpl());
    }

    @Override public GameState initial() { return GameState.initial(); }

    @Override public MoveGenerator moveGenerator() { return gen; }

    /* ───────── turn progression ───────── */

    @Override
    public GameState advance(GameState state, Move move) throws GameOverException, InvalidMoveException {
        Board board = state.board();
        Color mover = state.toMove();
        long legal = gen.legalMask(board, mover);

        if (legal == 0 && gen.legalMask(board, mover.opponent()) == 0) {
            throw new GameOverException(state.turn());
        }

        Board next = board;
        if (!move.isPass()) {
            if ((legal & move.mask()) == 0) throw new InvalidMoveException(move);
            next = gen.apply(board, mover, move);
        }
        return new GameState(next, mover.opponent(), state.turn() + 1);
    }

    @Override
    public boolean isOver(GameState state) {
        Board b = state.board();
        return gen.legalMask(b, state.toMove()) == 0
                && gen.legalMask(b, state.toMove().opponent()) == 0;
    }

    @Override
    public boolean isTerminal(GameState state) {
        if (isOver(state)) return false;
        List<Move> moves = gen.legalMoves(state);
        if (moves.isEmpty()) return false;
        try {
            return isOver(advance(state, moves.get(0)));
        } catch (GameOverException | InvalidMoveException e) {
            throw new IllegalStateException("first generated move was rejected", e);
        }
    }

    /* ───────── scoring ───────── */

    @Override
    public int score(GameState state) {
        Board b = state.board();
        return Long.bitCount(b.black()) - Long.bitCount(b.white());
    }

    @Override
    public Optional<Color> winner(GameState state) {
        int s = score(state);
        if (s > 0) return Optional.of(Color.BLACK);
        if (s < 0) return Optional.of(Color.WHITE);
        return Optional.empty();
    }

    @Override
    public long hash(GameState state) {
        return state.board().occupied();
    }

    @Override
    public int emptySquares(GameState state) {
        return Long.bitCount(state.board().empty());
    }

    @Override
    public Move randomMove(GameState state, RandomGenerator rng) {
        long legal = gen.legalMask(state.board(), state.toMove());
        int n = Long.bitCount(legal);
        if (n == 0) return Move.PASS;
        // drop the lowest set bit k times, then take the lowest remaining
        for (int k = rng.nextInt(n); k > 0; k--) legal &= legal - 1;
        return Move.at(Long.numberOfTrailingZeros(legal));
    }

    @Override
    public Move lowestOpponentMobilityMove(GameState state) {
        Move best = Move.PASS;
        int lowest = Integer.MAX_VALUE;
        Color mover = state.toMove();
        for (Move mv : gen.legalMoves(state)) {
            Board next = gen.apply(state.board(), mover, mv);
            int mobility = gen.mobility(next, mover.opponent());
            if (mobility < lowest) {
                lowest = mobility;
                best = mv;
            }
        }
        return best;
    }

    /* ───────── positional features ───────── */

    private static FeatureCount held(GameState state, long cells) {
        Board b = state.board();
        return new FeatureCount(Long.bitCount(b.black() & cells), Long.bitCount(b.white() & cells));
    }

    @Override public FeatureCount cornersHeld(GameState s)    { return held(s, CORNERS); }
    @Override public FeatureCount edgesHeld(GameState s)      { return held(s, EDGES); }
    @Override public FeatureCount xMovesHeld(GameState s)     { return held(s, X_SQUARES); }
    @Override public FeatureCount diagonalsHeld(GameState s)  { return held(s, DIAGONALS); }
    @Override public FeatureCount center4Held(GameState s)    { return held(s, CENTER_4); }
    @Override public FeatureCount innerBoardHeld(GameState s) { return held(s, INNER_16); }

    @Override
    public String render(GameState state) {
        Board b = state.board();
        StringBuilder sb = new StringBuilder(8 * 17);
        for (int row = 0; row < 8; row++) {
            for (int col = 0; col < 8; col++) {
                long bit = 1L << (row * 8 + col);
                char c = (b.black() & bit) != 0 ? 'B' : (b.white() & bit) != 0 ? 'W' : '.';
                if (col > 0) sb.append(' ');
                sb.append(c);
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
