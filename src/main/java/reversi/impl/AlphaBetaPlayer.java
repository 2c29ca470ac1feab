package reversi.impl;

import static reversi.constants.SearchConstants.*;

import reversi.contracts.MoveGenerator;
import reversi.contracts.Player;
import reversi.contracts.PositionFactory;
import reversi.exceptions.GameException;
import reversi.records.Color;
import reversi.records.GameState;
import reversi.records.Move;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Iterative-deepening minimax with alpha-beta pruning, kept as an alternative
 * to the tree search. Scores are always from the root mover's side.
 *
 * <p>Before {@code AB_MID_GAME_TURN} the leaf score is a mobility, corner and
 * edge differential; afterwards it is the disc differential. Finished games
 * score {@code ±AB_WIN_SCORE}.</p>
 */
public final class AlphaBetaPlayer implements Player {

    private final PositionFactory pf;
    private final MoveGenerator gen;
    private final int maxDepth;
    private final long timeLimitMs;

    private long deadline;
    private boolean aborted;

    public AlphaBetaPlayer(PositionFactory pf, int maxDepth, long timeLimitMs) {
        this.pf = pf;
        this.gen = pf.moveGenerator();
        this.maxDepth = maxDepth;
        this.timeLimitMs = timeLimitMs;
    }

    public AlphaBetaPlayer(PositionFactory pf) {
        this(pf, AB_MAX_DEPTH, AB_TIME_LIMIT_MS);
    }

    @Override
    public Move nextMove(GameState state) {
        List<Move> moves = orderedMoves(state, state.toMove());
        if (moves.isEmpty()) return Move.PASS;

        deadline = System.nanoTime() + timeLimitMs * 1_000_000L;
        aborted = false;
        Move best = moves.get(0);

        for (int depth = 1; depth <= maxDepth; depth++) {
            Move candidate = searchRoot(state, moves, depth);
            if (aborted) break;                       // partial iteration is discarded
            best = candidate;
        }
        return best;
    }

    private Move searchRoot(GameState root, List<Move> moves, int depth) {
        Color me = root.toMove();
        int alpha = Integer.MIN_VALUE + 1;
        Move best = moves.get(0);
        for (Move mv : moves) {
            int v = value(play(root, mv), depth - 1, alpha, Integer.MAX_VALUE, me);
            if (aborted) return best;
            if (v > alpha) {
                alpha = v;
                best = mv;
            }
        }
        return best;
    }

    private int value(GameState s, int depth, int alpha, int beta, Color me) {
        if (System.nanoTime() - deadline >= 0) {
            aborted = true;
            return 0;
        }
        if (depth == 0 || pf.isOver(s)) return evaluate(s, me);

        List<Move> moves = orderedMoves(s, s.toMove());
        if (moves.isEmpty()) {
            return value(play(s, Move.PASS), depth - 1, alpha, beta, me);
        }

        boolean maximizing = s.toMove() == me;
        int v = maximizing ? Integer.MIN_VALUE + 1 : Integer.MAX_VALUE;
        for (Move mv : moves) {
            int child = value(play(s, mv), depth - 1, alpha, beta, me);
            if (aborted) return v;
            if (maximizing) {
                v = Math.max(v, child);
                alpha = Math.max(alpha, v);
            } else {
                v = Math.min(v, child);
                beta = Math.min(beta, v);
            }
            if (alpha >= beta) break;
        }
        return v;
    }

    int evaluate(GameState s, Color me) {
        if (pf.isOver(s)) {
            Optional<Color> w = pf.winner(s);
            return w.isEmpty() ? 0 : w.get() == me ? AB_WIN_SCORE : -AB_WIN_SCORE;
        }
        if (s.turn() >= AB_MID_GAME_TURN) {
            int discs = pf.score(s);
            return me == Color.BLACK ? discs : -discs;
        }
        int mobility = gen.mobility(s.board(), me) - gen.mobility(s.board(), me.opponent());
        return mobility
                + AB_CORNER_WEIGHT * pf.cornersHeld(s).differential(me)
                + AB_EDGE_WEIGHT * pf.edgesHeld(s).differential(me);
    }

    /** Legal moves sorted by the mover's static score of the result, best first. */
    private List<Move> orderedMoves(GameState s, Color mover) {
        List<Move> moves = new ArrayList<>(pf.legalMoves(s));
        List<Integer> keys = new ArrayList<>(moves.size());
        for (Move mv : moves) keys.add(evaluate(play(s, mv), mover));

        List<Integer> order = new ArrayList<>(moves.size());
        for (int i = 0; i < moves.size(); i++) order.add(i);
        order.sort(Comparator.comparing((Integer i) -> keys.get(i)).reversed());

        List<Move> sorted = new ArrayList<>(moves.size());
        for (int i : order) sorted.add(moves.get(i));
        return sorted;
    }

    private GameState play(GameState s, Move mv) {
        try {
            return pf.advance(s, mv);
        } catch (GameException e) {
            throw new IllegalStateException("generated move rejected: " + mv, e);
        }
    }
}
