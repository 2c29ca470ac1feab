package reversi.impl;

import static reversi.constants.SearchConstants.*;

import reversi.contracts.Evaluator;
import reversi.contracts.MoveGenerator;
import reversi.contracts.PositionFactory;
import reversi.records.Color;
import reversi.records.GameState;
import reversi.records.NodeStats;

/**
 * Playout and final-choice heuristic: tree confidence plus a linear mix of
 * positional differentials. Stateless and thread-safe.
 *
 * <p>The evaluated state is a successor, so its side to move is the
 * opponent. Differentials are taken for the player who just moved, and the
 * mobility term counts the opponent's replies.</p>
 */
public final class EvaluatorImpl implements Evaluator {

    private final PositionFactory pf;
    private final MoveGenerator gen;

    public EvaluatorImpl(PositionFactory pf) {
        this.pf = pf;
        this.gen = pf.moveGenerator();
    }

    @Override
    public double evaluate(GameState state, NodeStats stats) {
        Color own = state.toMove().opponent();

        double value = VISIT_WEIGHT * sigmoid(stats.visits());
        value += WIN_RATIO_WEIGHT * stats.ratio();

        value += CORNER_WEIGHT    * pf.cornersHeld(state).differential(own);
        value += EDGE_WEIGHT      * pf.edgesHeld(state).differential(own);
        value += DIAGONAL_WEIGHT  * pf.diagonalsHeld(state).differential(own);
        value += CENTER_4_WEIGHT  * pf.center4Held(state).differential(own);
        value += INNER_16_WEIGHT  * pf.innerBoardHeld(state).differential(own);
        value += X_SQUARE_WEIGHT  * pf.xMovesHeld(state).differential(own);

        value += OPPONENT_MOBILITY_WEIGHT * gen.mobility(state.board(), state.toMove());
        return value;
    }

    static double sigmoid(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }
}
