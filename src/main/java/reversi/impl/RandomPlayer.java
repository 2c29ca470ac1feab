package reversi.impl;

import reversi.contracts.Player;
import reversi.contracts.PositionFactory;
import reversi.records.GameState;
import reversi.records.Move;

import java.util.random.RandomGenerator;

/** Picks uniformly among the legal moves; passes when there are none. */
public final class RandomPlayer implements Player {

    private final PositionFactory pf;
    private final RandomGenerator rng;

    public RandomPlayer(PositionFactory pf, RandomGenerator rng) {
        this.pf = pf;
        this.rng = rng;
    }

    @Override
    public Move nextMove(GameState state) {
        return pf.randomMove(state, rng);
    }
}
