package reversi.impl;

import reversi.contracts.Player;
import reversi.contracts.PositionFactory;
import reversi.records.GameState;
import reversi.records.Move;

/** One-ply player: leaves the opponent as few replies as possible. */
public final class GreedyPlayer implements Player {

    private final PositionFactory pf;

    public GreedyPlayer(PositionFactory pf) {
        this.pf = pf;
    }

    @Override
    public Move nextMove(GameState state) {
        return pf.lowestOpponentMobilityMove(state);
    }
}
