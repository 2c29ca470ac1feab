package reversi.impl;

import reversi.contracts.Player;
import reversi.contracts.Search;
import reversi.records.GameState;
import reversi.records.Move;

/** {@link Player} adapter over the tree search. */
public final class MctsPlayer implements Player {

    private final Search search;

    public MctsPlayer(Search search) {
        this.search = search;
    }

    @Override
    public Move nextMove(GameState state) {
        return search.search(state).bestMove();
    }
}
