package reversi.impl;

import static reversi.constants.SearchConstants.UCB_LOG_EPSILON;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import reversi.contracts.Evaluator;
import reversi.contracts.PositionFactory;
import reversi.contracts.SearchTree;
import reversi.exceptions.GameException;
import reversi.records.Color;
import reversi.records.GameState;
import reversi.records.Move;
import reversi.records.NodeStats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SplittableRandom;
import java.util.function.BiConsumer;
import java.util.random.RandomGenerator;

/**
 * Monte Carlo tree stored as a flat {@code hash -> NodeStats} table.
 *
 * <p>Each {@link #search} call walks down from the root with UCB1 until it
 * reaches a state with no recorded successor, expands that state's first
 * unrecorded successor, plays the game out with the evaluation heuristic and
 * credits every state on the walked path. At most one new state is recorded
 * per call. Rewards are always scored for the player to move at the root
 * passed to that call.</p>
 *
 * <p>Not thread-safe; one instance per worker.</p>
 */
public final class MctsTreeImpl implements SearchTree {

    private static final Logger LOGGER = LogManager.getLogger();

    private final double explorationFactor;
    private final PositionFactory pf;
    private final Evaluator evaluator;
    private final RandomGenerator rng;

    private final Map<Long, NodeStats> nodes = new HashMap<>();
    private long iterations;

    public MctsTreeImpl(double explorationFactor, PositionFactory pf, Evaluator evaluator, RandomGenerator rng) {
        this.explorationFactor = explorationFactor;
        this.pf = pf;
        this.evaluator = evaluator;
        this.rng = rng;
    }

    public MctsTreeImpl(double explorationFactor, PositionFactory pf, Evaluator evaluator) {
        this(explorationFactor, pf, evaluator, new SplittableRandom());
    }

    /* ───────────────────────── one iteration ───────────────────────── */

    @Override
    public void search(GameState root) {
        if (pf.isOver(root)) return;

        List<GameState> path = new ArrayList<>();
        boolean mayRecord = true;
        GameState leaf = root;
        while (!pf.isOver(leaf) && !isLeaf(leaf)) {
            mayRecord = addToPath(path, leaf, mayRecord);
            leaf = play(leaf, selectUcb1(leaf));
        }

        GameState child = mayRecord ? expand(leaf) : null;
        if (child == null) {
            addToPath(path, leaf, mayRecord);
        } else if (contains(pf.hash(leaf))) {
            path.add(leaf);
        }

        Optional<Color> winner = simulate(child != null ? child : leaf);
        if (child != null) path.add(child);

        backpropagate(root.toMove(), winner, path);
        iterations++;
    }

    /**
     * Recorded states always join the path; at most one unrecorded state may
     * join per iteration, so every call adds at most one key.
     *
     * @return whether an unrecorded state may still be added
     */
    private boolean addToPath(List<GameState> path, GameState state, boolean mayRecord) {
        if (contains(pf.hash(state))) {
            path.add(state);
            return mayRecord;
        }
        if (mayRecord) path.add(state);
        return false;
    }

    /** First successor, in enumeration order, that the tree has not recorded; {@code null} if none. */
    private GameState expand(GameState leaf) {
        for (Move mv : pf.legalMoves(leaf)) {
            GameState child = play(leaf, mv);
            if (!contains(pf.hash(child))) return child;
        }
        return null;
    }

    private Optional<Color> simulate(GameState start) {
        GameState game = start;
        while (!pf.isOver(game)) {
            Move mv = bestMove(game);
            if (mv.isPass() && !pf.legalMoves(game).isEmpty()) {
                mv = pf.randomMove(game, rng);
            }
            game = play(game, mv);
        }
        return pf.winner(game);
    }

    private void backpropagate(Color perspective, Optional<Color> winner, List<GameState> path) {
        double reward = winner.map(c -> c == perspective ? 1.0 : 0.0).orElse(0.5);
        for (GameState s : path) {
            nodes.merge(pf.hash(s), NodeStats.EMPTY.visit(reward), NodeStats::plus);
        }
    }

    /** A state none of whose successors are recorded yet. */
    boolean isLeaf(GameState state) {
        for (Move mv : pf.legalMoves(state)) {
            if (contains(pf.hash(play(state, mv)))) return false;
        }
        return true;
    }

    /* ───────────────────────── UCB1 ───────────────────────── */

    /** UCB1 value of every legal successor of {@code state}, in enumeration order. */
    double[] ucb1Scores(GameState state) {
        double parentVisits = stats(pf.hash(state)).map(NodeStats::visits).orElse(1.0);
        List<Move> moves = pf.legalMoves(state);
        double[] scores = new double[moves.size()];
        for (int i = 0; i < scores.length; i++) {
            NodeStats child = nodes.getOrDefault(pf.hash(play(state, moves.get(i))), NodeStats.COLD_START);
            scores[i] = ucb1(child, parentVisits, explorationFactor);
        }
        return scores;
    }

    static double ucb1(NodeStats child, double parentVisits, double explorationFactor) {
        double exploitation = child.wins() / child.visits();
        double exploration = explorationFactor
                * Math.sqrt((Math.log(parentVisits) + UCB_LOG_EPSILON) / child.visits());
        return exploitation + exploration;
    }

    /** Index of the largest value; the earliest one wins a tie. -1 for an empty array. */
    static int argMax(double[] values) {
        int best = -1;
        double bestValue = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < values.length; i++) {
            if (best < 0 || values[i] > bestValue) {
                best = i;
                bestValue = values[i];
            }
        }
        return best;
    }

    private Move selectUcb1(GameState state) {
        int idx = argMax(ucb1Scores(state));
        return pf.legalMoves(state).get(idx);
    }

    /* ───────────────────────── move choice ───────────────────────── */

    @Override
    public Move bestMove(GameState state) {
        return bestMove(state, false);
    }

    @Override
    public Move bestMove(GameState state, boolean report) {
        Move best = Move.PASS;
        double bestValue = Double.NEGATIVE_INFINITY;
        for (Move mv : pf.legalMoves(state)) {
            double value = evaluate(play(state, mv));
            if (report) LOGGER.info("MCTS: considering {} value {}", mv, value);
            if (best.isPass() || value > bestValue) {
                best = mv;
                bestValue = value;
            }
        }
        return best;
    }

    @Override
    public double evaluate(GameState state) {
        return evaluator.evaluate(state, nodes.getOrDefault(pf.hash(state), NodeStats.EMPTY));
    }

    /** Moves generated here come from the legal set, so a rejection is an engine defect. */
    private GameState play(GameState state, Move mv) {
        try {
            return pf.advance(state, mv);
        } catch (GameException e) {
            throw new IllegalStateException("search generated an unplayable move " + mv, e);
        }
    }

    /* ───────────────────────── merge & accessors ───────────────────────── */

    @Override
    public void merge(SearchTree other) {
        if (other == this) throw new IllegalArgumentException("cannot merge a tree into itself");
        other.forEachNode((key, s) -> nodes.merge(key, s, NodeStats::plus));
        iterations += other.iterations();
        other.clear();
    }

    @Override public Optional<NodeStats> stats(long key) { return Optional.ofNullable(nodes.get(key)); }
    @Override public boolean contains(long key) { return nodes.containsKey(key); }
    @Override public int size() { return nodes.size(); }
    @Override public long iterations() { return iterations; }

    @Override
    public void forEachNode(BiConsumer<Long, NodeStats> action) {
        nodes.forEach(action);
    }

    @Override
    public Map<Long, NodeStats> snapshot() {
        return Collections.unmodifiableMap(new HashMap<>(nodes));
    }

    @Override
    public void clear() {
        nodes.clear();
        iterations = 0;
    }
}
