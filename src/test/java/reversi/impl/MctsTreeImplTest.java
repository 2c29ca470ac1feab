package reversi.impl;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import reversi.contracts.Evaluator;
import reversi.contracts.PositionFactory;
import reversi.contracts.SearchTree;
import reversi.exceptions.GameException;
import reversi.records.Board;
import reversi.records.Color;
import reversi.records.GameState;
import reversi.records.Move;
import reversi.records.NodeStats;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.SplittableRandom;

class MctsTreeImplTest {

    private static final double C = Math.sqrt(2.0);
    private static final PositionFactory PF = new PositionFactoryImpl();
    private static final Evaluator EVAL = new EvaluatorImpl(PF);

    private MctsTreeImpl tree;

    @BeforeEach
    void setUp() {
        tree = newTree(42);
    }

    private static MctsTreeImpl newTree(long seed) {
        return new MctsTreeImpl(C, PF, EVAL, new SplittableRandom(seed));
    }

    /* ───────────────────────── single iterations ───────────────────────── */

    @Test
    void firstIterationRecordsFirstChildOfRoot() throws GameException {
        GameState root = PF.initial();
        tree.search(root);

        long child = PF.hash(PF.advance(root, Move.at(19)));
        assertEquals(1, tree.size());
        assertEquals(1, tree.iterations());
        assertTrue(tree.contains(child));
        assertEquals(1.0, tree.stats(child).orElseThrow().visits());
        assertFalse(tree.contains(PF.hash(root)));
    }

    @Test
    void secondIterationRecordsRootOnceItHasARecordedChild() throws GameException {
        GameState root = PF.initial();
        tree.search(root);
        tree.search(root);

        // the root is the one new key; no expansion happens below it this time
        assertEquals(2, tree.size());
        assertTrue(tree.contains(PF.hash(PF.advance(root, Move.at(19)))));
        assertEquals(1.0, tree.stats(PF.hash(root)).orElseThrow().visits());
    }

    @Test
    void finishedRootIsLeftAlone() {
        GameState over = new GameState(new Board(1L, 1L << 2), Color.BLACK, 12);
        tree.search(over);
        assertEquals(0, tree.size());
        assertEquals(0, tree.iterations());
    }

    @Test
    void rewardIsScoredForRootMover() throws GameException {
        // a1 black, b1 white, black to move: c1 wipes white out and black wins
        GameState blackWins = new GameState(new Board(1L, 1L << 1), Color.BLACK, 20);
        tree.search(blackWins);
        tree.search(blackWins);

        long child = PF.hash(PF.advance(blackWins, Move.at(2)));
        assertEquals(new NodeStats(1, 1), tree.stats(PF.hash(blackWins)).orElseThrow());
        assertEquals(new NodeStats(2, 2), tree.stats(child).orElseThrow());

        // same board with white to move: white must pass, then loses
        MctsTreeImpl other = newTree(1);
        other.search(blackWins.withOtherMover());
        assertEquals(new NodeStats(1, 0), other.stats(PF.hash(blackWins)).orElseThrow());
    }

    /* ───────────────────────── growth properties ───────────────────────── */

    @ParameterizedTest
    @ValueSource(longs = {1, 2, 3})
    void treeGrowsByAtMostOneKeyAndNeverForgets(long seed) {
        MctsTreeImpl t = newTree(seed);
        GameState root = PF.initial();
        Map<Long, NodeStats> previous = Map.of();

        for (int i = 0; i < 300; i++) {
            t.search(root);
            Map<Long, NodeStats> now = t.snapshot();
            assertTrue(now.keySet().containsAll(previous.keySet()), "key disappeared at iteration " + i);
            assertTrue(now.size() <= previous.size() + 1, "more than one new key at iteration " + i);
            previous = now;
        }

        // the root joins the tree on the second iteration and is on every path after
        assertEquals(300, t.iterations());
        assertEquals(299.0, t.stats(PF.hash(root)).orElseThrow().visits());
        t.forEachNode((key, s) -> {
            assertTrue(s.visits() >= 1.0);
            assertTrue(s.wins() >= 0.0 && s.wins() <= s.visits());
        });
    }

    /* ───────────────────────── merge ───────────────────────── */

    @Test
    void mergeSumsStatisticsAndDrainsDonor() {
        GameState root = PF.initial();
        MctsTreeImpl a = newTree(5);
        MctsTreeImpl b = newTree(6);
        for (int i = 0; i < 20; i++) a.search(root);
        for (int i = 0; i < 60; i++) b.search(root);

        Map<Long, NodeStats> before = a.snapshot();
        Map<Long, NodeStats> donor = b.snapshot();
        a.merge(b);

        Map<Long, NodeStats> expected = new HashMap<>(before);
        donor.forEach((k, s) -> expected.merge(k, s, NodeStats::plus));
        assertEquals(expected, a.snapshot());
        assertEquals(80, a.iterations());

        assertEquals(0, b.size());
        assertEquals(0, b.iterations());
    }

    @Test
    void mergeIntoSelfIsRejected() {
        tree.search(PF.initial());
        assertThrows(IllegalArgumentException.class, () -> tree.merge(tree));
        assertEquals(1, tree.size());
    }

    @Test
    void mergeIntoEmptyTreeCopiesDonor() {
        GameState root = PF.initial();
        MctsTreeImpl donor = newTree(9);
        for (int i = 0; i < 25; i++) donor.search(root);
        Map<Long, NodeStats> expected = donor.snapshot();

        SearchTree empty = newTree(10);
        empty.merge(donor);
        assertEquals(expected, empty.snapshot());
    }

    /* ───────────────────────── UCB1 ───────────────────────── */

    @Test
    void coldStartScore() {
        double expected = 0.5 + C * Math.sqrt(1e-5);
        assertEquals(expected, MctsTreeImpl.ucb1(NodeStats.COLD_START, 1.0, C), 1e-12);
    }

    @Test
    void lessVisitedChildGetsLargerBonus() {
        double rare = MctsTreeImpl.ucb1(new NodeStats(2, 1), 100, C);
        double common = MctsTreeImpl.ucb1(new NodeStats(50, 25), 100, C);
        assertTrue(rare > common);
    }

    @Test
    void scoresDoNotDependOnChildOrder() {
        List<NodeStats> children = new ArrayList<>(List.of(
                new NodeStats(10, 7), new NodeStats(3, 1), NodeStats.COLD_START,
                new NodeStats(10, 7), new NodeStats(40, 30), new NodeStats(1, 0)));
        double[] original = scores(children, 64);

        Collections.shuffle(children, new Random(3));
        double[] shuffled = scores(children, 64);

        double[] a = original.clone();
        double[] b = shuffled.clone();
        Arrays.sort(a);
        Arrays.sort(b);
        assertArrayEquals(a, b);
        assertEquals(original[MctsTreeImpl.argMax(original)], shuffled[MctsTreeImpl.argMax(shuffled)]);
    }

    @Test
    void argMaxKeepsEarliestOnTie() {
        assertEquals(1, MctsTreeImpl.argMax(new double[] {1.0, 2.0, 2.0, 0.5}));
        assertEquals(0, MctsTreeImpl.argMax(new double[] {3.0}));
        assertEquals(-1, MctsTreeImpl.argMax(new double[0]));
    }

    @Test
    void ucb1ScoresCoverEveryLegalChild() {
        GameState root = PF.initial();
        for (int i = 0; i < 10; i++) tree.search(root);
        double[] scores = tree.ucb1Scores(root);
        assertEquals(PF.legalMoves(root).size(), scores.length);
        for (double s : scores) assertTrue(Double.isFinite(s));
    }

    private static double[] scores(List<NodeStats> children, double parentVisits) {
        double[] out = new double[children.size()];
        for (int i = 0; i < out.length; i++) out[i] = MctsTreeImpl.ucb1(children.get(i), parentVisits, C);
        return out;
    }

    /* ───────────────────────── move choice ───────────────────────── */

    @Test
    void bestMoveIsLegalOrPass() {
        GameState root = PF.initial();
        for (int i = 0; i < 50; i++) tree.search(root);
        assertTrue(PF.legalMoves(root).contains(tree.bestMove(root)));
        assertTrue(PF.legalMoves(root).contains(tree.bestMove(root, true)));

        GameState whiteStuck = new GameState(new Board(1L, 1L << 1), Color.WHITE, 20);
        assertEquals(Move.PASS, tree.bestMove(whiteStuck));
    }

    @Test
    void evaluateUsesEmptyStatsForUnknownStates() throws GameException {
        GameState s = PF.advance(PF.initial(), Move.at(19));
        assertFalse(tree.contains(PF.hash(s)));
        assertEquals(EVAL.evaluate(s, NodeStats.EMPTY), tree.evaluate(s), 1e-12);
    }
}
