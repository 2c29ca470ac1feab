package reversi.impl;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reversi.contracts.Evaluator;
import reversi.contracts.PositionFactory;
import reversi.contracts.SearchTree;
import reversi.contracts.SearchTreeFactory;
import reversi.contracts.WorkerPool;
import reversi.records.GameState;
import reversi.records.NodeStats;

import java.util.concurrent.TimeUnit;

class WorkerPoolImplTest {

    private static final PositionFactory PF = new PositionFactoryImpl();
    private static final Evaluator EVAL = new EvaluatorImpl(PF);
    private static final SearchTreeFactory TREES = () -> new MctsTreeImpl(Math.sqrt(2.0), PF, EVAL);

    private WorkerPool pool;

    @BeforeEach
    void setUp() {
        pool = new WorkerPoolImpl(new TaskPoolImpl(2), TREES);
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    @Test
    void parallelismFollowsTaskPool() {
        assertEquals(2, pool.getParallelism());
        pool.setParallelism(3);
        assertEquals(3, pool.getParallelism());
        assertThrows(IllegalArgumentException.class, () -> pool.setParallelism(0));
    }

    @Test
    void expiredDeadlineYieldsEmptyTree() {
        SearchTree merged = pool.searchUntil(PF.initial(), System.nanoTime() - 1);
        assertEquals(0, merged.size());
        assertEquals(0, merged.iterations());
    }

    @Test
    void workersCombineTheirIterations() {
        GameState root = PF.initial();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(200);
        SearchTree merged = pool.searchUntil(root, deadline);

        assertTrue(System.nanoTime() - deadline >= 0, "returned before the deadline");
        assertTrue(merged.iterations() > 0);
        // each worker credits the root on every iteration but its first
        double rootVisits = merged.stats(PF.hash(root)).map(NodeStats::visits).orElse(0.0);
        assertTrue(rootVisits <= merged.iterations());
        assertTrue(rootVisits >= merged.iterations() - pool.getParallelism());
    }

    @Test
    void poolIsReusableAcrossTurns() {
        GameState root = PF.initial();
        for (int turn = 0; turn < 3; turn++) {
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(30);
            assertNotNull(pool.searchUntil(root, deadline));
        }
    }

    @Test
    void failingWorkerSurfacesAsIllegalState() {
        Evaluator broken = (s, st) -> {
            throw new UnsupportedOperationException("boom");
        };
        try (WorkerPool failing = new WorkerPoolImpl(new TaskPoolImpl(1),
                () -> new MctsTreeImpl(Math.sqrt(2.0), PF, broken))) {
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(500);
            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> failing.searchUntil(PF.initial(), deadline));
            assertInstanceOf(UnsupportedOperationException.class, e.getCause());
        }
    }

    @Test
    void everyWorkerIsJoinedBeforeAFailureSurfaces() {
        Evaluator broken = (s, st) -> {
            throw new UnsupportedOperationException("boom");
        };
        try (WorkerPool failing = new WorkerPoolImpl(new TaskPoolImpl(3),
                () -> new MctsTreeImpl(Math.sqrt(2.0), PF, broken))) {
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(500);
            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> failing.searchUntil(PF.initial(), deadline));
            assertInstanceOf(UnsupportedOperationException.class, e.getCause());
            assertEquals(2, e.getSuppressed().length);
        }
    }
}
