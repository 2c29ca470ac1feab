package bench;

import java.util.SplittableRandom;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.*;
import reversi.contracts.MoveGenerator;
import reversi.contracts.PositionFactory;
import reversi.impl.EvaluatorImpl;
import reversi.impl.MctsTreeImpl;
import reversi.impl.PositionFactoryImpl;
import reversi.records.Board;
import reversi.records.Color;
import reversi.records.GameState;
import reversi.records.Move;

/**
 * Throughput of the shift kernel (perft from the opening) and of single MCTS
 * iterations on a fresh tree.
 */
@State(Scope.Thread)
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
public class MoveGeneratorBenchmark {

  /* collaborators */
  private static final PositionFactory FACT = new PositionFactoryImpl();
  private static final MoveGenerator   GEN  = FACT.moveGenerator();

  @Param({"5", "7"})
  public int depth;

  private MctsTreeImpl tree;

  /* report nodes/sec */
  @AuxCounters(AuxCounters.Type.EVENTS)
  @State(Scope.Thread)
  public static class Metrics { public long nodes; }

  @Setup(Level.Iteration)
  public void freshTree() {
    tree = new MctsTreeImpl(Math.sqrt(2.0), FACT, new EvaluatorImpl(FACT), new SplittableRandom(1));
  }

  /* ── benchmark bodies ──────────────────────────────────────────── */
  @Benchmark
  public void perftNodes(Metrics m) {
    m.nodes += perft(Board.initial(), Color.BLACK, depth, false);
  }

  @Benchmark
  public int mctsIteration() {
    tree.search(GameState.initial());
    return tree.size();
  }

  private static long perft(Board b, Color mover, int depth, boolean passed) {
    if (depth == 0) return 1;
    long legal = GEN.legalMask(b, mover);
    if (legal == 0) {
      return passed ? 1 : perft(b, mover.opponent(), depth - 1, true);
    }
    long nodes = 0;
    while (legal != 0) {
      int cell = Long.numberOfTrailingZeros(legal);
      legal &= legal - 1;
      nodes += perft(GEN.apply(b, mover, Move.at(cell)), mover.opponent(), depth - 1, false);
    }
    return nodes;
  }
}
