package main;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import reversi.contracts.*;
import reversi.exceptions.GameException;
import reversi.impl.*;
import reversi.records.Color;
import reversi.records.EngineConfig;
import reversi.records.GameState;
import reversi.records.Move;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;
import java.util.SplittableRandom;

/**
 * Wire everything together and play.
 *
 * <pre>
 *   Main [config.json]            MCTS engine against the referee on stdin/stdout
 *   Main random                   random mover against the referee
 *   Main greedy                   fewest-opponent-replies mover against the referee
 *   Main alphabeta                iterative-deepening alpha-beta against the referee
 *   Main selfplay [config.json]   MCTS (black) against a random mover, printed
 * </pre>
 */
public final class Main {

    private static final Logger LOGGER = LogManager.getLogger();

    public static void main(String[] args) throws IOException, GameException {
        if (args.length > 0 && "selfplay".equalsIgnoreCase(args[0])) {
            runSelfPlay(loadConfig(args, 1));
            return;
        }

        PositionFactory pf = new PositionFactoryImpl();
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        Player alternate = args.length > 0 ? alternatePlayer(args[0], pf) : null;
        if (alternate != null) {
            new RefereeHandlerImpl(alternate, pf, in, System.out).runLoop();
            return;
        }

        EngineConfig config = loadConfig(args, 0);
        try (Search search = newSearch(pf, config)) {
            RefereeHandler referee = new RefereeHandlerImpl(new MctsPlayer(search), pf, in, System.out);
            referee.runLoop();
        }
    }

    /** Non-MCTS player named by {@code mode}, or {@code null} when the argument is a config path. */
    static Player alternatePlayer(String mode, PositionFactory pf) {
        return switch (mode.toLowerCase(Locale.ROOT)) {
            case "random" -> new RandomPlayer(pf, new SplittableRandom());
            case "greedy" -> new GreedyPlayer(pf);
            case "alphabeta" -> new AlphaBetaPlayer(pf);
            default -> null;
        };
    }

    private static EngineConfig loadConfig(String[] args, int index) {
        EngineConfig config = args.length > index ? ConfigLoader.load(Path.of(args[index])) : EngineConfig.defaults();
        if (!config.log()) {
            Configurator.setRootLevel(Level.WARN);
        }
        LOGGER.info("{}", config);
        return config;
    }

    static Search newSearch(PositionFactory pf, EngineConfig config) {
        Evaluator eval = new EvaluatorImpl(pf);
        SearchTreeFactory trees = () -> new MctsTreeImpl(config.explorationFactor(), pf, eval);

        TaskPool tasks = new TaskPoolImpl();
        WorkerPool pool = new WorkerPoolImpl(tasks, trees);
        TimeManager tm = new TimeManagerImpl();

        return new SearchImpl(pf, pool, tm, trees.create(), config.maxTimeMs());
    }

    private static void runSelfPlay(EngineConfig config) throws GameException {
        PositionFactory pf = new PositionFactoryImpl();
        Player white = new RandomPlayer(pf, new SplittableRandom());
        GameState game = pf.initial();

        long t0 = System.nanoTime();
        try (Search search = newSearch(pf, config)) {
            Player black = new MctsPlayer(search);
            while (!pf.isOver(game)) {
                System.out.printf("%nTurn %d:%n%s", game.turn(), pf.render(game));
                Move mv = game.toMove() == Color.BLACK ? black.nextMove(game) : white.nextMove(game);
                game = pf.advance(game, mv);
            }
        }
        long ms = (System.nanoTime() - t0) / 1_000_000;

        System.out.printf("Game Over after %d turns.%n", game.turn());
        System.out.printf("Duration: %dms%n", ms);
        System.out.printf("Score: %d%n", pf.score(game));
    }
}
