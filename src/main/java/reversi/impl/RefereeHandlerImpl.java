package reversi.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import reversi.contracts.Player;
import reversi.contracts.PositionFactory;
import reversi.contracts.RefereeHandler;
import reversi.exceptions.GameOverException;
import reversi.exceptions.InvalidMoveException;
import reversi.exceptions.MoveParseException;
import reversi.exceptions.ProtocolException;
import reversi.records.Color;
import reversi.records.GameState;
import reversi.records.Move;

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;

/**
 * Referee front-end.
 *
 * <pre>
 *   referee → I B          assigns our colour
 *   engine  → R B          ready
 *   engine  → B d 3        our move (bare "B" to pass)
 *   referee → W e 3        their move
 *   either  → C ...        comment, ignored by the game
 * </pre>
 */
public final class RefereeHandlerImpl implements RefereeHandler {

    private static final Logger LOGGER = LogManager.getLogger();

    public static final String COMMENT_PREFIX = "C ";

    private final Player engine;
    private final PositionFactory pf;
    private final BufferedReader in;
    private final PrintStream out;

    public RefereeHandlerImpl(Player engine, PositionFactory pf, BufferedReader in, PrintStream out) {
        this.engine = engine;
        this.pf = pf;
        this.in = in;
        this.out = out;
    }

    @Override
    public void runLoop() throws IOException {
        Color own = handshake();
        out.println("R " + own.token());
        out.flush();

        GameState state = pf.initial();
        while (!pf.isOver(state)) {
            LOGGER.debug("Start turn {}", state.turn());
            if (state.toMove() == own) {
                Move mv = engine.nextMove(state);
                out.println(MoveCodec.encode(mv, own));
                out.flush();
                state = play(state, mv);
            } else {
                state = play(state, receiveMove(own.opponent()));
            }
        }
        LOGGER.info("Game over at turn {}, score {}", state.turn(), pf.score(state));
    }

    /** Reads the {@code I <colour>} line. */
    Color handshake() throws IOException {
        String line = in.readLine();
        if (line == null) throw new EOFException("referee closed the stream before the handshake");

        String lower = line.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("i")) {
            if (lower.contains("b")) return Color.BLACK;
            if (lower.contains("w")) return Color.WHITE;
        }
        throw new ProtocolException("bad handshake: '" + line + "'");
    }

    /**
     * Skips and echoes non-move lines and moves tagged with our own colour;
     * an undecodable move becomes a pass.
     */
    private Move receiveMove(Color expected) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            if (line.startsWith("B") || line.startsWith("W")) {
                if (line.charAt(0) != expected.token()) {
                    comment("Ignoring move for the wrong side '" + line.trim() + "'; waiting for " + expected.token());
                    continue;
                }
                try {
                    Move mv = MoveCodec.decode(line);
                    LOGGER.info("Got opponent move {}", mv);
                    return mv;
                } catch (MoveParseException e) {
                    comment("Failed to parse move '" + line.trim() + "': " + e.getMessage() + "; treating as pass");
                    return Move.PASS;
                }
            }
            comment(line);
        }
        throw new EOFException("referee closed the stream mid-game");
    }

    /** An illegal opponent placement is replaced by a pass so the game can go on. */
    private GameState play(GameState state, Move mv) {
        try {
            return pf.advance(state, mv);
        } catch (InvalidMoveException e) {
            comment("Illegal move " + mv + " at turn " + state.turn() + "; treating as pass");
            return play(state, Move.PASS);
        } catch (GameOverException e) {
            throw new IllegalStateException("loop advanced a finished game", e);
        }
    }

    private void comment(String message) {
        out.println(COMMENT_PREFIX + message);
        out.flush();
    }
}
