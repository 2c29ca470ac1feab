package reversi.constants;

/**
 * Tuning constants for the tree search, the playout heuristic and the clock.
 */
public final class SearchConstants {

    private SearchConstants() {}

    /* ────────────── UCB1 ────────────── */
    public static final double UCB_LOG_EPSILON = 1e-5;

    /* ────────────── Evaluation weights ────────────── */
    public static final double VISIT_WEIGHT = 10.0;
    public static final double WIN_RATIO_WEIGHT = 10.0;
    public static final double CORNER_WEIGHT = 2.0;
    public static final double EDGE_WEIGHT = 1.5;
    public static final double DIAGONAL_WEIGHT = 1.75;
    public static final double CENTER_4_WEIGHT = 1.0;
    public static final double INNER_16_WEIGHT = 1.0;
    public static final double OPPONENT_MOBILITY_WEIGHT = -1.5;
    public static final double X_SQUARE_WEIGHT = -1.0;

    /* ────────────── Time management ────────────── */

    /**
     * Share of the remaining game clock to spend on turn {@code i}. Turns past
     * the end of the table reuse the last entry.
     */
    public static final double[] TIME_FRACTIONS = {
            0.015, 0.015, 0.015, 0.015, 0.025, 0.025, 0.025, 0.025, 0.025, 0.025,
            0.048, 0.048, 0.048, 0.048, 0.048, 0.048, 0.050, 0.051, 0.052, 0.053,
            0.044, 0.045, 0.049, 0.049, 0.049, 0.051, 0.053, 0.055, 0.057, 0.059,
            0.060, 0.060, 0.061, 0.062, 0.063, 0.064, 0.065, 0.065, 0.065, 0.065,
            0.167, 0.168, 0.169, 0.169, 0.171, 0.172, 0.173, 0.175, 0.180, 0.180,
            0.181, 0.187, 0.196, 0.199, 0.060, 0.060, 0.060, 0.060, 0.060, 0.060,
            0.060, 0.060, 0.060, 0.060, 0.060, 0.060, 0.060, 0.060, 0.060, 0.060
    };

    /* ────────────── Alpha-beta player ────────────── */
    public static final int AB_MAX_DEPTH = 4;
    public static final long AB_TIME_LIMIT_MS = 100;
    public static final int AB_MID_GAME_TURN = 35;
    public static final int AB_CORNER_WEIGHT = 5;
    public static final int AB_EDGE_WEIGHT = 2;
    public static final int AB_WIN_SCORE = 1_000_000;
}
