package reversi.constants;

/**
 * Static bitboard masks and the fixed cell sets used by the positional
 * feature counters.
 */
public final class BoardConstants {

    private BoardConstants() {}

    /* ────────────── Opening position ────────────── */
    public static final long BLACK_START = 1L << 28 | 1L << 35;
    public static final long WHITE_START = 1L << 27 | 1L << 36;

    /* ────────────── Shift kernel ────────────── */

    /**
     * Per-direction pre-shift masks. Entries 0..3 pair with a left shift by
     * {@link #DIRECTION_OFFSETS}[i], entries 4..7 with an unsigned right shift
     * by {@link #DIRECTION_OFFSETS}[i - 4]. Masking before the shift drops
     * discs that would wrap to the opposite edge or fall off the board.
     */
    public static final long[] DIRECTION_MASKS = {
            0x7F7F7F7F7F7F7F7FL, // << 1  east
            0x00FFFFFFFFFFFFFFL, // << 8  south
            0x007F7F7F7F7F7F7FL, // << 9  south-east
            0x00FEFEFEFEFEFEFEL, // << 7  south-west
            0xFEFEFEFEFEFEFEFEL, // >>> 1 west
            0xFFFFFFFFFFFFFF00L, // >>> 8 north
            0xFEFEFEFEFEFEFE00L, // >>> 9 north-west
            0x7F7F7F7F7F7F7F00L  // >>> 7 north-east
    };

    public static final int[] DIRECTION_OFFSETS = {1, 8, 9, 7};

    public static final int DIRECTIONS = 8;

    /* ────────────── Feature cell sets ────────────── */
    public static final int[] CORNER_CELLS = {0, 7, 56, 63};

    /** Cells touching a corner (the classic X- and C-squares). */
    public static final int[] X_CELLS = {1, 6, 8, 9, 14, 15, 48, 49, 54, 55, 57, 62};

    public static final int[] EDGE_CELLS = {
            0, 1, 2, 3, 4, 5, 6, 7,
            8, 16, 24, 32, 40, 48, 56,
            15, 23, 31, 39, 47, 55,
            57, 58, 59, 60, 61, 62, 63
    };

    public static final int[] DIAGONAL_CELLS = {
            0, 9, 18, 27, 36, 45, 54, 63,
            7, 14, 21, 28, 35, 42, 49, 56
    };

    public static final int[] CENTER_4_CELLS = {27, 28, 35, 36};

    public static final int[] INNER_16_CELLS = {
            18, 19, 20, 21,
            26, 27, 28, 29,
            34, 35, 36, 37,
            42, 43, 44, 45
    };

    public static final long CORNERS = maskOf(CORNER_CELLS);
    public static final long X_SQUARES = maskOf(X_CELLS);
    public static final long EDGES = maskOf(EDGE_CELLS);
    public static final long DIAGONALS = maskOf(DIAGONAL_CELLS);
    public static final long CENTER_4 = maskOf(CENTER_4_CELLS);
    public static final long INNER_16 = maskOf(INNER_16_CELLS);

    public static long maskOf(int... cells) {
        long m = 0L;
        for (int c : cells) m |= 1L << c;
        return m;
    }
}
