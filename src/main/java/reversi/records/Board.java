package reversi.records;

import reversi.constants.BoardConstants;

/**
 * Immutable bitboard: one 64-bit occupancy mask per colour.
 *
 * <p>Bit {@code i} is the cell at {@code row = i / 8}, {@code col = i % 8};
 * bit 0 is a1 (top-left), bit 63 is h8.</p>
 *
 * @param black occupancy of the black discs
 * @param white occupancy of the white discs
 */
public record Board(long black, long white) {

    public Board {
        if ((black & white) != 0) {
            throw new IllegalArgumentException(
                    "black and white overlap: " + Long.toHexString(black & white));
        }
    }

    /** The standard four-disc opening position. */
    public static Board initial() {
        return new Board(BoardConstants.BLACK_START, BoardConstants.WHITE_START);
    }

    public long discs(Color c) {
        return c == Color.BLACK ? black : white;
    }

    public long occupied() {
        return black | white;
    }

    public long empty() {
        return ~(black | white);
    }

    public int count(Color c) {
        return Long.bitCount(discs(c));
    }

    /** Returns a board with {@code mover}'s and the opponent's masks replaced. */
    public static Board of(Color mover, long own, long opponent) {
        return mover == Color.BLACK ? new Board(own, opponent) : new Board(opponent, own);
    }
}
