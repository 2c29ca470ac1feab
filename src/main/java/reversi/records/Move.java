package reversi.records;

/**
 * Either a placement on one of the 64 cells or a pass.
 *
 * @param cell {@code row * 8 + col} for a placement, {@code -1} for {@link #PASS}
 */
public record Move(int cell) {

    public static final Move PASS = new Move(-1);

    public Move {
        if (cell < -1 || cell > 63) {
            throw new IllegalArgumentException("cell out of range: " + cell);
        }
    }

    public static Move at(int cell) {
        if (cell < 0) throw new IllegalArgumentException("not a board cell: " + cell);
        return new Move(cell);
    }

    /** 0-indexed column and row. */
    public static Move of(int col, int row) {
        if (col < 0 || col > 7 || row < 0 || row > 7) {
            throw new IllegalArgumentException("col/row out of range: " + col + "," + row);
        }
        return new Move(row * 8 + col);
    }

    public boolean isPass() {
        return cell < 0;
    }

    public int col() {
        requirePlacement();
        return cell & 7;
    }

    public int row() {
        requirePlacement();
        return cell >>> 3;
    }

    /** Single-bit mask of the target cell, 0 for a pass. */
    public long mask() {
        return isPass() ? 0L : 1L << cell;
    }

    private void requirePlacement() {
        if (isPass()) throw new IllegalStateException("pass has no coordinates");
    }

    @Override
    public String toString() {
        return isPass() ? "pass" : "" + (char) ('a' + col()) + (row() + 1);
    }
}
