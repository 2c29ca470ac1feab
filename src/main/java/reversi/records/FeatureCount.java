package reversi.records;

/**
 * Number of cells of some fixed set held by each colour.
 */
public record FeatureCount(int black, int white) {

    public int of(Color c) {
        return c == Color.BLACK ? black : white;
    }

    /** {@code own - opponent} from {@code perspective}'s point of view. */
    public int differential(Color perspective) {
        return of(perspective) - of(perspective.opponent());
    }
}
