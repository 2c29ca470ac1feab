package reversi.records;

/**
 * Visit and win totals for one tree entry. {@code wins} counts a draw as half.
 */
public record NodeStats(double visits, double wins) {

    /** Stats of a state nothing has been recorded for. */
    public static final NodeStats EMPTY = new NodeStats(0.0, 0.0);

    /** Optimistic-but-neutral prior for UCB1 on unexplored children. */
    public static final NodeStats COLD_START = new NodeStats(1.0, 0.5);

    public NodeStats plus(NodeStats other) {
        return new NodeStats(visits + other.visits, wins + other.wins);
    }

    public NodeStats visit(double reward) {
        return new NodeStats(visits + 1.0, wins + reward);
    }

    /** Win ratio, 0 when unvisited. */
    public double ratio() {
        return visits > 0.0 ? wins / visits : 0.0;
    }
}
