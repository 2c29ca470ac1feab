package reversi.records;

/**
 * Engine settings.
 *
 * @param maxTimeSeconds     total thinking time for the whole game
 * @param log                whether informational logging is enabled
 * @param explorationFactor  UCB1 exploration constant
 */
public record EngineConfig(double maxTimeSeconds, boolean log, double explorationFactor) {

    public static final double DEFAULT_MAX_TIME_SECONDS = 120.0;
    public static final double DEFAULT_EXPLORATION_FACTOR = Math.sqrt(2.0);

    public static EngineConfig defaults() {
        return new EngineConfig(DEFAULT_MAX_TIME_SECONDS, true, DEFAULT_EXPLORATION_FACTOR);
    }

    public long maxTimeMs() {
        return (long) (maxTimeSeconds * 1000.0);
    }
}
