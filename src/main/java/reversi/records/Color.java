package reversi.records;

/**
 * Disc colour. Black always moves first.
 */
public enum Color {
    BLACK('B'),
    WHITE('W');

    private final char token;

    Color(char token) {
        this.token = token;
    }

    public Color opponent() {
        return this == BLACK ? WHITE : BLACK;
    }

    /** Single-letter form used on the referee wire ({@code B} / {@code W}). */
    public char token() {
        return token;
    }

    public static Color fromToken(char c) {
        return switch (Character.toUpperCase(c)) {
            case 'B' -> BLACK;
            case 'W' -> WHITE;
            default -> throw new IllegalArgumentException("Unknown colour token: " + c);
        };
    }

    @Override
    public String toString() {
        return String.valueOf(token);
    }
}
