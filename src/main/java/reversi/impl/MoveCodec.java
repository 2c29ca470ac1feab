package reversi.impl;

import reversi.exceptions.MoveParseException;
import reversi.records.Color;
import reversi.records.Move;

/**
 * Referee wire form of a move: {@code "<colour> <column-letter> <row>"} with
 * a 1-based row (e.g. {@code B d 3}), or the bare colour for a pass.
 */
public final class MoveCodec {

    private MoveCodec() {}

    public static String encode(Move move, Color color) {
        if (move.isPass()) return String.valueOf(color.token());
        return color.token() + " " + (char) ('a' + move.col()) + " " + (move.row() + 1);
    }

    public static Move decode(String line) throws MoveParseException {
        if (line == null || line.isBlank()) throw new MoveParseException("empty move line");

        String[] t = line.trim().split("\\s+");
        if (t[0].length() != 1) throw new MoveParseException("missing colour in '" + line + "'");
        try {
            Color.fromToken(t[0].charAt(0));
        } catch (IllegalArgumentException e) {
            throw new MoveParseException("missing colour in '" + line + "'", e);
        }
        if (t.length == 1) return Move.PASS;
        if (t.length < 3) throw new MoveParseException("missing row in '" + line + "'");

        int col = column(t[1]);
        int row;
        try {
            row = Integer.parseInt(t[2]);
        } catch (NumberFormatException e) {
            throw new MoveParseException("row is not a number: '" + t[2] + "'", e);
        }
        if (row < 1 || row > 8) throw new MoveParseException("row out of range: " + row);
        return Move.of(col, row - 1);
    }

    private static int column(String token) throws MoveParseException {
        if (token.length() == 1) {
            char c = Character.toLowerCase(token.charAt(0));
            if (c >= 'a' && c <= 'h') return c - 'a';
        }
        throw new MoveParseException("unknown column: '" + token + "'");
    }
}
