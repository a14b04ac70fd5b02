package org.surn.compiler.frontend.lexer;

/**
 * A line/column location in a source file.
 *
 * @param line   The 1-based line number.
 * @param column The 0-based column, counted in characters since the last line feed.
 */
public record Position(int line, int column) {

    /** The position of the first character of every source. */
    public static final Position START = new Position(1, 0);

    /**
     * Checks whether this position lies before or at the given one.
     * @param other The position to compare with.
     * @return {@code true} if this position is on an earlier line, or on the same line at or before {@code other}.
     */
    public boolean isLeading(Position other) {
        return line < other.line || (line == other.line && column <= other.column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
