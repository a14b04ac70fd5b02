package org.surn.compiler.frontend.lexer;

/**
 * A half-open span {@code [start, end)} of character offsets into a source string.
 * <p>
 * Offsets count UTF-16 code units, which equal byte offsets for ASCII sources.
 *
 * @param start The offset of the first character.
 * @param end   The offset after the last character.
 */
public record TextRange(int start, int end) {

    public TextRange {
        if (start < 0) {
            throw new IllegalArgumentException("Range start must not be negative: " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException("Range end " + end + " is before its start " + start);
        }
    }

    /**
     * Creates a range covering a single offset.
     * @param offset The offset.
     * @return A range of length one starting at {@code offset}.
     */
    public static TextRange at(int offset) {
        return new TextRange(offset, offset + 1);
    }

    /**
     * Creates the smallest range covering both given ranges.
     * @param first The first range.
     * @param last The second range.
     * @return The combined range.
     */
    public static TextRange between(TextRange first, TextRange last) {
        return new TextRange(Math.min(first.start, last.start), Math.max(first.end, last.end));
    }

    /**
     * @param other The range to include.
     * @return The smallest range covering this and {@code other}.
     */
    public TextRange combine(TextRange other) {
        return between(this, other);
    }

    /**
     * @return The number of characters covered.
     */
    public int length() {
        return end - start;
    }

    /**
     * @param offset The offset to test.
     * @return {@code true} if the offset lies within {@code [start, end)}.
     */
    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
