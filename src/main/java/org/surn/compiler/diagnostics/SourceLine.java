package org.surn.compiler.diagnostics;

import org.surn.compiler.frontend.lexer.TextRange;

/**
 * One line of a {@link SourceBuffer}, without its line break.
 *
 * @param offset The offset of the first character of the line in the source.
 * @param length The number of characters on the line.
 * @param lineNumber The 1-based line number.
 * @param text The text of the line.
 */
public record SourceLine(int offset, int length, int lineNumber, String text) {

    /**
     * @return The offset just past the last character of the line.
     */
    public int offsetMax() {
        return offset + length;
    }

    /**
     * @return The text without leading whitespace, as it is displayed in snippets.
     */
    public String trimmed() {
        return text.stripLeading();
    }

    /**
     * @return The number of characters {@link #trimmed()} removes.
     */
    public int leadingWhitespace() {
        return text.length() - trimmed().length();
    }

    /**
     * @return The offset of the first displayed character.
     */
    public int displayOffset() {
        return offset + leadingWhitespace();
    }

    /**
     * Computes how far the start of a range is from the start of the displayed line.
     * The displayed line has its leading whitespace removed, so that whitespace is subtracted.
     * @param range A range starting on this line.
     * @return The number of spaces before the underline, never negative.
     */
    public int spacesUntil(TextRange range) {
        return Math.max(0, range.start() - displayOffset());
    }
}
