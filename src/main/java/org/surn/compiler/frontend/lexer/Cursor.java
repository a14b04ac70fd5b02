package org.surn.compiler.frontend.lexer;

/**
 * A character-level scanner over an immutable source string.
 * <p>
 * The cursor tracks the offset of the next unread character and its line/column
 * {@link Position}. Lookahead is unlimited and never consumes; reading past the
 * end yields {@link #END_OF_FILE} instead of failing.
 */
public class Cursor {

    /** Sentinel returned by every lookup past the end of the source. */
    public static final char END_OF_FILE = '\0';

    /**
     * A predicate over a single character.
     */
    @FunctionalInterface
    public interface CharPredicate {
        /**
         * @param c The character to test.
         * @return {@code true} to keep consuming.
         */
        boolean test(char c);
    }

    /**
     * A predicate that may inspect and consume from the cursor itself.
     * Used for constructs whose end marker spans more than one character.
     */
    @FunctionalInterface
    public interface CursorPredicate {
        /**
         * @param cursor The cursor being consumed.
         * @param c The next, not yet consumed character.
         * @return {@code true} to consume {@code c} and continue.
         */
        boolean test(Cursor cursor, char c);
    }

    private final String source;
    private int offset = 0;
    private int line = 1;
    private int column = 0;
    private char previous = END_OF_FILE;

    /**
     * Creates a cursor positioned at the first character of the source.
     * @param source The source text.
     */
    public Cursor(String source) {
        this.source = source;
    }

    /**
     * @return The next character without consuming it.
     */
    public char first() {
        return nthChar(0);
    }

    /**
     * @return The character after the next one without consuming anything.
     */
    public char second() {
        return nthChar(1);
    }

    /**
     * Looks ahead {@code n} characters without consuming.
     * @param n The distance from the next character, 0 being the next character.
     * @return The character, or {@link #END_OF_FILE} past the end.
     */
    public char nthChar(int n) {
        int index = offset + n;
        if (n < 0 || index >= source.length()) {
            return END_OF_FILE;
        }
        return source.charAt(index);
    }

    /**
     * Consumes the next character and updates the position.
     * @return The consumed character, or {@link #END_OF_FILE} if the cursor is exhausted.
     */
    public char peek() {
        if (isEof()) {
            return END_OF_FILE;
        }
        char c = source.charAt(offset++);
        if (c == '\n') {
            line++;
            column = 0;
        } else {
            column++;
        }
        previous = c;
        return c;
    }

    /**
     * Consumes {@code n} characters, stopping early at the end of the source.
     * @param n The number of characters to consume.
     */
    public void advance(int n) {
        for (int i = 0; i < n && !isEof(); i++) {
            peek();
        }
    }

    /**
     * Consumes the maximal run of characters matching the predicate.
     * @param predicate The predicate.
     * @return The consumed text, empty if the next character does not match.
     */
    public String eatWhile(CharPredicate predicate) {
        int begin = offset;
        while (!isEof() && predicate.test(first())) {
            peek();
        }
        return source.substring(begin, offset);
    }

    /**
     * Consumes characters while the predicate holds. The predicate receives this cursor
     * and may consume further characters before answering.
     * @param predicate The predicate.
     * @return Everything consumed, including characters consumed by the predicate.
     */
    public String eatWhileCursor(CursorPredicate predicate) {
        int begin = offset;
        while (!isEof() && predicate.test(this, first())) {
            peek();
        }
        return source.substring(begin, offset);
    }

    /**
     * @return {@code true} once every character has been consumed.
     */
    public boolean isEof() {
        return offset >= source.length();
    }

    /**
     * @return The position of the next unread character.
     */
    public Position getPosition() {
        return new Position(line, column);
    }

    /**
     * @return The number of characters consumed so far.
     */
    public int getOffset() {
        return offset;
    }

    /**
     * @return The last consumed character, or {@link #END_OF_FILE} before the first read.
     */
    public char getPrevious() {
        return previous;
    }

    /**
     * @return The text this cursor scans.
     */
    public String getSource() {
        return source;
    }
}
