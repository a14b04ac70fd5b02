package org.surn.compiler.frontend.lexer;

/**
 * A problem found while tokenizing. Tokenizing never stops on these; they are collected
 * and handed to the caller next to the tokens.
 *
 * @param kind     What went wrong.
 * @param message  A human readable description.
 * @param range    The characters involved.
 * @param position The line/column of the first character involved.
 */
public record LexicalError(Kind kind, String message, TextRange range, Position position) {

    /**
     * The kinds of lexical problems.
     */
    public enum Kind {
        /** A character that starts no token and was skipped. */
        UNKNOWN_CHARACTER,
        /** A string literal without a closing delimiter. */
        UNTERMINATED_STRING,
        /** A block comment without a closing {@code *}{@code /}. */
        UNTERMINATED_COMMENT
    }

    @Override
    public String toString() {
        return String.format("%s at %s: %s", kind, position, message);
    }
}
