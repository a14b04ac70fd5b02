package org.surn.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Tokenizer}.
 *
 * @param type     The type of the token.
 * @param keyword  The keyword for {@link TokenType#KEYWORD} tokens, {@code null} otherwise.
 * @param range    The characters of the source this token covers.
 * @param value    The literal text of the token, or {@code null} for keywords and single-character punctuation.
 *                 String literals carry their content without the delimiters.
 * @param position The line/column at which the token begins.
 */
public record Token(
        TokenType type,
        Keyword keyword,
        TextRange range,
        String value,
        Position position
) {

    /**
     * @param expected The type to compare with.
     * @return {@code true} if this token has the given type.
     */
    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * @param expected The keyword to compare with.
     * @return {@code true} if this token is the given keyword.
     */
    public boolean isKeyword(Keyword expected) {
        return type == TokenType.KEYWORD && keyword == expected;
    }

    /**
     * @return {@code true} for whitespace and comment tokens.
     */
    public boolean isTrivia() {
        return type.isTrivia();
    }

    /**
     * @return The value, or the keyword spelling for keywords, or an empty string.
     */
    public String text() {
        if (value != null) {
            return value;
        }
        return keyword != null ? keyword.text() : "";
    }
}
