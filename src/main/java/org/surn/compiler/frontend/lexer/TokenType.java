package org.surn.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Tokenizer} can recognize.
 */
public enum TokenType {
    // Trivia

    /** A maximal run of whitespace characters, line feeds included. */
    WHITESPACE,
    /** A line comment ({@code // ...}) or a possibly nested block comment ({@code /* ... *}{@code /}). */
    COMMENT,

    // Words and literals

    /** A reserved word, see {@link Keyword}. */
    KEYWORD,
    /** A name that is not a keyword, e.g. {@code foo} or {@code _bar2}. */
    IDENTIFIER,
    /** A numeric literal, e.g. {@code 42} or {@code 3.14}. */
    NUMBER,
    /** A string literal delimited by {@code "}, {@code '} or a backtick. */
    STRING_LITERAL,
    /** {@code true} or {@code false}. */
    BOOLEAN,
    /** A single operator character or one of the word operators {@code and} / {@code or}. */
    OPERATOR,

    // Punctuation

    /** {@code :} */
    COLON,
    /** {@code .} or {@code ::} */
    ACCESSOR,
    /** {@code ..} */
    RANGE,
    /** {@code ;} */
    STATEMENT_END,
    /** {@code ,} */
    COMMA,
    /** {@code \}, the namespace path separator. */
    BACKSLASH,
    /** {@code [} */
    LEFT_BRACKET,
    /** {@code ]} */
    RIGHT_BRACKET,
    /** {@code (} */
    LEFT_PARENTHESIS,
    /** {@code )} */
    RIGHT_PARENTHESIS,
    /** The opening brace. */
    LEFT_BRACE,
    /** The closing brace. */
    RIGHT_BRACE;

    /**
     * @return {@code true} for whitespace and comments, which the parser skips.
     */
    public boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT;
    }
}
