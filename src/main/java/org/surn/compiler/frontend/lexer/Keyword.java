package org.surn.compiler.frontend.lexer;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The reserved words of the language.
 */
public enum Keyword {
    NAMESPACE("namespace"),
    CONST("const"),
    VAR("var"),
    CLASS("class"),
    INTERFACE("interface"),
    TYPE("type"),
    FUNCTION("function"),
    IF("if"),
    ELSE("else"),
    PUBLIC("public"),
    PRIVATE("private"),
    PROTECTED("protected"),
    STATIC("static"),
    RETURN("return"),
    BREAK("break"),
    CONTINUE("continue"),
    FOR("for"),
    WHILE("while"),
    DO("do"),
    NEW("new"),
    DROP("drop"),
    USE("use"),
    EXTENDS("extends"),
    IMPLEMENTS("implements");

    /** Upper bound for the length of any keyword; longer words are never keywords. */
    public static final int MAX_LENGTH = 10;

    private static final Map<String, Keyword> BY_TEXT = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Keyword::text, Function.identity()));

    private final String text;

    Keyword(String text) {
        this.text = text;
    }

    /**
     * @return The source spelling of the keyword.
     */
    public String text() {
        return text;
    }

    /**
     * Looks up a keyword by its spelling.
     * @param text The word.
     * @return The keyword, or empty if the word is not reserved.
     */
    public static Optional<Keyword> fromText(String text) {
        return Optional.ofNullable(BY_TEXT.get(text));
    }

    /**
     * @return {@code true} for {@code public}, {@code private} and {@code protected}.
     */
    public boolean isVisibility() {
        return this == PUBLIC || this == PRIVATE || this == PROTECTED;
    }
}
