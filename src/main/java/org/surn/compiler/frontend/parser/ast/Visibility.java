package org.surn.compiler.frontend.parser.ast;

import org.surn.compiler.frontend.lexer.Keyword;

import java.util.Optional;

/**
 * Who can see a declaration.
 */
public enum Visibility {
    /** Every module can see this. */
    PUBLIC,
    /** Only the current scope can see this. */
    PRIVATE,
    /** The current scope and its children can see this. */
    PROTECTED,
    /** Only the current module can see this. Never written in source. */
    MODULE;

    /**
     * @param keyword A keyword.
     * @return The visibility the keyword declares, or empty for any other keyword.
     */
    public static Optional<Visibility> fromKeyword(Keyword keyword) {
        switch (keyword) {
            case PUBLIC: return Optional.of(PUBLIC);
            case PRIVATE: return Optional.of(PRIVATE);
            case PROTECTED: return Optional.of(PROTECTED);
            default: return Optional.empty();
        }
    }
}
