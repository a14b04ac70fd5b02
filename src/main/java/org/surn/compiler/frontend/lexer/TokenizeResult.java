package org.surn.compiler.frontend.lexer;

import java.util.List;

/**
 * The output of a {@link Tokenizer} run.
 *
 * @param tokens The tokens in source order.
 * @param errors The lexical problems found, in source order.
 */
public record TokenizeResult(List<Token> tokens, List<LexicalError> errors) {

    public TokenizeResult {
        tokens = List.copyOf(tokens);
        errors = List.copyOf(errors);
    }

    /**
     * @return {@code true} if at least one lexical problem was found.
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
