package org.surn.compiler.frontend.parser;

import org.surn.compiler.frontend.lexer.TextRange;

/**
 * A structural parse error: a production committed to a construct and a required
 * continuation was missing.
 *
 * @param message The human readable description.
 * @param label   A short hint shown inline under the offending source, may be {@code null}.
 * @param range   The offending characters.
 */
public record ParseError(String message, String label, TextRange range) {

    @Override
    public String toString() {
        return String.format("%s (%s)", message, range);
    }
}
