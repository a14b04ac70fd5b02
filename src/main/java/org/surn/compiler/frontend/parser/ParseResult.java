package org.surn.compiler.frontend.parser;

import org.surn.compiler.frontend.parser.ast.AstBody;

import java.util.Optional;

/**
 * The outcome of parsing one file. On failure the body holds every node parsed before the error.
 *
 * @param body  The parsed nodes; complete on success, partial on failure.
 * @param error The error that stopped parsing, {@code null} on success.
 */
public record ParseResult(AstBody body, ParseError error) {

    /**
     * @param body The parsed file.
     * @return A successful result.
     */
    public static ParseResult success(AstBody body) {
        return new ParseResult(body, null);
    }

    /**
     * @param partial The nodes parsed before the error.
     * @param error The error.
     * @return A failed result.
     */
    public static ParseResult failure(AstBody partial, ParseError error) {
        return new ParseResult(partial, error);
    }

    /**
     * @return {@code true} if the whole file was parsed.
     */
    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return The error, or empty on success.
     */
    public Optional<ParseError> getError() {
        return Optional.ofNullable(error);
    }
}
