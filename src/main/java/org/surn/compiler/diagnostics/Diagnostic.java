package org.surn.compiler.diagnostics;

import org.surn.compiler.frontend.lexer.TextRange;

/**
 * A single problem or remark found while compiling a file.
 *
 * @param type The severity of the diagnostic.
 * @param message The diagnostic message.
 * @param fileName The name of the source the issue was found in.
 * @param lineNumber The 1-based line number of the issue.
 * @param range The characters the diagnostic refers to, {@code null} if unknown.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber,
        TextRange range
) {
    /**
     * The severity of a diagnostic.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, fileName, lineNumber, message);
    }
}
