package org.surn.compiler.diagnostics;

import org.surn.compiler.frontend.lexer.TextRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of a compilation so that the tokenizer, the analyzers and the
 * parser do not print anything themselves.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message    The error message.
     * @param fileName   The file in which the error occurred.
     * @param lineNumber The line number of the error.
     * @param range      The offending characters, may be {@code null}.
     */
    public void reportError(String message, String fileName, int lineNumber, TextRange range) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, fileName, lineNumber, range));
    }

    /**
     * Reports a warning.
     *
     * @param message    The warning message.
     * @param fileName   The file in which the warning occurred.
     * @param lineNumber The line number of the warning.
     * @param range      The offending characters, may be {@code null}.
     */
    public void reportWarning(String message, String fileName, int lineNumber, TextRange range) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, fileName, lineNumber, range));
    }

    /**
     * @return {@code true} if at least one error was reported.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return {@code true} if at least one warning was reported.
     */
    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.WARNING);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
