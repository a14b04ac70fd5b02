package org.surn.compiler.api;

import org.surn.compiler.diagnostics.DiagnosticsEngine;
import org.surn.compiler.frontend.parser.ParseResult;
import org.surn.compiler.frontend.parser.ast.AstBody;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Defines the public interface of the Surn compiler front end.
 */
public interface ICompiler {

    /**
     * Parses an in-memory source.
     *
     * @param name A name for the source, used in diagnostics.
     * @param source The source code.
     * @return The parsed body; on failure the partial body together with the error.
     */
    ParseResult parseScript(String name, String source);

    /**
     * Parses a source file.
     *
     * @param path The file to parse.
     * @return The parsed body; on failure the partial body together with the error.
     * @throws IOException if the file cannot be read.
     */
    ParseResult parseFile(Path path) throws IOException;

    /**
     * Parses an in-memory source and requires it to be free of errors.
     *
     * @param name A name for the source, used in diagnostics.
     * @param source The source code.
     * @return The complete body.
     * @throws CompilationException if a lexical or syntax error was found.
     */
    AstBody parseOrThrow(String name, String source) throws CompilationException;

    /**
     * @return The diagnostics collected by all calls so far.
     */
    DiagnosticsEngine getDiagnostics();
}
