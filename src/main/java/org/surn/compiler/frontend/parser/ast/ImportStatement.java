package org.surn.compiler.frontend.parser.ast;

/**
 * {@code use a\b;}.
 *
 * @param path The imported path.
 */
public record ImportStatement(Path path) implements Statement {
}
