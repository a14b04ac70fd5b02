package org.surn.compiler.frontend.parser.ast;

import org.surn.compiler.frontend.lexer.TextRange;

/**
 * One parsed top-level unit of a source file.
 *
 * @param inner The parsed expression or statement.
 * @param range The characters of the source the unit was parsed from.
 */
public record Node(AstNode inner, TextRange range) {
}
