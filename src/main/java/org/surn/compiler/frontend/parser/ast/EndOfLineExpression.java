package org.surn.compiler.frontend.parser.ast;

/**
 * A lone {@code ;}.
 */
public record EndOfLineExpression() implements Expression {
}
