package org.surn.compiler.frontend.parser.ast;

/**
 * The token kinds a {@link LiteralExpression} can be parsed from.
 */
public enum LiteralKind {
    IDENTIFIER,
    NUMBER,
    STRING,
    BOOLEAN
}
