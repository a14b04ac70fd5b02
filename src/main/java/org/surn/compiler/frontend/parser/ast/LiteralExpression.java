package org.surn.compiler.frontend.parser.ast;

import org.surn.compiler.frontend.parser.types.TypeKind;

/**
 * A literal value or a plain name, e.g. {@code 1}, {@code "hello"}, {@code true} or {@code x}.
 *
 * @param value The literal text; string literals without their delimiters.
 * @param kind  What kind of token the literal was parsed from.
 * @param type  The type assumed by the compiler, {@code null} after parsing.
 */
public record LiteralExpression(String value, LiteralKind kind, TypeKind type) implements Expression {

    /**
     * @param value The literal text.
     * @param kind The literal kind.
     * @return An untyped literal.
     */
    public static LiteralExpression of(String value, LiteralKind kind) {
        return new LiteralExpression(value, kind, null);
    }
}
