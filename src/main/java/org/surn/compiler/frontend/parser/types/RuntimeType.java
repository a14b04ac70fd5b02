package org.surn.compiler.frontend.parser.types;

import org.surn.compiler.frontend.parser.ast.Expression;

import java.util.List;

/**
 * A type checked by evaluating an expression at runtime. The parser never produces these yet.
 *
 * @param params The parameters the body is evaluated with.
 * @param body   The predicate expression.
 */
public record RuntimeType(List<TypeParam> params, Expression body) implements TypeKind {

    public RuntimeType {
        params = params == null ? List.of() : List.copyOf(params);
    }
}
