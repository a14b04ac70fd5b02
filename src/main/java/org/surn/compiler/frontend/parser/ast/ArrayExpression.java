package org.surn.compiler.frontend.parser.ast;

import org.surn.compiler.frontend.parser.types.TypeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * An array literal, e.g. {@code [1, 2, 3]}.
 *
 * @param values The element expressions.
 * @param type   The element type once known, {@code null} after parsing.
 */
public record ArrayExpression(List<Expression> values, TypeKind type) implements Expression {

    public ArrayExpression {
        values = List.copyOf(values);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(values);
    }
}
