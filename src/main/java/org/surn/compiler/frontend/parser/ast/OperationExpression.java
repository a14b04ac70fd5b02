package org.surn.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A binary operation, e.g. {@code 1 + 2}.
 *
 * @param left     The left operand.
 * @param operator The operator.
 * @param right    The right operand.
 */
public record OperationExpression(Expression left, Operator operator, Expression right) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
