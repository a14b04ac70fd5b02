package org.surn.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code return expr;} or {@code return;}.
 *
 * @param expression The returned value, {@code null} for a bare return.
 */
public record ReturnStatement(Expression expression) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return expression == null ? List.of() : List.of(expression);
    }
}
