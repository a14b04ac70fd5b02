package org.surn.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A statement used where an expression is expected, e.g. a declaration inside a block.
 *
 * @param statement The wrapped statement.
 */
public record StatementExpression(Statement statement) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(statement);
    }
}
