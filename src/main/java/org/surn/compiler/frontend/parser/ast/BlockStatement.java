package org.surn.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A braced sequence of expressions, e.g. a function body.
 *
 * @param body The expressions in source order. Statements appear wrapped in {@link StatementExpression}.
 */
public record BlockStatement(List<Expression> body) implements Statement {

    public BlockStatement {
        body = List.copyOf(body);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(body);
    }
}
