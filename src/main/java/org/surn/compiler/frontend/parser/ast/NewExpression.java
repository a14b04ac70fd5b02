package org.surn.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A construction of a new instance, e.g. {@code new Point(1, 2)}.
 *
 * @param name      The constructed class.
 * @param arguments The constructor arguments.
 */
public record NewExpression(String name, List<Expression> arguments) implements Expression {

    public NewExpression {
        arguments = List.copyOf(arguments);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(arguments);
    }
}
