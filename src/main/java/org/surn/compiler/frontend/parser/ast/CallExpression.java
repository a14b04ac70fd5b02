package org.surn.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A call of a named function, e.g. {@code some_function(1, 2)}.
 *
 * @param name      The called function.
 * @param arguments The argument expressions.
 */
public record CallExpression(String name, List<Expression> arguments) implements Expression {

    public CallExpression {
        arguments = List.copyOf(arguments);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(arguments);
    }
}
