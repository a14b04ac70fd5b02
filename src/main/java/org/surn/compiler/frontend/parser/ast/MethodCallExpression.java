package org.surn.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A call of a method on a value, e.g. {@code x.method()}.
 *
 * @param callee    The value the method is called on.
 * @param name      The method name.
 * @param arguments The argument expressions.
 */
public record MethodCallExpression(Expression callee, String name, List<Expression> arguments) implements Expression {

    public MethodCallExpression {
        arguments = List.copyOf(arguments);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(callee);
        children.addAll(arguments);
        return children;
    }
}
