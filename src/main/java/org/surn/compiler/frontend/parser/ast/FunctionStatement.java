package org.surn.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A function declaration.
 *
 * @param function The declared function.
 */
public record FunctionStatement(Function function) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(function.body());
    }
}
