package org.surn.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A mutable binding, {@code var x = 5;}.
 *
 * @param variable The binding.
 */
public record VarStatement(Variable variable) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return variable.isUninit() ? List.of() : List.of(variable.assignment());
    }
}
