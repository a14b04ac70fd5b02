package org.surn.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An immutable binding, {@code const x = 5;}.
 *
 * @param variable The binding.
 */
public record ConstStatement(Variable variable) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return variable.isUninit() ? List.of() : List.of(variable.assignment());
    }
}
