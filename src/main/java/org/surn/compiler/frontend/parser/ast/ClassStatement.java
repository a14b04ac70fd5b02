package org.surn.compiler.frontend.parser.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A class declaration.
 *
 * @param declaration The declared class.
 */
public record ClassStatement(ClassDeclaration declaration) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return declaration.body().methods().stream().map(Function::body).collect(Collectors.toList());
    }
}
