package org.surn.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code namespace a\b;} or {@code namespace a { ... };}.
 *
 * @param namespace The declared namespace.
 */
public record NamespaceStatement(Namespace namespace) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return namespace.body() == null ? List.of() : List.of(namespace.body());
    }
}
