package org.surn.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A statement prefixed with {@code static}, e.g. {@code public static var count = 0;}.
 *
 * @param visibility The visibility written before {@code static}, {@link Visibility#PRIVATE} if none.
 * @param statement  The wrapped statement.
 */
public record StaticStatement(Visibility visibility, Statement statement) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(statement);
    }
}
