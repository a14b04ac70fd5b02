package org.surn.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A member access, e.g. {@code x.y} or {@code Type::member}. The member side is a full
 * expression, so {@code x.y.z} nests to the right.
 *
 * @param origin The name the member is looked up on, {@code x} in {@code x.y}.
 * @param lookup How the member is looked up.
 * @param member The accessed member, {@code y} in {@code x.y}.
 */
public record MemberExpression(String origin, MemberLookup lookup, Expression member) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(member);
    }
}
