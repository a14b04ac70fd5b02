package org.surn.compiler.frontend.parser.ast;

import org.surn.compiler.frontend.parser.types.TypeKind;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An object literal, e.g. {@code { key: "value" }}.
 *
 * @param properties The properties in source order.
 * @param type       The object type, {@code null} for anonymous objects.
 */
public record ObjectExpression(List<ObjectProperty> properties, TypeKind type) implements Expression {

    public ObjectExpression {
        properties = List.copyOf(properties);
    }

    @Override
    public List<AstNode> getChildren() {
        return properties.stream().map(ObjectProperty::value).collect(Collectors.toList());
    }
}
