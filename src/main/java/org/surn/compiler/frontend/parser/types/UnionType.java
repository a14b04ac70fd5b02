package org.surn.compiler.frontend.parser.types;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A type that may be any of its members, e.g. {@code int | string}.
 *
 * @param types The members in source order.
 */
public record UnionType(List<TypeKind> types) implements TypeKind {

    public UnionType {
        types = List.copyOf(types);
    }

    @Override
    public String toString() {
        return types.stream().map(TypeKind::toString).collect(Collectors.joining(" | "));
    }
}
