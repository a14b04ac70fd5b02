package org.surn.compiler.frontend.parser.types;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A reference to a type defined elsewhere, with optional generic parameters,
 * e.g. {@code Map<string, int>}.
 *
 * @param name   The referenced type name.
 * @param params The generic parameters, empty if none were given.
 */
public record ReferenceType(String name, List<TypeParam> params) implements TypeKind {

    public ReferenceType {
        params = params == null ? List.of() : List.copyOf(params);
    }

    @Override
    public String toString() {
        if (params.isEmpty()) {
            return name;
        }
        return name + params.stream().map(TypeParam::toString).collect(Collectors.joining(", ", "<", ">"));
    }
}
