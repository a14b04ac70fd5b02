package org.surn.compiler.frontend.parser.types;

import java.util.List;

/**
 * A named type alias, e.g. {@code type Id<T> = int | T;}.
 *
 * @param name   The alias name.
 * @param params The generic parameters of the alias, empty if none.
 * @param kind   The aliased type.
 */
public record TypeDefinition(String name, List<TypeParam> params, TypeKind kind) {

    public TypeDefinition {
        params = params == null ? List.of() : List.copyOf(params);
    }
}
