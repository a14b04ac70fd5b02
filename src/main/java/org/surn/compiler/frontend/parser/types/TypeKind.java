package org.surn.compiler.frontend.parser.types;

import java.util.List;
import java.util.Optional;

/**
 * A type as written in a declaration: a built-in type, a reference to a named type,
 * a union of types, or a type evaluated at runtime.
 */
public sealed interface TypeKind permits BuiltInTypeKind, ReferenceType, UnionType, RuntimeType {

    /**
     * Creates the type for a name as it appears in source code. Names of built-in types
     * become {@link BuiltInTypeKind} when no generic parameters are given.
     * @param name The type name.
     * @param params The generic parameters, may be empty.
     * @return The type.
     */
    static TypeKind named(String name, List<TypeParam> params) {
        if (params.isEmpty()) {
            Optional<BuiltInType> builtIn = BuiltInType.fromName(name);
            if (builtIn.isPresent()) {
                return new BuiltInTypeKind(builtIn.get());
            }
        }
        return new ReferenceType(name, params);
    }
}
