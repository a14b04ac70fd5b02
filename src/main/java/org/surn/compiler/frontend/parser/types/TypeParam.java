package org.surn.compiler.frontend.parser.types;

/**
 * A single generic parameter, e.g. {@code T} in {@code Box<T>}.
 *
 * @param name The parameter name when declared by name, {@code null} for a plain type argument.
 * @param kind The type of the parameter.
 */
public record TypeParam(String name, TypeKind kind) {

    /**
     * @param kind The type argument.
     * @return An unnamed type parameter.
     */
    public static TypeParam of(TypeKind kind) {
        return new TypeParam(null, kind);
    }

    @Override
    public String toString() {
        return name == null ? kind.toString() : name + ": " + kind;
    }
}
