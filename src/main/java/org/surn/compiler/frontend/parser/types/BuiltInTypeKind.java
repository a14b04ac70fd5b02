package org.surn.compiler.frontend.parser.types;

/**
 * A type defined by the language, e.g. {@code int}.
 *
 * @param type The built-in type.
 */
public record BuiltInTypeKind(BuiltInType type) implements TypeKind {

    @Override
    public String toString() {
        return type.typeName();
    }
}
