package org.surn.compiler.frontend.parser.ast;

import org.surn.compiler.frontend.parser.types.TypeKind;

/**
 * A field of a class.
 *
 * @param name       The field name.
 * @param visibility The field visibility.
 * @param type       The declared type, {@code null} if none was written.
 * @param assignment The default value, {@code null} if none was written.
 */
public record ClassProperty(String name, Visibility visibility, TypeKind type, Expression assignment) {

    /**
     * @param newVisibility The visibility of the copy.
     * @return A copy of this property with another visibility.
     */
    public ClassProperty withVisibility(Visibility newVisibility) {
        return new ClassProperty(name, newVisibility, type, assignment);
    }
}
