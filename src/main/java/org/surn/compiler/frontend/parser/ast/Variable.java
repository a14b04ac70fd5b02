package org.surn.compiler.frontend.parser.ast;

import org.surn.compiler.frontend.parser.types.TypeKind;

/**
 * A {@code var} or {@code const} binding.
 *
 * @param name       The bound name.
 * @param type       The declared type, {@code null} if none was written.
 * @param visibility The visibility of the binding.
 * @param assignment The initializer, {@code null} if the binding starts uninitialized.
 */
public record Variable(String name, TypeKind type, Visibility visibility, Expression assignment) {

    /**
     * @return {@code true} if the binding has no initializer.
     */
    public boolean isUninit() {
        return assignment == null;
    }
}
