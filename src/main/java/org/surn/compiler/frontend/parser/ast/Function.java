package org.surn.compiler.frontend.parser.ast;

import org.surn.compiler.frontend.parser.types.TypeKind;

import java.util.List;

/**
 * A function or method declaration.
 *
 * @param name       The function name, {@code null} for anonymous functions.
 * @param inputs     The parameters in declaration order.
 * @param returnType The declared return type, {@code null} if none was written.
 * @param body       The body, a {@link BlockStatement}.
 * @param visibility The visibility of the function.
 * @param nodeId     The id of the function within its file.
 */
public record Function(
        String name,
        List<FunctionInput> inputs,
        TypeKind returnType,
        Statement body,
        Visibility visibility,
        long nodeId
) {

    public Function {
        inputs = List.copyOf(inputs);
    }

    /**
     * @param newVisibility The visibility of the copy.
     * @return A copy of this function with another visibility.
     */
    public Function withVisibility(Visibility newVisibility) {
        return new Function(name, inputs, returnType, body, newVisibility, nodeId);
    }

    /**
     * @return {@code true} for functions declared without a name.
     */
    public boolean isAnonymous() {
        return name == null;
    }
}
