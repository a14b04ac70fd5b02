package org.surn.compiler.frontend.parser.ast;

import org.surn.compiler.frontend.parser.types.TypeKind;

/**
 * One parameter of a function.
 *
 * @param name The parameter name.
 * @param type The parameter type, {@code null} if none was written.
 */
public record FunctionInput(String name, TypeKind type) {
}
