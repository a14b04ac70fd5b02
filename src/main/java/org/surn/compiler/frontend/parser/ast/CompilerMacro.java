package org.surn.compiler.frontend.parser.ast;

/**
 * A compiler macro invocation such as {@code php! { ... }}. Macros cannot be user defined.
 *
 * @param name The macro name.
 * @param body The raw macro body.
 */
public record CompilerMacro(String name, String body) {
}
