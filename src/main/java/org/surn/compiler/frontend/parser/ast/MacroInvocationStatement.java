package org.surn.compiler.frontend.parser.ast;

/**
 * An invocation of a compiler macro.
 *
 * @param macro The invoked macro.
 */
public record MacroInvocationStatement(CompilerMacro macro) implements Statement {
}
