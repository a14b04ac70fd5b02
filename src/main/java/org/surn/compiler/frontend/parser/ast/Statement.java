package org.surn.compiler.frontend.parser.ast;

/**
 * A declaration or control construct that does not produce a value by itself.
 */
public sealed interface Statement extends AstNode permits
        VarStatement,
        ConstStatement,
        StaticStatement,
        FunctionStatement,
        ClassStatement,
        BlockStatement,
        ImportStatement,
        NamespaceStatement,
        TypeDefStatement,
        ReturnStatement,
        MacroInvocationStatement {
}
