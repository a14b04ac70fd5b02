package org.surn.compiler.frontend.parser.ast;

/**
 * Anything that can be evaluated to a value, e.g. {@code x + 1} or {@code some_function()}.
 */
public sealed interface Expression extends AstNode permits
        CallExpression,
        MethodCallExpression,
        NewExpression,
        ArrayExpression,
        ObjectExpression,
        OperationExpression,
        MemberExpression,
        LiteralExpression,
        StatementExpression,
        EndOfLineExpression {
}
