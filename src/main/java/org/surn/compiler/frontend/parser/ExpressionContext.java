package org.surn.compiler.frontend.parser;

import org.surn.compiler.frontend.parser.ast.Expression;
import org.surn.compiler.frontend.parser.ast.Operator;

import java.util.Optional;

/**
 * The parser services an {@link OperatorPolicy} needs to attach trailing operators to an operand,
 * without coupling the policy to the parser implementation.
 */
public interface ExpressionContext {

    /**
     * Looks past whitespace and comments for a binary operator without consuming anything.
     * Directly adjacent operator characters are read as one operator when they spell one, e.g. {@code ==}.
     * @return The next operator, or empty if the next token is not an operator.
     */
    Optional<Operator> nextOperator();

    /**
     * Consumes the operator returned by the last {@link #nextOperator()} call, and any whitespace before it.
     */
    void consumeOperator();

    /**
     * Parses a single operand without attaching any trailing operator.
     * @return The operand.
     * @throws ParserException if no operand follows.
     */
    Expression parseOperand() throws ParserException;

    /**
     * Parses a complete expression, trailing operators included.
     * @return The expression.
     * @throws ParserException if no expression follows.
     */
    Expression parseRequiredExpression() throws ParserException;
}
