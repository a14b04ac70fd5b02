package org.surn.compiler.frontend.parser;

import org.surn.compiler.frontend.parser.ast.Expression;
import org.surn.compiler.frontend.parser.ast.OperationExpression;
import org.surn.compiler.frontend.parser.ast.Operator;

import java.util.Optional;

/**
 * The language's original operator handling: {@code left OP expression}, where the right side is
 * again a full expression. There is no precedence; chains always nest to the right, so
 * {@code 1 + 2 * 3} is {@code 1 + (2 * 3)} and {@code a * b + c} is {@code a * (b + c)}.
 */
public class RightRecursiveOperatorPolicy implements OperatorPolicy {

    @Override
    public Expression attachOperators(Expression left, ExpressionContext context) throws ParserException {
        Optional<Operator> operator = context.nextOperator();
        if (operator.isEmpty()) {
            return left;
        }
        context.consumeOperator();
        Expression right = context.parseRequiredExpression();
        return new OperationExpression(left, operator.get(), right);
    }
}
