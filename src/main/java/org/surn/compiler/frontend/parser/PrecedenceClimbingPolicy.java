package org.surn.compiler.frontend.parser;

import org.surn.compiler.frontend.parser.ast.Expression;
import org.surn.compiler.frontend.parser.ast.OperationExpression;
import org.surn.compiler.frontend.parser.ast.Operator;

import java.util.Optional;

/**
 * Attaches operators by precedence climbing over {@link Operator#priority()}. Operators of equal
 * priority group to the left, except assignments which group to the right, so
 * {@code a * b + c} is {@code (a * b) + c} and {@code a = b = c} is {@code a = (b = c)}.
 */
public class PrecedenceClimbingPolicy implements OperatorPolicy {

    @Override
    public Expression attachOperators(Expression left, ExpressionContext context) throws ParserException {
        return climb(left, 0, context);
    }

    private Expression climb(Expression left, int minPriority, ExpressionContext context) throws ParserException {
        Optional<Operator> operator = context.nextOperator();
        while (operator.isPresent() && operator.get().priority() >= minPriority) {
            Operator current = operator.get();
            context.consumeOperator();
            Expression right = context.parseOperand();

            Optional<Operator> lookahead = context.nextOperator();
            while (lookahead.isPresent() && bindsTighter(lookahead.get(), current)) {
                int nextMin = lookahead.get().priority() > current.priority()
                        ? current.priority() + 1
                        : current.priority();
                right = climb(right, nextMin, context);
                lookahead = context.nextOperator();
            }

            left = new OperationExpression(left, current, right);
            operator = context.nextOperator();
        }
        return left;
    }

    private static boolean bindsTighter(Operator next, Operator current) {
        return next.priority() > current.priority()
                || (next.isRightAssociative() && next.priority() == current.priority());
    }
}
