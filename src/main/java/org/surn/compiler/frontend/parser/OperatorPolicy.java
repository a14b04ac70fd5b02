package org.surn.compiler.frontend.parser;

import org.surn.compiler.frontend.parser.ast.Expression;

/**
 * Decides how binary operators following an operand are attached to it.
 *
 * @see RightRecursiveOperatorPolicy
 * @see PrecedenceClimbingPolicy
 */
public interface OperatorPolicy {

    /**
     * Attaches every operator that follows {@code left}.
     * @param left The operand already parsed.
     * @param context Access to the tokens after the operand.
     * @return {@code left} itself if no operator follows, otherwise the operation tree.
     * @throws ParserException if an operator is not followed by an operand.
     */
    Expression attachOperators(Expression left, ExpressionContext context) throws ParserException;

    /**
     * The operator handling selectable through configuration.
     */
    enum Kind {
        /** {@link RightRecursiveOperatorPolicy} */
        LEGACY,
        /** {@link PrecedenceClimbingPolicy} */
        PRECEDENCE;

        /**
         * @return A new policy of this kind.
         */
        public OperatorPolicy create() {
            return this == PRECEDENCE ? new PrecedenceClimbingPolicy() : new RightRecursiveOperatorPolicy();
        }
    }
}
