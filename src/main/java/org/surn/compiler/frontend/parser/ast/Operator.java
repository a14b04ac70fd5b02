package org.surn.compiler.frontend.parser.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The binary operators of the language.
 * <p>
 * Each operator carries its source symbol, its category and a binding priority. The priority
 * is only consulted by the precedence-climbing policy; higher binds tighter.
 */
public enum Operator {
    ASSIGN("=", Category.ASSIGNMENT, 1),
    ADD_ASSIGN("+=", Category.ASSIGNMENT, 1),
    SUB_ASSIGN("-=", Category.ASSIGNMENT, 1),
    MUL_ASSIGN("*=", Category.ASSIGNMENT, 1),
    DIV_ASSIGN("/=", Category.ASSIGNMENT, 1),
    REM_ASSIGN("%=", Category.ASSIGNMENT, 1),
    BIT_AND_ASSIGN("&=", Category.ASSIGNMENT, 1),
    BIT_OR_ASSIGN("|=", Category.ASSIGNMENT, 1),
    BIT_XOR_ASSIGN("^=", Category.ASSIGNMENT, 1),
    SHL_ASSIGN("<<=", Category.ASSIGNMENT, 1),
    SHR_ASSIGN(">>=", Category.ASSIGNMENT, 1),

    OR("||", Category.LOGICAL, 2),
    AND("&&", Category.LOGICAL, 3),

    BIT_OR("|", Category.BITWISE, 4),
    BIT_XOR("^", Category.BITWISE, 5),
    BIT_AND("&", Category.BITWISE, 6),

    EQUAL("==", Category.COMPARISON, 7),
    LESS_THAN("<", Category.COMPARISON, 8),
    GREATER_THAN(">", Category.COMPARISON, 8),
    LESS_THAN_OR_EQUAL("<=", Category.COMPARISON, 8),
    GREATER_THAN_OR_EQUAL(">=", Category.COMPARISON, 8),

    SHL("<<", Category.BITWISE, 9),
    SHR(">>", Category.BITWISE, 9),

    PLUS("+", Category.ARITHMETIC, 10),
    MINUS("-", Category.ARITHMETIC, 10),
    STAR("*", Category.ARITHMETIC, 11),
    SLASH("/", Category.ARITHMETIC, 11),
    PERCENT("%", Category.ARITHMETIC, 11),

    FLIP("~", Category.BITWISE, 12);

    /**
     * Groups of operators.
     */
    public enum Category {
        ARITHMETIC,
        BITWISE,
        LOGICAL,
        COMPARISON,
        ASSIGNMENT
    }

    private static final Map<String, Operator> BY_SYMBOL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Operator::symbol, Function.identity()));

    private final String symbol;
    private final Category category;
    private final int priority;

    Operator(String symbol, Category category, int priority) {
        this.symbol = symbol;
        this.category = category;
        this.priority = priority;
    }

    /**
     * Resolves an operator from its spelling. The word operators {@code and} and {@code or}
     * resolve to {@link #AND} and {@link #OR}.
     * @param symbol The operator text.
     * @return The operator, or empty if the text is not an operator.
     */
    public static Optional<Operator> fromSymbol(String symbol) {
        if ("and".equals(symbol)) {
            return Optional.of(AND);
        }
        if ("or".equals(symbol)) {
            return Optional.of(OR);
        }
        return Optional.ofNullable(BY_SYMBOL.get(symbol));
    }

    /**
     * @return The source spelling.
     */
    public String symbol() {
        return symbol;
    }

    public Category category() {
        return category;
    }

    public int priority() {
        return priority;
    }

    /**
     * @return {@code true} if chains of this operator group to the right.
     */
    public boolean isRightAssociative() {
        return category == Category.ASSIGNMENT;
    }
}
