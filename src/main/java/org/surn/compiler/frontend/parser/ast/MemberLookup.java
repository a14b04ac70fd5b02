package org.surn.compiler.frontend.parser.ast;

/**
 * The kinds of member access.
 */
public enum MemberLookup {
    /** {@code Type::member} */
    STATIC,
    /** {@code value.member} */
    DYNAMIC,
    /** {@code value[index]} */
    INDEX
}
