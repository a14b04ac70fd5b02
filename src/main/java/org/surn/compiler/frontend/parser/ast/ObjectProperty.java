package org.surn.compiler.frontend.parser.ast;

/**
 * One {@code name: value} entry of an object literal.
 *
 * @param name  The property name.
 * @param value The property value.
 */
public record ObjectProperty(String name, Expression value) {
}
