package org.surn.compiler.frontend.parser.ast;

import org.surn.compiler.frontend.parser.types.TypeDefinition;

/**
 * A type alias, {@code type Id = int;}.
 *
 * @param definition The alias.
 */
public record TypeDefStatement(TypeDefinition definition) implements Statement {
}
