package org.surn.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The members of a class, sorted while parsing.
 *
 * @param properties The instance fields.
 * @param methods    The instance methods.
 * @param other      Static members, imports and macros.
 */
public record ClassBody(List<ClassProperty> properties, List<Function> methods, List<ClassMember> other) {

    public ClassBody {
        properties = List.copyOf(properties);
        methods = List.copyOf(methods);
        other = List.copyOf(other);
    }
}
