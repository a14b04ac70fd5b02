package org.surn.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A class declaration.
 *
 * @param name       The class name.
 * @param superclass The extended class, {@code null} if none.
 * @param interfaces The implemented interfaces, {@code null} if there is no {@code implements} clause.
 * @param body       The members.
 * @param nodeId     The id of the class within its file.
 */
public record ClassDeclaration(String name, String superclass, List<String> interfaces, ClassBody body, long nodeId) {

    public ClassDeclaration {
        interfaces = interfaces == null ? null : List.copyOf(interfaces);
    }
}
