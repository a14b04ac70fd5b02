package org.surn.compiler.frontend.parser.ast;

/**
 * A member of a class body that is not a plain property or method: static members,
 * imports and macros. Properties and methods are wrapped only when nested in {@link Static}.
 */
public sealed interface ClassMember {

    /**
     * @param property The wrapped property.
     */
    record Property(ClassProperty property) implements ClassMember {
    }

    /**
     * @param method The wrapped method.
     */
    record Method(Function method) implements ClassMember {
    }

    /**
     * @param macro The invoked macro.
     */
    record Macro(CompilerMacro macro) implements ClassMember {
    }

    /**
     * @param path The imported path, {@code use a\b;}.
     */
    record Import(Path path) implements ClassMember {
    }

    /**
     * A member declared {@code static}.
     *
     * @param visibility The visibility written before {@code static}.
     * @param member     The static member.
     */
    record Static(Visibility visibility, ClassMember member) implements ClassMember {
    }
}
