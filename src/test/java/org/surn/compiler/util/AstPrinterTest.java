package org.surn.compiler.util;

import org.surn.compiler.Compiler;
import org.surn.compiler.api.CompilationException;
import org.surn.compiler.frontend.parser.ast.AstBody;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the S-expression output of the {@link AstPrinter}.
 */
public class AstPrinterTest {

    private static String dump(String source) throws CompilationException {
        AstBody body = new Compiler().parseOrThrow("print.surn", source);
        return AstPrinter.print(body);
    }

    @Test
    @Tag("unit")
    void testStatementsAndExpressions() throws CompilationException {
        assertThat(dump("var x: int = 1 + 2 * 3;")).isEqualTo("(var x: int (+ 1 (* 2 3)))");
        assertThat(dump("const names: string | array<string> = [\"a\", b];"))
                .isEqualTo("(const names: string | array<string> (array \"a\" b))");
        assertThat(dump("use std\\io;\nnamespace app;")).isEqualTo("(use std\\io)\n(namespace app)");
        assertThat(dump("type Id = int;")).isEqualTo("(type Id int)");
        assertThat(dump("Math::max(1, new Point())")).isEqualTo("(member Math :: (call max 1 (new Point)))");
        assertThat(dump("{ a: 1 }")).isEqualTo("(object (a 1))");
    }

    /**
     * Verifies the dump of a class with each kind of member.
     */
    @Test
    @Tag("unit")
    void testClassDump() throws CompilationException {
        // Arrange
        String source = "class A extends B { x: int; public static function make(): A { return new A(); } }";

        // Act
        String dumped = dump(source);

        // Assert
        assertThat(dumped).isEqualTo("(class A extends B (property private x: int) "
                + "(static public (function public make (): A (block (return (new A))))))");
    }
}
