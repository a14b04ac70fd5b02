package org.surn.compiler;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.surn.compiler.api.CompilationException;
import org.surn.compiler.api.CompilerOptions;
import org.surn.compiler.diagnostics.CompilerLogger;
import org.surn.compiler.diagnostics.Diagnostic;
import org.surn.compiler.frontend.parser.OperatorPolicy;
import org.surn.compiler.frontend.parser.ParseResult;
import org.surn.compiler.frontend.parser.ast.AstBody;
import org.surn.compiler.frontend.parser.ast.OperationExpression;
import org.surn.compiler.frontend.parser.ast.Operator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains integration tests for the {@link Compiler} facade, running sources through
 * tokenizing, token analysis and parsing.
 */
public class CompilerTest {

    /**
     * Verifies that a valid script parses without diagnostics and that its context is released afterwards.
     */
    @Test
    @Tag("unit")
    void testParseScript() {
        // Arrange
        Compiler compiler = new Compiler();

        // Act
        ParseResult result = compiler.parseScript("main.surn", "use std\\io;\nfunction main() { print(\"hi\"); }");

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.body().size()).isEqualTo(2);
        assertThat(compiler.getDiagnostics().getDiagnostics()).isEmpty();
        assertThat(compiler.getContextStore().liveCount()).isZero();
        assertThat(compiler.getContextStore().size()).isEqualTo(1);
    }

    /**
     * Verifies that a syntax error is recorded in the diagnostics with its line number.
     */
    @Test
    @Tag("unit")
    void testSyntaxErrorIsRecorded() {
        // Arrange
        Compiler compiler = new Compiler();

        // Act
        ParseResult result = compiler.parseScript("bad.surn", "var a = 1;\nvar = 2;");

        // Assert
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.body().size()).isEqualTo(1);
        assertThat(compiler.getDiagnostics().getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.ERROR);
            assertThat(d.lineNumber()).isEqualTo(2);
            assertThat(d.fileName()).isEqualTo("bad.surn");
        });
    }

    @Test
    @Tag("unit")
    void testTokenAnalysisWarnings() {
        Compiler compiler = new Compiler();

        compiler.parseScript("warn.surn", "foo(1");

        assertThat(compiler.getDiagnostics().getDiagnostics())
                .extracting(Diagnostic::type)
                .containsExactly(Diagnostic.Type.WARNING, Diagnostic.Type.ERROR);
    }

    @Test
    @Tag("unit")
    void testTokenAnalysisCanBeDisabled() {
        CompilerOptions options = new CompilerOptions(false, false, false, false, false, OperatorPolicy.Kind.LEGACY, 2);
        Compiler compiler = new Compiler(options);

        compiler.parseScript("warn.surn", "foo(1");

        assertThat(compiler.getDiagnostics().getDiagnostics()).extracting(Diagnostic::type).containsExactly(Diagnostic.Type.ERROR);
    }

    @Test
    @Tag("unit")
    void testOperatorPolicyFromOptions() throws CompilationException {
        Compiler compiler = new Compiler(CompilerOptions.defaults().withOperatorPolicy(OperatorPolicy.Kind.PRECEDENCE));

        AstBody body = compiler.parseOrThrow("ops.surn", "a * b + c");

        OperationExpression root = (OperationExpression) body.getProgram().get(0).inner();
        assertThat(root.operator()).isEqualTo(Operator.PLUS);
    }

    /**
     * Verifies that parseOrThrow renders the report of the syntax error into the exception message.
     */
    @Test
    @Tag("unit")
    void testParseOrThrowRendersReport() {
        // Arrange
        Compiler compiler = new Compiler();

        // Act & Assert
        assertThatThrownBy(() -> compiler.parseOrThrow("list.surn", "[1, 2,"))
                .isInstanceOf(CompilationException.class)
                .hasMessageStartingWith("error[E0001]: Array must be closed.")
                .hasMessageContaining("--> list.surn:1:6");
    }

    @Test
    @Tag("unit")
    void testParseOrThrowFailsOnLexicalErrors() {
        Compiler compiler = new Compiler();

        assertThatThrownBy(() -> compiler.parseOrThrow("lex.surn", "var x = 1; @"))
                .isInstanceOf(CompilationException.class)
                .hasMessageStartingWith("error[E0002]: Unexpected character: '@'");
    }

    @Test
    @Tag("unit")
    void testParseFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("app.surn");
        Files.writeString(file, "namespace app;\nclass App { run: bool = true; }");

        ParseResult result = new Compiler().parseFile(file);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.body().size()).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void testParseMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> new Compiler().parseFile(dir.resolve("missing.surn"))).isInstanceOf(IOException.class);
    }

    /**
     * Verifies that the parse summary goes through the compiler logger and honours the verbosity setting.
     */
    @Test
    @Tag("unit")
    void testParseSummaryIsLoggedAtInfoVerbosity() {
        // Arrange
        Logger logger = (Logger) LoggerFactory.getLogger(CompilerLogger.class);
        Level originalLevel = logger.getLevel();
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(Level.TRACE);
        CompilerOptions quiet = new CompilerOptions(true, false, false, false, false, OperatorPolicy.Kind.LEGACY, CompilerLogger.WARN);

        try {
            // Act
            new Compiler().parseScript("main.surn", "var a = 1;\nvar = 2;");
            new Compiler(quiet).parseScript("quiet.surn", "var a = 1;");

            // Assert
            assertThat(appender.list)
                    .filteredOn(event -> event.getLevel() == Level.INFO)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .containsExactly("Parsed main.surn: 1 top-level node(s), stopped by a syntax error.");
        } finally {
            logger.detachAppender(appender);
            logger.setLevel(originalLevel);
            CompilerLogger.setLevel(CompilerLogger.INFO);
        }
    }
}
