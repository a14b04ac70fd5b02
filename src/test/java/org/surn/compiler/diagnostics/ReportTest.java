package org.surn.compiler.diagnostics;

import org.surn.compiler.frontend.context.SourceOrigin;
import org.surn.compiler.frontend.lexer.TextRange;
import org.surn.compiler.frontend.parser.ParseError;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for {@link Report} and the {@link DiagnosticsEngine}.
 */
public class ReportTest {

    /**
     * Verifies that a parse error turns into a report with a headline and one snippet.
     */
    @Test
    @Tag("unit")
    void testFromParseError() {
        // Arrange
        String source = "[1, 2,";
        ParseError error = new ParseError("Array must be closed.", null, new TextRange(5, 6));

        // Act
        Report report = Report.fromParseError(error, SourceOrigin.ofVirtual("list.surn", source), source);
        String rendered = report.render();

        // Assert
        assertThat(report.getKind()).isEqualTo(ReportKind.ERROR);
        assertThat(report.getSnippets()).hasSize(1);
        assertThat(rendered.split("\n")).containsExactly(
                "error[E0001]: Array must be closed.",
                " --> list.surn:1:6",
                "  |",
                "1 | [1, 2,",
                "  |      ~ Array must be closed.",
                "Err | ---> Array must be closed.");
    }

    @Test
    @Tag("unit")
    void testPrintWritesRenderedReport() {
        Report report = new Report().setName("x").setKind(ReportKind.WARNING).setCode(42).setMessage("Careful.");
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        report.print(new PrintStream(bytes, true, StandardCharsets.UTF_8));

        assertThat(bytes.toString(StandardCharsets.UTF_8)).isEqualTo("warning[E0042]: Careful." + System.lineSeparator());
    }

    @Test
    @Tag("unit")
    void testDiagnosticsEngineCollectsAndSummarizes() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        diagnostics.reportWarning("Unused.", "a.surn", 3, null);
        assertThat(diagnostics.hasErrors()).isFalse();
        diagnostics.reportError("Broken.", "a.surn", 4, new TextRange(0, 1));

        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.hasWarnings()).isTrue();
        assertThat(diagnostics.summary()).isEqualTo("[WARNING] a.surn:3: Unused.\n[ERROR] a.surn:4: Broken.");
    }
}
