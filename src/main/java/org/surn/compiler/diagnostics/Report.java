package org.surn.compiler.diagnostics;

import org.surn.compiler.frontend.context.SourceOrigin;
import org.surn.compiler.frontend.lexer.TextRange;
import org.surn.compiler.frontend.parser.ParseError;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A user facing diagnostic: a headline followed by any number of {@link Snippet}s.
 * <p>
 * Reports are assembled with the chained setters and turned into text with {@link #render()}.
 * Printing is left to the caller.
 */
public class Report {

    /** Code used for syntax errors. */
    public static final int SYNTAX_ERROR = 1;
    /** Code used for lexical errors. */
    public static final int LEXICAL_ERROR = 2;

    private String name = "<unknown>";
    private String message = "";
    private ReportKind kind = ReportKind.ERROR;
    private int code = 0;
    private SourceBuffer source = new SourceBuffer("");
    private final List<Snippet> snippets = new ArrayList<>();

    /**
     * Builds the report for a parse error.
     * @param error The error.
     * @param origin Where the parsed text came from.
     * @param source The parsed text.
     * @return The report with one snippet.
     */
    public static Report fromParseError(ParseError error, SourceOrigin origin, String source) {
        return new Report()
                .setName(origin.getName())
                .setKind(ReportKind.ERROR)
                .setCode(SYNTAX_ERROR)
                .setMessage(error.message())
                .setSource(source)
                .makeSnippet(error.range(), error.message(), error.label());
    }

    public Report setName(String name) {
        this.name = name;
        return this;
    }

    public Report setMessage(String message) {
        this.message = message;
        return this;
    }

    public Report setKind(ReportKind kind) {
        this.kind = kind;
        return this;
    }

    public Report setCode(int code) {
        this.code = code;
        return this;
    }

    public Report setSource(String source) {
        this.source = new SourceBuffer(source);
        return this;
    }

    /**
     * Adds a snippet underlining a range of the source.
     * @param range The characters to underline.
     * @param snippetMessage The message of the snippet.
     * @param inline The hint next to the underline, may be {@code null}.
     * @return This report.
     */
    public Report makeSnippet(TextRange range, String snippetMessage, String inline) {
        snippets.add(new Snippet(range, snippetMessage, inline));
        return this;
    }

    public String getName() {
        return name;
    }

    public String getMessage() {
        return message;
    }

    public ReportKind getKind() {
        return kind;
    }

    public int getCode() {
        return code;
    }

    public List<Snippet> getSnippets() {
        return Collections.unmodifiableList(snippets);
    }

    /**
     * @return The headline, e.g. {@code error[E0001]: Array must be closed.}, followed by every snippet.
     */
    public String render() {
        StringBuilder out = new StringBuilder();
        out.append(String.format("%s[E%04d]: %s", kind.label(), code, message));
        for (Snippet snippet : snippets) {
            out.append('\n').append(snippet.render(source, name));
        }
        return out.toString();
    }

    /**
     * Writes the rendered report followed by a line break.
     * @param out The stream to write to.
     */
    public void print(PrintStream out) {
        out.println(render());
    }

    @Override
    public String toString() {
        return render();
    }
}
