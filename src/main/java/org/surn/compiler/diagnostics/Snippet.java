package org.surn.compiler.diagnostics;

import org.surn.compiler.frontend.lexer.TextRange;

import java.util.ArrayList;
import java.util.List;

/**
 * An underlined excerpt of a single source line.
 * <p>
 * Rendering only depends on the source text and the range, so the same snippet renders
 * identically every time:
 * <pre>
 *   --&gt; main.surn:2:5
 *    |
 *  2 | var = 5;
 *    |     ~ A name is expected here.
 * Err | ---&gt; A name must follow a variable declaration.
 * </pre>
 *
 * @param range The characters to underline.
 * @param message The primary message.
 * @param inline The hint printed next to the underline, {@code null} to repeat the message.
 */
public record Snippet(TextRange range, String message, String inline) {

    /**
     * Renders the snippet.
     * @param buffer The source the range points into.
     * @param name The source name printed in the location line.
     * @return The rendered lines joined with {@code \n}.
     */
    public String render(SourceBuffer buffer, String name) {
        return String.join("\n", renderLines(buffer, name));
    }

    /**
     * @param buffer The source the range points into.
     * @param name The source name printed in the location line.
     * @return The rendered lines.
     */
    public List<String> renderLines(SourceBuffer buffer, String name) {
        SourceLine line = buffer.getLineAt(range.start());
        String number = String.valueOf(line.lineNumber());
        String gutter = " ".repeat(number.length());
        int column = Math.max(0, range.start() - line.offset()) + 1;

        List<String> lines = new ArrayList<>();
        lines.add(gutter + "--> " + name + ":" + line.lineNumber() + ":" + column);
        lines.add(gutter + " |");
        lines.add(number + " | " + line.trimmed());
        lines.add(gutter + " | " + " ".repeat(line.spacesUntil(range)) + "~".repeat(underlineLength(line))
                + " " + (inline != null ? inline : message));
        lines.add("Err | ---> " + message);
        return lines;
    }

    /**
     * The underline covers the part of the range that is displayed: trimmed leading whitespace
     * and everything past the end of the line are cut off. Empty ranges get one mark.
     */
    int underlineLength(SourceLine line) {
        int start = Math.max(range.start(), line.displayOffset());
        int end = Math.min(range.end(), line.offsetMax());
        return Math.max(1, end - start);
    }
}
