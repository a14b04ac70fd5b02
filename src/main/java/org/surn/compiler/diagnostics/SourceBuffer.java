package org.surn.compiler.diagnostics;

import java.util.ArrayList;
import java.util.List;

/**
 * The text of a source, split into lines on demand. Lines are not cached.
 */
public class SourceBuffer {

    private final String source;

    public SourceBuffer(String source) {
        this.source = source == null ? "" : source;
    }

    public String getSource() {
        return source;
    }

    /**
     * Returns a slice of the source. Positions past the end read as spaces.
     * @param start The first offset, inclusive.
     * @param end The last offset, exclusive.
     * @return The text between the offsets.
     */
    public String get(int start, int end) {
        StringBuilder result = new StringBuilder();
        for (int i = start; i < end; i++) {
            result.append(i >= 0 && i < source.length() ? source.charAt(i) : ' ');
        }
        return result.toString();
    }

    /**
     * Splits the source on {@code \n}. The last line is always present, even when empty.
     * @return The lines in order.
     */
    public List<SourceLine> getLines() {
        List<SourceLine> lines = new ArrayList<>();
        int lineStart = 0;
        int lineNumber = 1;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                lines.add(new SourceLine(lineStart, i - lineStart, lineNumber, source.substring(lineStart, i)));
                lineNumber++;
                lineStart = i + 1;
            }
        }
        lines.add(new SourceLine(lineStart, source.length() - lineStart, lineNumber, source.substring(lineStart)));
        return lines;
    }

    /**
     * Finds the line containing an offset. The offset of a line break belongs to the line it ends.
     * @param offset An offset into the source.
     * @return The line, or the last line for offsets past the end.
     */
    public SourceLine getLineAt(int offset) {
        List<SourceLine> lines = getLines();
        for (SourceLine line : lines) {
            if (offset >= line.offset() && offset <= line.offsetMax()) {
                return line;
            }
        }
        return lines.get(lines.size() - 1);
    }
}
