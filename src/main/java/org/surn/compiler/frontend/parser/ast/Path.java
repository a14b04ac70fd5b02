package org.surn.compiler.frontend.parser.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A backslash separated module path, e.g. {@code std\io}.
 *
 * @param name  The first segment.
 * @param parts The following segments.
 */
public record Path(String name, List<Path> parts) {

    public Path {
        parts = List.copyOf(parts);
    }

    /**
     * @param name A single segment.
     * @return A path without further parts.
     */
    public static Path of(String name) {
        return new Path(name, List.of());
    }

    /**
     * @param name The first segment.
     * @param parts The following segments.
     * @return The path.
     */
    public static Path of(String name, List<String> parts) {
        return new Path(name, parts.stream().map(Path::of).collect(Collectors.toList()));
    }

    /**
     * @return The names of the following segments.
     */
    public List<String> partNames() {
        return parts.stream().map(Path::name).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        if (parts.isEmpty()) {
            return name;
        }
        return name + "\\" + parts.stream().map(Path::toString).collect(Collectors.joining("\\"));
    }
}
