package org.surn.compiler.frontend.context;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Where a source comes from: a file on disk, or a named in-memory ("virtual") source such as a
 * script or a test fixture. File contents are not cached; they are read on every call to
 * {@link #getContents()}.
 */
public final class SourceOrigin {

    private final Path path;
    private final String name;
    private final String contents;

    private SourceOrigin(Path path, String name, String contents) {
        this.path = path;
        this.name = name;
        this.contents = contents;
    }

    /**
     * @param path The file to read.
     * @return An origin backed by the file.
     */
    public static SourceOrigin ofFile(Path path) {
        Objects.requireNonNull(path, "path");
        return new SourceOrigin(path, path.toString(), null);
    }

    /**
     * @param name The name used in diagnostics.
     * @param contents The source text.
     * @return An in-memory origin.
     */
    public static SourceOrigin ofVirtual(String name, String contents) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(contents, "contents");
        return new SourceOrigin(null, name, contents);
    }

    /**
     * Returns the source text, reading the file for file-backed origins.
     * @return The source text.
     * @throws IOException if the file cannot be read.
     */
    public String getContents() throws IOException {
        if (isVirtual()) {
            return contents;
        }
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    /**
     * @return {@code true} for in-memory sources.
     */
    public boolean isVirtual() {
        return path == null;
    }

    /**
     * @return The file path, or {@code null} for virtual sources.
     */
    public Path getPath() {
        return path;
    }

    /**
     * @return The name shown in diagnostics: the file path, or the virtual name.
     */
    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return isVirtual() ? "virtual:" + name : name;
    }
}
