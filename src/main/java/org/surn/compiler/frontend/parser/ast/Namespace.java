package org.surn.compiler.frontend.parser.ast;

/**
 * A namespace declaration. Without a body the namespace applies to the rest of the file.
 *
 * @param path The namespace path.
 * @param body The braced body, {@code null} if the namespace has none.
 */
public record Namespace(Path path, Statement body) {
}
