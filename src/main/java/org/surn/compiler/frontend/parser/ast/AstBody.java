package org.surn.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The ordered sequence of top-level nodes parsed from one source file.
 * Nodes can only be appended.
 */
public final class AstBody {

    private final List<Node> program = new ArrayList<>();

    /**
     * Appends a node.
     * @param node The node to append.
     */
    public void push(Node node) {
        program.add(node);
    }

    /**
     * @return An unmodifiable view of the nodes in source order.
     */
    public List<Node> getProgram() {
        return Collections.unmodifiableList(program);
    }

    /**
     * @return The number of top-level nodes.
     */
    public int size() {
        return program.size();
    }

    /**
     * @return {@code true} if nothing was parsed.
     */
    public boolean isEmpty() {
        return program.isEmpty();
    }

    @Override
    public String toString() {
        return "AstBody" + program;
    }
}
