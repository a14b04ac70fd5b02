package org.surn.compiler.frontend.context;

/**
 * Identifies a {@link Context} inside its {@link ContextStore}.
 *
 * @param value The slot index in the store.
 */
public record ContextId(int value) {

    public ContextId {
        if (value < 0) {
            throw new IllegalArgumentException("Context id must not be negative: " + value);
        }
    }

    @Override
    public String toString() {
        return "#" + value;
    }
}
