package org.surn.compiler.frontend.lexer;

/**
 * A labelled span between two positions.
 *
 * @param start The first position of the span.
 * @param end   The last position of the span.
 * @param label A short label used when the region is shown to a user, may be empty.
 */
public record Region(Position start, Position end, String label) {

    public Region {
        if (label == null) {
            label = "";
        }
    }

    /**
     * Creates an unlabelled region.
     * @param start The start position.
     * @param end The end position.
     * @return The new region.
     */
    public static Region of(Position start, Position end) {
        return new Region(start, end, "");
    }

    /**
     * Checks whether the given position lies inside this region, both ends included.
     * @param position The position to test.
     * @return {@code true} if the position is inside.
     */
    public boolean includes(Position position) {
        return start.isLeading(position) && position.isLeading(end);
    }

    /**
     * Returns a copy of this region whose end is moved forward to the given position.
     * A position that lies before the current end leaves the region unchanged.
     * @param position The new end.
     * @return The expanded region.
     */
    public Region expandTo(Position position) {
        if (position.isLeading(end)) {
            return this;
        }
        return new Region(start, position, label);
    }

    /**
     * Returns a copy of this region whose end is moved back to the given position.
     * @param position The new end, must lie inside this region.
     * @return The shrunk region.
     * @throws IllegalArgumentException if the position is after the current end or before the start.
     */
    public Region shrinkTo(Position position) {
        if (!position.isLeading(end)) {
            throw new IllegalArgumentException("Cannot shrink region " + this + " to " + position + ": position is after the end");
        }
        if (!start.isLeading(position)) {
            throw new IllegalArgumentException("Cannot shrink region " + this + " to " + position + ": position is before the start");
        }
        return new Region(start, position, label);
    }

    /**
     * @param newLabel The label of the copy.
     * @return A copy of this region with another label.
     */
    public Region withLabel(String newLabel) {
        return new Region(start, end, newLabel);
    }

    @Override
    public String toString() {
        return label.isEmpty() ? start + "-" + end : label + "@" + start + "-" + end;
    }
}
