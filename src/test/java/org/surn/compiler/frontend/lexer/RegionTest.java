package org.surn.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for {@link Position}, {@link Region} and {@link TextRange}.
 */
public class RegionTest {

    @Test
    @Tag("unit")
    void testPositionOrdering() {
        assertThat(new Position(1, 5).isLeading(new Position(2, 0))).isTrue();
        assertThat(new Position(2, 3).isLeading(new Position(2, 3))).isTrue();
        assertThat(new Position(2, 4).isLeading(new Position(2, 3))).isFalse();
        assertThat(new Position(3, 1).toString()).isEqualTo("3:1");
    }

    /**
     * Verifies inclusion at both ends, and that expanding backwards is a no-op.
     */
    @Test
    @Tag("unit")
    void testRegionIncludesAndExpand() {
        // Arrange
        Region region = Region.of(new Position(1, 0), new Position(1, 10));

        // Act
        Region expanded = region.expandTo(new Position(2, 4));
        Region unchanged = region.expandTo(new Position(1, 3));

        // Assert
        assertThat(region.includes(new Position(1, 0))).isTrue();
        assertThat(region.includes(new Position(1, 10))).isTrue();
        assertThat(region.includes(new Position(1, 11))).isFalse();
        assertThat(expanded.end()).isEqualTo(new Position(2, 4));
        assertThat(unchanged).isSameAs(region);
    }

    /**
     * Verifies that shrinking past the end or before the start is rejected.
     */
    @Test
    @Tag("unit")
    void testRegionShrinkRejectsPositionsOutside() {
        // Arrange
        Region region = Region.of(new Position(1, 2), new Position(1, 10)).withLabel("name");

        // Act
        Region shrunk = region.shrinkTo(new Position(1, 5));

        // Assert
        assertThat(shrunk.end()).isEqualTo(new Position(1, 5));
        assertThat(shrunk.label()).isEqualTo("name");
        assertThatThrownBy(() -> region.shrinkTo(new Position(1, 11))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> region.shrinkTo(new Position(1, 1))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void testTextRangeHelpers() {
        TextRange first = new TextRange(2, 5);
        TextRange second = new TextRange(8, 9);

        assertThat(first.combine(second)).isEqualTo(new TextRange(2, 9));
        assertThat(first.length()).isEqualTo(3);
        assertThat(first.contains(4)).isTrue();
        assertThat(first.contains(5)).isFalse();
        assertThat(TextRange.at(7)).isEqualTo(new TextRange(7, 8));
        assertThatThrownBy(() -> new TextRange(5, 4)).isInstanceOf(IllegalArgumentException.class);
    }
}
