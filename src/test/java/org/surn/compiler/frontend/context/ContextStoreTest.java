package org.surn.compiler.frontend.context;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link ContextStore} arena and {@link SourceOrigin}.
 */
public class ContextStoreTest {

    /**
     * Verifies that ids are handed out densely and are not reused after removal.
     */
    @Test
    @Tag("unit")
    void testIdsAreDenseAndNotReused() {
        // Arrange
        ContextStore store = new ContextStore();

        // Act
        Context first = store.create(SourceOrigin.ofVirtual("a", ""));
        Context second = store.create(SourceOrigin.ofVirtual("b", ""));
        boolean removed = store.remove(first.getId());
        Context third = store.create(SourceOrigin.ofVirtual("c", ""));

        // Assert
        assertThat(first.getId()).isEqualTo(new ContextId(0));
        assertThat(second.getId()).isEqualTo(new ContextId(1));
        assertThat(third.getId()).isEqualTo(new ContextId(2));
        assertThat(removed).isTrue();
        assertThat(store.remove(first.getId())).isFalse();
        assertThat(store.size()).isEqualTo(3);
        assertThat(store.liveCount()).isEqualTo(2);
        assertThat(store.nextContextId()).isEqualTo(new ContextId(3));
    }

    @Test
    @Tag("unit")
    void testLookup() {
        ContextStore store = new ContextStore();
        Context context = store.create(SourceOrigin.ofVirtual("main.surn", "var x = 1;"));

        assertThat(store.get(context.getId())).isSameAs(context);
        assertThat(store.findByName("main.surn")).containsSame(context);
        assertThat(store.find(new ContextId(7))).isEmpty();
        assertThatThrownBy(() -> store.get(new ContextId(7))).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    @Tag("unit")
    void testLocalIdsStartAtOne() {
        Context context = new ContextStore().create(SourceOrigin.ofVirtual("a", ""));

        assertThat(context.nextLocalId()).isEqualTo(1L);
        assertThat(context.nextLocalId()).isEqualTo(2L);
    }

    /**
     * Verifies that file origins read their contents from disk and virtual origins hold them in memory.
     */
    @Test
    @Tag("unit")
    void testSourceOrigins(@TempDir Path dir) throws IOException {
        // Arrange
        Path file = dir.resolve("main.surn");
        Files.writeString(file, "use std\\io;");

        // Act
        SourceOrigin fromFile = SourceOrigin.ofFile(file);
        SourceOrigin virtual = SourceOrigin.ofVirtual("script", "1 + 2");

        // Assert
        assertThat(fromFile.isVirtual()).isFalse();
        assertThat(fromFile.getContents()).isEqualTo("use std\\io;");
        assertThat(fromFile.getName()).isEqualTo(file.toString());
        assertThat(virtual.isVirtual()).isTrue();
        assertThat(virtual.getContents()).isEqualTo("1 + 2");
        assertThat(virtual.getPath()).isNull();
    }
}
