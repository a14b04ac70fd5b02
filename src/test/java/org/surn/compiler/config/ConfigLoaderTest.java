package org.surn.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the precedence of the configuration sources merged by {@link ConfigLoader}.
 */
@Tag("unit")
class ConfigLoaderTest {

    private static final String PROPERTY = "surn.compiler.verbosity";

    @AfterEach
    void tearDown() {
        System.clearProperty(PROPERTY);
        ConfigFactory.invalidateCaches();
    }

    @Test
    void load_withoutFile_shouldUseReferenceDefaults(@TempDir Path dir) {
        // When
        final Config config = ConfigLoader.load(dir.resolve("missing.conf").toFile());

        // Then
        assertThat(config.getBoolean("surn.compiler.semantic-checks")).isTrue();
        assertThat(config.getString("surn.compiler.operator-precedence")).isEqualTo("LEGACY");
        assertThat(config.getString("logging.format")).isEqualTo("PLAIN");
    }

    @Test
    void load_withFile_shouldOverrideDefaults(@TempDir Path dir) throws IOException {
        // Given
        final File file = dir.resolve("surn.conf").toFile();
        Files.writeString(file.toPath(), "surn.compiler { dump-ast = true, operator-precedence = \"PRECEDENCE\" }");

        // When
        final Config config = ConfigLoader.load(file);

        // Then
        assertThat(config.getBoolean("surn.compiler.dump-ast")).isTrue();
        assertThat(config.getString("surn.compiler.operator-precedence")).isEqualTo("PRECEDENCE");
        assertThat(config.getBoolean("surn.compiler.semantic-checks")).isTrue();
    }

    @Test
    void load_withSystemProperty_shouldOverrideFile(@TempDir Path dir) throws IOException {
        // Given
        final File file = dir.resolve("surn.conf").toFile();
        Files.writeString(file.toPath(), "surn.compiler.verbosity = 3");
        System.setProperty(PROPERTY, "4");
        ConfigFactory.invalidateCaches();

        // When
        final Config config = ConfigLoader.load(file);

        // Then
        assertThat(config.getInt(PROPERTY)).isEqualTo(4);
    }
}
