package org.minikconfig.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.minikconfig.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * 1. System Properties (highest priority)
 * 2. Environment Variables
 * 3. Configuration File
 * 4. Default reference configuration (lowest priority)
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        // Invalidate the cache before each test to ensure a clean slate
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("minikconfig.output");
        System.clearProperty("minikconfig.strict");
        ConfigFactory.invalidateCaches();
    }

    private File writeConfig(String content) throws IOException {
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, content);
        return file.toFile();
    }

    @Test
    @DisplayName("Should fall back to reference.conf when no file is given")
    void load_shouldUseReferenceDefaults() {
        // Act
        Config config = ConfigLoader.load();
        MiniKconfigSettings settings = MiniKconfigSettings.from(config);

        // Assert
        assertEquals("Kconfig", settings.input());
        assertEquals(".config", settings.output());
        assertTrue(settings.selectDefaults());
        assertFalse(settings.strict());
        assertEquals("PLAIN", config.getString("logging.format"));
    }

    @Test
    @DisplayName("Configuration file should override reference defaults")
    void load_fileShouldOverrideDefaults() throws IOException {
        // Arrange
        File file = writeConfig("minikconfig { output = \"build/.config\", select-defaults = false }");

        // Act
        MiniKconfigSettings settings = MiniKconfigSettings.from(ConfigLoader.load(file));

        // Assert
        assertEquals("build/.config", settings.output());
        assertFalse(settings.selectDefaults());
        assertEquals("Kconfig", settings.input()); // Not overridden
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFile() throws IOException {
        // Arrange
        File file = writeConfig("minikconfig { output = \"file/.config\", strict = false }");
        System.setProperty("minikconfig.output", "system/.config");
        System.setProperty("minikconfig.strict", "true");
        ConfigFactory.invalidateCaches();

        // Act
        MiniKconfigSettings settings = MiniKconfigSettings.from(ConfigLoader.load(file));

        // Assert
        assertEquals("system/.config", settings.output());
        assertTrue(settings.strict());
    }

    @Test
    @DisplayName("Should resolve substitutions in the configuration file")
    void load_shouldResolveSubstitutions() throws IOException {
        // Arrange
        File file = writeConfig("base = \"out\"\nminikconfig.output = ${base}\"/.config\"");

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertEquals("out/.config", config.getString("minikconfig.output"));
    }

    @Test
    @DisplayName("Should reject an explicit configuration file that does not exist")
    void load_shouldRejectMissingExplicitFile() {
        // Arrange
        File missing = tempDir.resolve("missing.conf").toFile();

        // Act & Assert
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(missing));
        assertTrue(e.getMessage().contains("missing.conf"));
    }
}
