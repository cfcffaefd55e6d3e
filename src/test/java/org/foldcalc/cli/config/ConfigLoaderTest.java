package org.foldcalc.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.net.URISyntaxException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * 1. CLI overrides
 * 2. System Properties
 * 3. Configuration File
 * 4. Default reference configuration (lowest priority)
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        // Invalidate the cache before each test to ensure a clean slate
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("foldcalc.prompt");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Should load reference defaults when no file or overrides are given")
    void load_shouldProvideDefaults() {
        // Act
        Config config = ConfigLoader.load(null, null);

        // Assert
        assertEquals("calc> ", config.getString("foldcalc.prompt"));
        assertTrue(config.getBoolean("foldcalc.show-caret"));
        assertEquals(1, config.getInt("foldcalc.batch.parallelism"));
        assertEquals("PLAIN", config.getString("logging.format"));
    }

    @Test
    @DisplayName("Configuration file should override defaults")
    void load_fileShouldOverrideDefaults() throws URISyntaxException {
        // Act
        Config config = ConfigLoader.load(testConfigFile(), null);

        // Assert
        assertEquals(">> ", config.getString("foldcalc.prompt"));
        assertFalse(config.getBoolean("foldcalc.show-caret"));
        assertEquals(4, config.getInt("foldcalc.batch.parallelism"));
        // Defaults remain for keys the file does not set
        assertEquals("WARN", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFileConfig() throws URISyntaxException {
        // Arrange
        System.setProperty("test.value", "system-value");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load(testConfigFile(), null);

        // Assert
        assertEquals("system-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
    }

    @Test
    @DisplayName("CLI overrides should win over system properties and the file")
    void load_cliOverrideShouldWin() throws URISyntaxException {
        // Arrange
        System.setProperty("foldcalc.prompt", "system> ");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load(testConfigFile(), Map.of(
                "foldcalc.prompt", "cli> ",
                "foldcalc.batch.parallelism", "8"));

        // Assert
        assertEquals("cli> ", config.getString("foldcalc.prompt"));
        assertEquals(8, config.getInt("foldcalc.batch.parallelism"));
    }

    @Test
    @DisplayName("A missing explicit configuration file is rejected")
    void load_missingFileShouldFail() {
        File missing = new File("does-not-exist/foldcalc.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(missing, null));
        assertTrue(e.getMessage().contains("does-not-exist"));
    }

    private static File testConfigFile() throws URISyntaxException {
        return new File(ConfigLoaderTest.class.getResource("test-config.conf").toURI());
    }
}
