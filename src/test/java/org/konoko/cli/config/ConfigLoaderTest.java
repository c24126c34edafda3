package org.konoko.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * system properties, then the configuration file, then reference.conf.
 */
@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("konoko.machine.tape-size");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Should fall back to reference.conf when no file is given")
    void load_shouldUseReferenceDefaults() {
        Config config = ConfigLoader.load(null);

        assertEquals(16, config.getInt("konoko.machine.tape-size"));
        assertFalse(config.getBoolean("konoko.machine.symmetric-wraparound"));
        assertEquals("out.konoko", config.getString("konoko.cli.default-output"));
    }

    @Test
    @DisplayName("Should let the configuration file override reference.conf")
    void load_fileShouldOverrideDefaults() throws IOException {
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "konoko.machine { tape-size = 64 }\n");

        Config config = ConfigLoader.load(file.toFile());

        assertEquals(64, config.getInt("konoko.machine.tape-size"));
        assertEquals(0, config.getLong("konoko.machine.max-steps"));
    }

    @Test
    @DisplayName("Should let system properties override the configuration file")
    void load_systemPropertiesShouldOverrideFile() throws IOException {
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "konoko.machine.tape-size = 64\n");
        System.setProperty("konoko.machine.tape-size", "128");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(file.toFile());

        assertEquals(128, config.getInt("konoko.machine.tape-size"));
    }

    @Test
    @DisplayName("Should fail for an explicit file that does not exist")
    void load_missingExplicitFileShouldFail() {
        File missing = tempDir.resolve("nope.conf").toFile();

        ConfigException e = assertThrows(ConfigException.class, () -> ConfigLoader.load(missing));
        assertTrue(e.getMessage().contains("nope.conf"));
    }

    @Test
    @DisplayName("Should fail for a file that is not valid HOCON")
    void load_malformedFileShouldFail() throws IOException {
        Path file = tempDir.resolve("broken.conf");
        Files.writeString(file, "konoko { machine {\n");

        assertThrows(ConfigException.class, () -> ConfigLoader.load(file.toFile()));
    }
}
