package org.kukicha.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies the precedence of configuration sources: system properties over the file over
 * {@code reference.conf}.
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("test.nested.setting");
        System.clearProperty("kukicha.compiler.max-errors");
        System.clearProperty("config.file");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile merges the file with the bundled defaults")
    void loadFromFile_shouldMergeFileWithDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("from-file", config.getString("test.value"));
        assertEquals(42, config.getInt("test.nested.setting"));
        assertEquals(7, config.getInt("kukicha.compiler.max-errors"));
        assertTrue(config.getBoolean("kukicha.codegen.emit-header"));
    }

    @Test
    @DisplayName("System property overrides the file")
    void loadFromFile_systemPropertyShouldOverrideFile() {
        System.setProperty("test.nested.setting", "99");
        System.setProperty("kukicha.compiler.max-errors", "3");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals(99, config.getInt("test.nested.setting"));
        assertEquals(3, config.getInt("kukicha.compiler.max-errors"));
        assertEquals("file", config.getString("test.priority"));
    }

    @Test
    @DisplayName("Substitutions resolve against the merged configuration")
    void loadFromFile_shouldResolveReferences() {
        Config config = ConfigLoader.loadFromFile(testResource("references-config.conf"));

        assertEquals("hello kukicha", config.getString("derived.greeting"));
        assertEquals(50, config.getInt("derived.limit"));
    }

    @Test
    @DisplayName("loadDefaults exposes the reference settings")
    void loadDefaults_shouldContainReferenceSettings() {
        Config config = ConfigLoader.loadDefaults();

        assertEquals(50, config.getInt("kukicha.compiler.max-errors"));
        assertEquals("signatures/go-stdlib.json", config.getString("kukicha.signatures.resource"));
        assertEquals("PLAIN", config.getString("kukicha.logging.format"));
    }

    @Test
    @DisplayName("An explicit file wins and is reported")
    void resolve_shouldUseExplicitFile() {
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(testResource("test-config.conf"),
                (level, message) -> messages.add(level + " " + message));

        assertEquals("from-file", config.getString("test.value"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO Using configuration file specified via --config"));
    }

    @Test
    @DisplayName("A missing explicit file is rejected")
    void resolve_shouldRejectMissingExplicitFile() {
        File missing = new File("does-not-exist/kukicha.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing, (level, message) -> { }));

        assertTrue(e.getMessage().startsWith("Configuration file not found"));
    }

    @Test
    @DisplayName("-Dconfig.file is used when no file is passed")
    void resolve_shouldUseConfigFileProperty() {
        System.setProperty("config.file", testResource("test-config.conf").getAbsolutePath());

        Config config = ConfigLoader.resolve(null, (level, message) -> { });

        assertEquals(7, config.getInt("kukicha.compiler.max-errors"));
    }

    private File testResource(final String name) {
        final URL url = getClass().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid test resource URI: " + url, e);
        }
    }
}
