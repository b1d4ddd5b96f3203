package org.rubyshift.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.rubyshift.transpiler.TranspilerOptions;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConfigLoader}: file lookup and the precedence of system properties
 * over the configuration file over {@code reference.conf}.
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
        System.clearProperty("rubyshift.transpiler.eslevel");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should layer the file over the reference defaults")
    void loadFromFile_shouldLayerFileOverDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        TranspilerOptions options = TranspilerOptions.fromConfig(config);
        assertEquals(List.of("require", "combiner", "pragma"), options.filters());
        assertEquals(2015, options.eslevel());
        assertEquals(TranspilerOptions.Autoexports.OFF, options.autoexports());
        assertEquals(List.of(".rb", ".js.rb"), options.requireExtensions());
        assertEquals(List.of("each"), options.exclude());
        assertEquals("file-value", config.getString("test.value"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("rubyshift.transpiler.eslevel", "2022");
        System.setProperty("test.value", "system-value");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals(2022, TranspilerOptions.fromConfig(config).eslevel());
        assertEquals("system-value", config.getString("test.value"));
    }

    @Test
    @DisplayName("loadDefaults should return the reference configuration")
    void loadDefaults_shouldReturnReferenceConfig() {
        TranspilerOptions options = TranspilerOptions.fromConfig(ConfigLoader.loadDefaults());

        assertEquals(List.of("require", "pragma"), options.filters());
        assertEquals(2020, options.eslevel());
        assertFalse(options.modules());
        assertFalse(options.includeComments());
    }

    @Test
    @DisplayName("An explicit configuration file is used and reported")
    void resolve_shouldUseExplicitFile() {
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(testResource("test-config.conf"), (level, message) -> messages.add(level + " " + message));

        assertEquals(2015, TranspilerOptions.fromConfig(config).eslevel());
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO Using configuration file specified via --config"));
    }

    @Test
    @DisplayName("A missing explicit configuration file is an error")
    void resolve_shouldRejectMissingExplicitFile() {
        File missing = new File("does-not-exist.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing, (level, message) -> { }));
        assertTrue(e.getMessage().contains("does-not-exist.conf"));
    }

    @Test
    @DisplayName("Without any file the classpath defaults are used")
    void resolve_shouldFallBackToDefaults() {
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(null, (level, message) -> messages.add(message));

        assertEquals(List.of("require", "pragma"), TranspilerOptions.fromConfig(config).filters());
        assertTrue(messages.get(0).contains("using default configuration from classpath"));
    }

    private File testResource(String name) {
        URL url = getClass().getClassLoader().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
