package org.fhirstack.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.fhirstack.junit.extensions.logging.LogWatchExtension;
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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Verifies the configuration priority: system properties, then the configuration file,
 * then {@code reference.conf}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("stack.name");
        System.clearProperty("stack.stop-timeout");
        System.clearProperty("config.file");
        ConfigFactory.invalidateCaches();
    }

    private File writeConfig(String content) throws IOException {
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, content);
        return file.toFile();
    }

    @Test
    @DisplayName("Without a file the built-in MongoDB and FHIR store stack is used")
    void load_usesReferenceDefaults() {
        Config config = ConfigLoader.load((File) null);

        assertThat(config.getString("stack.name")).isEqualTo("fhir-stack");
        assertThat(config.getConfigList("stack.services")).hasSize(2);
        assertThat(config.getString("logging.format")).isEqualTo("PLAIN");
    }

    @Test
    @DisplayName("File values override the defaults and flow into substitutions")
    void load_fileOverridesDefaults() throws IOException {
        File file = writeConfig("stack.name = \"from-file\"\nsecrets.mongo-root-password = \"file-secret\"\n");

        Config config = ConfigLoader.load(file);

        assertThat(config.getString("stack.name")).isEqualTo("from-file");
        assertThat(config.getString("stack.dependency-timeout")).isEqualTo("120s");
        Config mongo = config.getConfigList("stack.services").get(0);
        assertThat(mongo.getString("environment.MONGO_INITDB_ROOT_PASSWORD")).isEqualTo("file-secret");
    }

    @Test
    @DisplayName("System properties override the file")
    void load_systemPropertyOverridesFile() throws IOException {
        File file = writeConfig("stack { name = \"from-file\", stop-timeout = 3s }");
        System.setProperty("stack.name", "from-property");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(file);

        assertThat(config.getString("stack.name")).isEqualTo("from-property");
        assertThat(config.getString("stack.stop-timeout")).isEqualTo("3s");
    }

    @Test
    @DisplayName("-Dconfig.file is used when no --config is given")
    void load_honoursConfigFileProperty() throws IOException {
        File file = writeConfig("stack.name = \"via-property\"");
        System.setProperty("config.file", file.getAbsolutePath());
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load((File) null);

        assertThat(config.getString("stack.name")).isEqualTo("via-property");
    }

    @Test
    @DisplayName("A missing --config file is an error")
    void load_failsForMissingExplicitFile() {
        File missing = tempDir.resolve("missing.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.load(missing))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("--config")
            .hasMessageContaining("missing.conf");
    }

    @Test
    @DisplayName("Syntax errors surface as ConfigurationException")
    void load_failsForUnparsableFile() throws IOException {
        File file = writeConfig("stack { name = ");

        assertThatThrownBy(() -> ConfigLoader.load(file))
            .isInstanceOf(ConfigurationException.class);
    }
}
