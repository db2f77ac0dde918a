package org.fhirstack.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the stack configuration from the usual sources.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>Java system properties ({@code -Dstack.stop-timeout=30s})</li>
 *   <li>Environment overrides ({@code CONFIG_FORCE_stack_stop__timeout=30s}) and the
 *       {@code ${?VAR}} substitutions in the files</li>
 *   <li>The configuration file: {@code --config}, else {@code -Dconfig.file}, else
 *       {@value #CONFIG_FILE_NAME} in the working directory</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    public static final String CONFIG_FILE_NAME = "fhir-stack.conf";

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param explicitFile file given on the command line, or {@code null}
     * @return the resolved configuration
     * @throws ConfigurationException if an explicitly named file does not exist or a file cannot be parsed
     */
    public static Config load(final File explicitFile) {
        final File configFile = locate(explicitFile);
        final Config fileConfig;
        if (configFile != null) {
            LOG.debug("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("No '{}' found in the working directory, using the built-in stack", CONFIG_FILE_NAME);
            fileConfig = ConfigFactory.empty();
        }
        return load(fileConfig);
    }

    /**
     * Layers system properties and environment overrides over the given configuration and the classpath defaults.
     */
    public static Config load(final Config fileConfig) {
        try {
            return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironmentOverrides())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
        } catch (final ConfigException e) {
            throw new ConfigurationException("Failed to load configuration: " + e.getMessage(), e);
        }
    }

    private static File locate(final File explicitFile) {
        if (explicitFile != null) {
            return requireExisting(explicitFile, "--config");
        }
        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            return requireExisting(new File(systemConfigPath).getAbsoluteFile(), "-Dconfig.file");
        }
        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        return cwdConfigFile.isFile() ? cwdConfigFile : null;
    }

    private static File requireExisting(final File file, final String source) {
        if (!file.isFile()) {
            throw new ConfigurationException("Configuration file specified via " + source + " was not found: "
                + file.getAbsolutePath());
        }
        return file;
    }
}
