package org.stackpp.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the interpreter configuration.
 * <p>
 * Precedence, highest first:
 * <ol>
 *     <li>Java system properties ({@code -Dkey=value})</li>
 *     <li>Environment variables</li>
 *     <li>The configuration file: the one passed with {@code --config}, else the one named by
 *         {@code -Dconfig.file}, else {@code stackpp.conf} in the working directory</li>
 *     <li>Defaults from {@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** The configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "stackpp.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration.
     *
     * @param explicitFile The file given on the command line, or {@code null}.
     * @return The resolved configuration.
     * @throws ConfigException if a file cannot be parsed, or the explicit file does not exist.
     */
    public static Config load(final File explicitFile) {
        final Config fileConfig = parseFile(locateFile(explicitFile));

        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }

    private static File locateFile(final File explicitFile) {
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new ConfigException.Generic(
                        "Configuration file specified via --config was not found: " + explicitFile.getAbsolutePath());
            }
            LOG.info("Using configuration file specified via --config: {}", explicitFile.getAbsolutePath());
            return explicitFile;
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.isFile()) {
                throw new ConfigException.Generic(
                        "Configuration file specified via -Dconfig.file was not found: " + systemConfigFile);
            }
            LOG.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile);
            return systemConfigFile;
        }

        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.isFile()) {
            LOG.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return cwdConfigFile;
        }

        LOG.debug("No '{}' found, using defaults from classpath.", CONFIG_FILE_NAME);
        return null;
    }

    private static Config parseFile(final File file) {
        return file == null ? ConfigFactory.empty() : ConfigFactory.parseFile(file);
    }
}
