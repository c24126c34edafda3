package org.konoko.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration. Precedence, highest first:
 * <ol>
 *   <li>Java system properties ({@code -Dkonoko.machine.tape-size=32})</li>
 *   <li>Environment variables</li>
 *   <li>The file given with {@code --config}, or else {@code konoko.conf} in the working directory</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "konoko.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration.
     *
     * @param explicitFile A file named on the command line, or {@code null}.
     * @return The resolved configuration.
     * @throws ConfigException if a file cannot be parsed, or an explicit file does not exist.
     */
    public static Config load(final File explicitFile) {
        final Config fileConfig;
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new ConfigException.IO(ConfigFactory.empty().origin(),
                        "Configuration file not found: " + explicitFile.getAbsolutePath());
            }
            LOG.debug("Loading configuration from {}", explicitFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(explicitFile);
        } else {
            final File cwdFile = new File(CONFIG_FILE_NAME);
            if (cwdFile.isFile()) {
                LOG.debug("Loading configuration from {}", cwdFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(cwdFile);
            } else {
                fileConfig = ConfigFactory.empty();
            }
        }

        // The one provided first wins.
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }
}
