package org.sparkworld.cli.config;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.security.CodeSource;
import java.security.ProtectionDomain;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Resolves the HOCON configuration of the command line.
 * <p>
 * Layers, highest precedence first: JVM system properties, environment variables, the user
 * configuration file, {@code reference.conf} from the classpath. Substitutions are resolved
 * only after all layers are merged, so a user override reaches every value that refers to it.
 */
public final class ConfigLoader {

    private static final String CONFIG_DIR = "config";
    private static final String CONFIG_FILE_NAME = "sparkworld.conf";

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is being located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Finds the configuration file, trying in order:
     * <ol>
     *   <li>the file given with {@code --config}</li>
     *   <li>the file named by {@code -Dconfig.file}</li>
     *   <li>{@code config/sparkworld.conf} below the working directory</li>
     *   <li>{@code config/sparkworld.conf} below the installation directory of the jar</li>
     *   <li>no file, classpath defaults only</li>
     * </ol>
     *
     * @param explicitConfigFile File from the command line, or {@code null}.
     * @param handler Receives progress messages.
     * @return The resolved configuration.
     * @throws IllegalArgumentException if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException("Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO, "Using configuration file given via --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String propertyPath = System.getProperty("config.file");
        if (propertyPath != null && !propertyPath.isBlank()) {
            final File propertyFile = new File(propertyPath).getAbsoluteFile();
            if (!propertyFile.exists()) {
                throw new IllegalArgumentException("Configuration file given via -Dconfig.file not found: " + propertyFile);
            }
            handler.log(MessageLevel.INFO, "Using configuration file given via -Dconfig.file: " + propertyFile);
            return loadFromFile(propertyFile);
        }

        final File workingDirFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirFile.exists()) {
            handler.log(MessageLevel.INFO, "Using configuration file from working directory: " + workingDirFile.getAbsolutePath());
            return loadFromFile(workingDirFile);
        }

        final File installedFile = findInstalledConfigFile(handler);
        if (installedFile != null) {
            handler.log(MessageLevel.INFO, "Using configuration file from installation directory: " + installedFile.getAbsolutePath());
            return loadFromFile(installedFile);
        }

        handler.log(MessageLevel.WARN, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME
            + " found, running on the built-in defaults");
        return loadDefaults();
    }

    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Looks for {@code APP_HOME/config/sparkworld.conf}, where {@code APP_HOME} is the parent of
     * the {@code lib} directory holding the running jar.
     *
     * @return The file, or {@code null} if there is none or the location cannot be determined.
     */
    private static File findInstalledConfigFile(final ConfigMessageHandler handler) {
        final ProtectionDomain domain = ConfigLoader.class.getProtectionDomain();
        final CodeSource source = domain == null ? null : domain.getCodeSource();
        final URL location = source == null ? null : source.getLocation();
        if (location == null) {
            return null;
        }
        final File jarOrClasses;
        try {
            jarOrClasses = new File(location.toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            handler.log(MessageLevel.INFO, "Cannot determine installation directory from " + location + ": " + e.getMessage());
            return null;
        }
        // Classes directories have no lib/ parent; the working directory lookup covers development.
        final File libDir = jarOrClasses.isFile() ? jarOrClasses.getParentFile() : null;
        final File appHome = libDir == null ? null : libDir.getParentFile();
        if (appHome == null) {
            return null;
        }
        final File configFile = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
        return configFile.exists() ? configFile : null;
    }
}
