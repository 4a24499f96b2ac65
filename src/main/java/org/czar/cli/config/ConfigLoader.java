package org.czar.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.security.CodeSource;
import java.security.ProtectionDomain;

/**
 * Resolves the transpiler configuration for the command line.
 * <p>
 * Layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dczar.switch.require-enum-default=true})</li>
 *   <li>Environment variables</li>
 *   <li>One user configuration file, found by {@link #resolve(File, ConfigMessageHandler)}</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved only after all layers are merged.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "czar.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a message emitted while locating the configuration file.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        /**
         * @param level   The message severity.
         * @param message The message text.
         */
        void log(MessageLevel level, String message);
    }

    /**
     * Locates the user configuration file and loads it over the defaults. The first
     * match wins:
     * <ol>
     *   <li>the file given with {@code --config}</li>
     *   <li>the file given with {@code -Dconfig.file}</li>
     *   <li>{@code config/czar.conf} below the working directory</li>
     *   <li>{@code config/czar.conf} below the installation directory</li>
     *   <li>no file: {@code reference.conf} only</li>
     * </ol>
     *
     * @param explicitConfigFile The file from the command line, or {@code null}.
     * @param handler            Receives which file was chosen.
     * @return The resolved configuration.
     * @throws IllegalArgumentException              if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException   if a file cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO, "Using configuration file from --config: "
                    + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException("Configuration file from -Dconfig.file not found: "
                        + systemConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO, "Using configuration file from -Dconfig.file: "
                    + systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        final File workingDirConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirConfigFile.exists()) {
            handler.log(MessageLevel.INFO, "Using configuration file from working directory: "
                    + workingDirConfigFile.getAbsolutePath());
            return loadFromFile(workingDirConfigFile);
        }

        final File installationConfigFile = detectInstallationConfigFile();
        if (installationConfigFile != null) {
            handler.log(MessageLevel.INFO, "Using configuration file from installation directory: "
                    + installationConfigFile.getAbsolutePath());
            return loadFromFile(installationConfigFile);
        }

        handler.log(MessageLevel.INFO, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                + " found, using built-in defaults");
        return loadDefaults();
    }

    /**
     * @param configFile A HOCON file.
     * @return The file merged over the defaults, with system properties and environment on top.
     */
    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.parseFile(configFile))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    /**
     * @return The defaults, with system properties and environment on top.
     */
    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    /**
     * Looks for {@code APP_HOME/config/czar.conf}, where {@code APP_HOME} is the parent of
     * the {@code lib} directory holding the running jar.
     *
     * @return The file, or {@code null} if there is none or the location cannot be determined.
     */
    private static File detectInstallationConfigFile() {
        try {
            final ProtectionDomain protectionDomain = ConfigLoader.class.getProtectionDomain();
            final CodeSource codeSource = protectionDomain == null ? null : protectionDomain.getCodeSource();
            if (codeSource == null) {
                return null;
            }
            final URL location = codeSource.getLocation();
            final File jarOrClasses = new File(location.toURI());
            if (!jarOrClasses.isFile()) {
                // Running from target/classes; the working directory lookup covers development.
                return null;
            }
            final File libDir = jarOrClasses.getParentFile();
            final File appHome = libDir == null ? null : libDir.getParentFile();
            if (appHome == null) {
                return null;
            }
            final File configFile = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
            return configFile.exists() ? configFile : null;
        } catch (URISyntaxException | SecurityException | IllegalArgumentException e) {
            return null;
        }
    }
}
