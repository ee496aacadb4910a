package com.osman.filelog.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Level;

/**
 * Resolves the log file location and console level from system properties, the
 * environment, {@code filelog.properties} on the classpath and persisted preferences,
 * in that order.
 */
public final class ConfigService {
    static final String LOG_PATH_PROPERTY = "filelog.path";
    static final String LOG_PATH_ENV = "FILELOG_PATH";
    static final String LOG_PATH_FILE_KEY = "log.path";
    static final String PREF_KEY_LOG_FILE = "log.file";

    static final String CONSOLE_LEVEL_PROPERTY = "filelog.console.level";
    static final String CONSOLE_LEVEL_ENV = "FILELOG_CONSOLE_LEVEL";
    static final String CONSOLE_LEVEL_FILE_KEY = "console.level";

    static final String RESOURCE_NAME = "filelog.properties";
    static final String DEFAULT_LOG_FILE_NAME = "filelog.log";

    private static final ConfigService INSTANCE =
        new ConfigService(PreferencesStore.global(), loadFileProperties(), System.getenv());

    private final PreferencesStore preferences;
    private final Properties fileProperties;
    private final Map<String, String> environment;

    ConfigService(PreferencesStore preferences, Properties fileProperties, Map<String, String> environment) {
        this.preferences = preferences;
        this.fileProperties = fileProperties;
        this.environment = environment;
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    /**
     * Path of the append-only log file. Resolved on every call so a changed override
     * takes effect the next time a writer is opened.
     */
    public Path getLogFile() {
        String configured = firstNonBlank(
            System.getProperty(LOG_PATH_PROPERTY),
            environment.get(LOG_PATH_ENV),
            fileProperties.getProperty(LOG_PATH_FILE_KEY)
        );
        if (configured != null) {
            return Paths.get(configured);
        }
        Optional<Path> persisted = preferences.getPath(PREF_KEY_LOG_FILE);
        return persisted.orElseGet(ConfigService::defaultLogFile);
    }

    public void setLogFile(Path logFile) {
        if (logFile == null) return;
        preferences.putPath(PREF_KEY_LOG_FILE, logFile);
    }

    public Level getConsoleLevel() {
        String raw = firstNonBlank(
            System.getProperty(CONSOLE_LEVEL_PROPERTY),
            environment.get(CONSOLE_LEVEL_ENV),
            fileProperties.getProperty(CONSOLE_LEVEL_FILE_KEY)
        );
        if (raw == null) {
            return Level.INFO;
        }
        try {
            return Level.parse(raw.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return Level.INFO;
        }
    }

    static Path defaultLogFile() {
        return Paths.get(System.getProperty("user.home"), ".filelog", DEFAULT_LOG_FILE_NAME);
    }

    private static Properties loadFileProperties() {
        Properties props = new Properties();
        try (InputStream stream = ConfigService.class
            .getClassLoader()
            .getResourceAsStream(RESOURCE_NAME)) {
            if (stream != null) {
                props.load(stream);
            }
        } catch (IOException ignored) {
            // malformed resource: fall back to system properties, environment and defaults
        }
        return props;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
