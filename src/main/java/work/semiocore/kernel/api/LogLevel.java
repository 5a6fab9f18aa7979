package work.semiocore.kernel.api;

import java.util.Locale;

/**
 * Log thresholds accepted by {@code --log-level}; applied as the SLF4J simple logger default.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    static final String SIMPLE_LOGGER_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    /** Must run before the first logger is created to take effect. */
    public void apply() {
        System.setProperty(SIMPLE_LOGGER_PROPERTY, name().toLowerCase(Locale.ROOT));
    }
}
