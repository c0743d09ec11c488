package com.adkstream.common.logging;

import org.slf4j.event.Level;

import java.util.Map;

/**
 * Console verbosity levels accepted from the {@code LOG_LEVEL} environment
 * variable, with normalisation and SLF4J level mapping.
 */
public enum LogLevel {
    ERROR,
    WARN,
    INFO,
    DEBUG;

    public static final String ENV_VAR = "LOG_LEVEL";

    private static final Map<String, LogLevel> ALIASES = Map.of(
            "error", ERROR,
            "warn", WARN,
            "warning", WARN,
            "info", INFO,
            "debug", DEBUG);

    /**
     * Normalize an arbitrary string to a LogLevel, falling back to the given
     * default when the value is blank or unknown.
     */
    public static LogLevel normalize(String level, LogLevel fallback) {
        if (level == null || level.isBlank()) {
            return fallback;
        }
        LogLevel resolved = ALIASES.get(level.trim().toLowerCase());
        return resolved != null ? resolved : fallback;
    }

    public static LogLevel normalize(String level) {
        return normalize(level, INFO);
    }

    /**
     * Resolve the level configured through {@code LOG_LEVEL}.
     */
    public static LogLevel fromEnvironment(Map<String, String> env) {
        return normalize(env.get(ENV_VAR));
    }

    /**
     * Level name understood by Logback and Spring's {@code logging.level.*}.
     */
    public String toSlf4jLevel() {
        return name();
    }

    Level toSlf4jEventLevel() {
        return switch (this) {
            case ERROR -> Level.ERROR;
            case WARN -> Level.WARN;
            case INFO -> Level.INFO;
            case DEBUG -> Level.DEBUG;
        };
    }
}
