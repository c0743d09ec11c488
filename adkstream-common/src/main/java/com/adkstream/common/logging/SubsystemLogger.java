package com.adkstream.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;

/**
 * Subsystem-aware logger that wraps SLF4J and tags every line with the
 * subsystem it came from.
 *
 * <p>
 * Usage:
 *
 * <pre>
 * SubsystemLogger log = SubsystemLogger.create("approval");
 * log.info("Approval resolved", Map.of("requestId", "call-1", "outcome", "timeout"));
 * </pre>
 *
 * The SLF4J logger name is {@code adkstream.<subsystem>}, so verbosity can be
 * tuned per subsystem from the logging configuration.
 */
public class SubsystemLogger {

    static final String MDC_SUBSYSTEM = "subsystem";

    private final String subsystem;
    private final Logger logger;

    private SubsystemLogger(String subsystem) {
        this.subsystem = subsystem;
        this.logger = LoggerFactory.getLogger("adkstream." + subsystem);
    }

    public static SubsystemLogger create(String subsystem) {
        return new SubsystemLogger(subsystem);
    }

    /**
     * Create a child logger with an extended subsystem path.
     */
    public SubsystemLogger child(String name) {
        return new SubsystemLogger(subsystem + "/" + name);
    }

    // -----------------------------------------------------------------------
    // Log methods
    // -----------------------------------------------------------------------

    public void debug(String message) {
        debug(message, null);
    }

    public void debug(String message, Map<String, Object> meta) {
        emit(LogLevel.DEBUG, message, meta);
    }

    public void info(String message) {
        info(message, null);
    }

    public void info(String message, Map<String, Object> meta) {
        emit(LogLevel.INFO, message, meta);
    }

    public void warn(String message) {
        warn(message, null);
    }

    public void warn(String message, Map<String, Object> meta) {
        emit(LogLevel.WARN, message, meta);
    }

    public void error(String message, Map<String, Object> meta) {
        emit(LogLevel.ERROR, message, meta);
    }

    public void error(String message, Throwable t) {
        try {
            MDC.put(MDC_SUBSYSTEM, subsystem);
            logger.error(formatMessage(message, null), t);
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    // -----------------------------------------------------------------------
    // Accessors
    // -----------------------------------------------------------------------

    public String getSubsystem() {
        return subsystem;
    }

    public boolean isDebugEnabled() {
        return logger.isDebugEnabled();
    }

    // -----------------------------------------------------------------------
    // Internals
    // -----------------------------------------------------------------------

    private void emit(LogLevel level, String message, Map<String, Object> meta) {
        if (!logger.isEnabledForLevel(level.toSlf4jEventLevel())) {
            return;
        }
        try {
            MDC.put(MDC_SUBSYSTEM, subsystem);
            String formatted = formatMessage(message, meta);
            switch (level) {
                case DEBUG -> logger.debug(formatted);
                case WARN -> logger.warn(formatted);
                case ERROR -> logger.error(formatted);
                default -> logger.info(formatted);
            }
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    String formatMessage(String message, Map<String, Object> meta) {
        if (meta == null || meta.isEmpty()) {
            return "[" + subsystem + "] " + message;
        }
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(subsystem).append("] ").append(message);
        sb.append(" {");
        boolean first = true;
        for (var entry : meta.entrySet()) {
            if (!first)
                sb.append(", ");
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        sb.append("}");
        return sb.toString();
    }
}
