package com.panelkit.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * SLF4J wrapper that tags each line with a subsystem path such as
 * {@code router} or {@code store/guild}.
 *
 * <pre>
 * SubsystemLogger log = SubsystemLogger.create("recovery");
 * log.info("Recovered panel", Map.of("panelId", "status_board"));
 * </pre>
 *
 * The subsystem is also placed in the MDC under {@code subsystem} so the
 * logback pattern can print it. Global filters and a global minimum level
 * come from the {@code logging} config section.
 */
public class SubsystemLogger {

    private static final String MDC_SUBSYSTEM = "subsystem";
    private static final List<String> subsystemFilters = new CopyOnWriteArrayList<>();
    private static volatile LogLevel minimumLevel = LogLevel.TRACE;

    private final String subsystem;
    private final Logger logger;

    private SubsystemLogger(String subsystem) {
        this.subsystem = subsystem;
        this.logger = LoggerFactory.getLogger("panelkit." + subsystem.replace('/', '.'));
    }

    public static SubsystemLogger create(String subsystem) {
        return new SubsystemLogger(subsystem);
    }

    public SubsystemLogger child(String name) {
        return new SubsystemLogger(subsystem + "/" + name);
    }

    public void debug(String message) {
        emit(LogLevel.DEBUG, message, null, null);
    }

    public void debug(String message, Map<String, ?> meta) {
        emit(LogLevel.DEBUG, message, meta, null);
    }

    public void info(String message) {
        emit(LogLevel.INFO, message, null, null);
    }

    public void info(String message, Map<String, ?> meta) {
        emit(LogLevel.INFO, message, meta, null);
    }

    public void warn(String message) {
        emit(LogLevel.WARN, message, null, null);
    }

    public void warn(String message, Map<String, ?> meta) {
        emit(LogLevel.WARN, message, meta, null);
    }

    public void warn(String message, Map<String, ?> meta, Throwable t) {
        emit(LogLevel.WARN, message, meta, t);
    }

    public void error(String message) {
        emit(LogLevel.ERROR, message, null, null);
    }

    public void error(String message, Throwable t) {
        emit(LogLevel.ERROR, message, null, t);
    }

    public void error(String message, Map<String, ?> meta, Throwable t) {
        emit(LogLevel.ERROR, message, meta, t);
    }

    /**
     * Apply the {@code logging} config section. Empty filters let every subsystem through.
     */
    public static void configure(String level, List<String> filters) {
        minimumLevel = LogLevel.normalize(level, LogLevel.INFO);
        subsystemFilters.clear();
        if (filters != null) {
            filters.stream()
                    .filter(s -> s != null && !s.isBlank())
                    .map(String::trim)
                    .forEach(subsystemFilters::add);
        }
    }

    public static void reset() {
        minimumLevel = LogLevel.TRACE;
        subsystemFilters.clear();
    }

    public boolean shouldLog(LogLevel level) {
        if (!level.isEnabledFor(minimumLevel)) {
            return false;
        }
        if (subsystemFilters.isEmpty()) {
            return true;
        }
        return subsystemFilters.stream().anyMatch(
                prefix -> subsystem.equals(prefix) || subsystem.startsWith(prefix + "/"));
    }

    public String getSubsystem() {
        return subsystem;
    }

    private void emit(LogLevel level, String message, Map<String, ?> meta, Throwable t) {
        if (!shouldLog(level)) {
            return;
        }
        String formatted = format(message, meta);
        MDC.put(MDC_SUBSYSTEM, subsystem);
        try {
            switch (level) {
                case TRACE -> logger.trace(formatted, t);
                case DEBUG -> logger.debug(formatted, t);
                case INFO -> logger.info(formatted, t);
                case WARN -> logger.warn(formatted, t);
                default -> logger.error(formatted, t);
            }
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    String format(String message, Map<String, ?> meta) {
        StringBuilder sb = new StringBuilder("[").append(subsystem).append("] ").append(message);
        if (meta != null && !meta.isEmpty()) {
            sb.append(" {");
            boolean first = true;
            for (var entry : meta.entrySet()) {
                if (!first) {
                    sb.append(", ");
                }
                sb.append(entry.getKey()).append('=').append(entry.getValue());
                first = false;
            }
            sb.append('}');
        }
        return sb.toString();
    }
}
