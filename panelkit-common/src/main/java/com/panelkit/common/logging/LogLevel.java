package com.panelkit.common.logging;

import java.util.Locale;
import java.util.Map;

/**
 * Log levels accepted in {@code logging.level}, ordered from most to least severe.
 */
public enum LogLevel {
    SILENT,
    ERROR,
    WARN,
    INFO,
    DEBUG,
    TRACE;

    private static final Map<String, LogLevel> ALIASES = Map.of(
            "silent", SILENT,
            "off", SILENT,
            "error", ERROR,
            "fatal", ERROR,
            "warn", WARN,
            "warning", WARN,
            "info", INFO,
            "debug", DEBUG,
            "trace", TRACE);

    public static LogLevel normalize(String level, LogLevel fallback) {
        if (level == null || level.isBlank()) {
            return fallback;
        }
        LogLevel resolved = ALIASES.get(level.trim().toLowerCase(Locale.ROOT));
        return resolved != null ? resolved : fallback;
    }

    public static LogLevel normalize(String level) {
        return normalize(level, INFO);
    }

    /**
     * A message at this level passes when the configured minimum is at least as verbose.
     */
    public boolean isEnabledFor(LogLevel minLevel) {
        if (this == SILENT || minLevel == SILENT) {
            return false;
        }
        return ordinal() <= minLevel.ordinal();
    }
}
