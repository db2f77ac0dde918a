package org.fhirstack.junit.extensions.logging;

import ch.qos.logback.classic.Level;

/**
 * Levels the log watch annotations can refer to.
 */
public enum LogLevel {
    INFO(Level.INFO),
    WARN(Level.WARN),
    ERROR(Level.ERROR);

    private final Level logbackLevel;

    LogLevel(Level logbackLevel) {
        this.logbackLevel = logbackLevel;
    }

    Level toLogback() {
        return logbackLevel;
    }
}
