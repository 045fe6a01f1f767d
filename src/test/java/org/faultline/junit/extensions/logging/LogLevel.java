package org.faultline.junit.extensions.logging;

/**
 * Log levels that tests can watch for.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
