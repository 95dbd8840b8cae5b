package org.termconf.junit.extensions.logging;

/**
 * Log levels the {@link LogWatchExtension} can watch for.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
