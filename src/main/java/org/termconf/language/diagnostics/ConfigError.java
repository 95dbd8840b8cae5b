package org.termconf.language.diagnostics;

import java.io.IOException;

/**
 * A single error produced while parsing a command.
 *
 * @param code The error code.
 * @param sourceLabel The label of the input the error was found in; empty if none is configured.
 * @param line The 1-based line of the offending token, or 0 if there is no token.
 * @param column The 1-based column of the offending token, or 0 if there is no token.
 * @param message The fully formatted, user facing text of the error.
 * @param cause The read failure behind a {@link ConfigErrorCode#SCANNER_FAILURE}, otherwise {@code null}.
 */
public record ConfigError(
        ConfigErrorCode code,
        String sourceLabel,
        int line,
        int column,
        String message,
        IOException cause
) {

    /**
     * A scanner failure leaves the input in an unknown state; callers should stop reading from it.
     * @return true if no further commands can be read from the same source.
     */
    public boolean isFatal() {
        return code == ConfigErrorCode.SCANNER_FAILURE;
    }

    @Override
    public String toString() {
        return message;
    }
}
