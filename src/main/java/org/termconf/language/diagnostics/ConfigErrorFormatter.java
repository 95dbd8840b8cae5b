package org.termconf.language.diagnostics;

import org.termconf.language.lexer.ConfigToken;

import java.io.IOException;

/**
 * Builds {@link ConfigError}s. All positioned errors are rendered through {@link #format},
 * so diagnostics read the same regardless of where they are raised.
 */
public final class ConfigErrorFormatter {

    private ConfigErrorFormatter() {}

    /**
     * Renders an error message for a token.
     * <p>
     * The result is {@code "<sourceLabel>:<line>:<column> <message>"}, or just the message if
     * {@code sourceLabel} is empty. A lexical error carried by the token is appended as
     * {@code ": <error>"}.
     *
     * @param sourceLabel The input label; may be empty or {@code null}.
     * @param token The offending token.
     * @param template A {@link String#format} template.
     * @param args The template arguments.
     * @return The rendered message.
     */
    public static String format(String sourceLabel, ConfigToken token, String template, Object... args) {
        StringBuilder buffer = new StringBuilder();

        if (sourceLabel != null && !sourceLabel.isEmpty()) {
            buffer.append(sourceLabel)
                    .append(':')
                    .append(token.line())
                    .append(':')
                    .append(token.column())
                    .append(' ');
        }

        buffer.append(String.format(template, args));

        if (token.hasError()) {
            buffer.append(": ").append(token.error());
        }

        return buffer.toString();
    }

    /**
     * Creates an error positioned at a token.
     * @param code The error code.
     * @param sourceLabel The input label.
     * @param token The offending token.
     * @param template A {@link String#format} template.
     * @param args The template arguments.
     * @return The error.
     */
    public static ConfigError error(ConfigErrorCode code, String sourceLabel, ConfigToken token,
                                    String template, Object... args) {
        return new ConfigError(code, labelOf(sourceLabel), token.line(), token.column(),
                format(sourceLabel, token, template, args), null);
    }

    /**
     * Creates an error for a failure of the underlying input. It has no position.
     * @param sourceLabel The input label.
     * @param cause The read failure.
     * @return The error.
     */
    public static ConfigError scannerFailure(String sourceLabel, IOException cause) {
        String label = labelOf(sourceLabel);
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        String message = label.isEmpty() ? detail : label + ": " + detail;
        return new ConfigError(ConfigErrorCode.SCANNER_FAILURE, label, 0, 0, message, cause);
    }

    private static String labelOf(String sourceLabel) {
        return sourceLabel == null ? "" : sourceLabel;
    }
}
