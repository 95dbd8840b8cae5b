package org.termconf.language.parser;

import org.termconf.language.diagnostics.ConfigError;
import org.termconf.language.diagnostics.ConfigErrorCode;
import org.termconf.language.lexer.ConfigToken;

/**
 * Encapsulates what a command handler may use from the parser while building a command,
 * without coupling handlers to the parser implementation.
 */
public interface CommandContext {

    /**
     * @return The label of the input being parsed; empty if none is configured.
     */
    String getSourceLabel();

    /**
     * Creates an error positioned at a token of the current input.
     * @param code The error code.
     * @param token The offending token.
     * @param template A {@link String#format} template for the message.
     * @param args The template arguments.
     * @return The error.
     */
    ConfigError error(ConfigErrorCode code, ConfigToken token, String template, Object... args);
}
