package org.termconf.language.diagnostics;

/**
 * Thrown by a command handler when matched tokens cannot be turned into a command.
 * The parser converts it back into the {@link ConfigError} it carries.
 */
public class CommandConstructionException extends Exception {

    private final transient ConfigError error;

    /**
     * Constructs a new exception for the given error.
     * @param error The error describing why construction failed.
     */
    public CommandConstructionException(ConfigError error) {
        super(error.message(), null);
        this.error = error;
    }

    /**
     * @return The error describing why construction failed.
     */
    public ConfigError getError() {
        return error;
    }
}
