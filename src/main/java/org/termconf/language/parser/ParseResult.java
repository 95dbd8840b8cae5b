package org.termconf.language.parser;

import org.termconf.language.diagnostics.ConfigError;
import org.termconf.language.parser.ast.ConfigCommand;

/**
 * The outcome of one call to {@link ConfigParser#parseNext()}.
 * At most one of {@code command} and {@code error} is set.
 *
 * @param command The parsed command, or {@code null}.
 * @param endOfInput {@code true} once the input is exhausted; callers stop looping.
 * @param error The error, or {@code null}.
 */
public record ParseResult(ConfigCommand command, boolean endOfInput, ConfigError error) {

    private static final ParseResult END_OF_INPUT = new ParseResult(null, true, null);

    static ParseResult of(ConfigCommand command) {
        return new ParseResult(command, false, null);
    }

    static ParseResult atEnd() {
        return END_OF_INPUT;
    }

    static ParseResult failure(ConfigError error) {
        return new ParseResult(null, false, error);
    }

    static ParseResult failureAtEnd(ConfigError error) {
        return new ParseResult(null, true, error);
    }

    /**
     * @return true if this result carries an error.
     */
    public boolean hasError() {
        return error != null;
    }
}
