package org.termconf.language;

import org.termconf.language.diagnostics.ConfigError;
import org.termconf.language.parser.ast.ConfigCommand;

import java.util.List;

/**
 * Everything read from one command source.
 *
 * @param sourceLabel The label of the source.
 * @param commands The successfully parsed commands, in source order.
 * @param errors The errors, in source order.
 */
public record LoadResult(String sourceLabel, List<ConfigCommand> commands, List<ConfigError> errors) {

    public LoadResult {
        commands = List.copyOf(commands);
        errors = List.copyOf(errors);
    }

    /**
     * @return true if at least one error was found.
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
