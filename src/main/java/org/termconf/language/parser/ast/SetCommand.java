package org.termconf.language.parser.ast;

import org.termconf.language.lexer.ConfigToken;

/**
 * Sets a configuration variable to a value.
 *
 * @param variable The variable name.
 * @param value The new value.
 */
public record SetCommand(ConfigToken variable, ConfigToken value) implements ConfigCommand {
    @Override
    public <R> R accept(ConfigCommandVisitor<R> visitor) {
        return visitor.visitSet(this);
    }
}
