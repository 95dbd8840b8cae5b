package org.termconf.language.parser.ast;

import org.termconf.language.lexer.ConfigToken;

/**
 * Removes a key mapping from a view.
 *
 * @param view The view the mapping applies to.
 * @param from The mapped key sequence.
 */
public record UnmapCommand(ConfigToken view, ConfigToken from) implements ConfigCommand {
    @Override
    public <R> R accept(ConfigCommandVisitor<R> visitor) {
        return visitor.visitUnmap(this);
    }
}
