package org.termconf.language.parser.ast;

import org.termconf.language.lexer.ConfigToken;

/**
 * Maps a key sequence to another in a view.
 *
 * @param view The view the mapping applies to.
 * @param from The key sequence typed by the user.
 * @param to The key sequence it is translated to.
 */
public record MapCommand(ConfigToken view, ConfigToken from, ConfigToken to) implements ConfigCommand {
    @Override
    public <R> R accept(ConfigCommandVisitor<R> visitor) {
        return visitor.visitMap(this);
    }
}
