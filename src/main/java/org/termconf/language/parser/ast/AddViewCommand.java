package org.termconf.language.parser.ast;

import org.termconf.language.lexer.ConfigToken;

import java.util.List;

/**
 * Adds a new view to the currently active view.
 *
 * @param view The name of the view to add.
 * @param args The arguments passed to the view; possibly empty.
 */
public record AddViewCommand(ConfigToken view, List<ConfigToken> args) implements ConfigCommand {

    public AddViewCommand {
        args = List.copyOf(args);
    }

    @Override
    public <R> R accept(ConfigCommandVisitor<R> visitor) {
        return visitor.visitAddView(this);
    }
}
