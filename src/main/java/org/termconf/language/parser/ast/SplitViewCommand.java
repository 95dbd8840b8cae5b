package org.termconf.language.parser.ast;

import org.termconf.language.lexer.ConfigToken;

import java.util.List;

/**
 * Splits the currently active view with a new view.
 *
 * @param orientation How the views are laid out relative to each other.
 * @param view The name of the new view.
 * @param args The arguments passed to the view; possibly empty.
 */
public record SplitViewCommand(
        ContainerOrientation orientation,
        ConfigToken view,
        List<ConfigToken> args
) implements ConfigCommand {

    public SplitViewCommand {
        args = List.copyOf(args);
    }

    @Override
    public <R> R accept(ConfigCommandVisitor<R> visitor) {
        return visitor.visitSplitView(this);
    }
}
