package org.termconf.language.parser.ast;

import org.termconf.language.lexer.ConfigToken;

/**
 * Creates a new tab.
 *
 * @param tabName The name of the tab.
 */
public record NewTabCommand(ConfigToken tabName) implements ConfigCommand {
    @Override
    public <R> R accept(ConfigCommandVisitor<R> visitor) {
        return visitor.visitNewTab(this);
    }
}
