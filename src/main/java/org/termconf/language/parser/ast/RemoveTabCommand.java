package org.termconf.language.parser.ast;

/**
 * Removes the currently active tab.
 */
public record RemoveTabCommand() implements ConfigCommand {
    @Override
    public <R> R accept(ConfigCommandVisitor<R> visitor) {
        return visitor.visitRemoveTab(this);
    }
}
