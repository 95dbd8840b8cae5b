package org.termconf.language.parser.ast;

/**
 * Quits the application.
 */
public record QuitCommand() implements ConfigCommand {
    @Override
    public <R> R accept(ConfigCommandVisitor<R> visitor) {
        return visitor.visitQuit(this);
    }
}
