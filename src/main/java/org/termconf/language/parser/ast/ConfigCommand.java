package org.termconf.language.parser.ast;

/**
 * The base interface for all commands produced by the parser.
 * <p>
 * Commands hold the tokens they were built from, so an executor can still report errors
 * against their source positions.
 */
public sealed interface ConfigCommand
        permits SetCommand, ThemeCommand, MapCommand, UnmapCommand, QuitCommand,
                NewTabCommand, RemoveTabCommand, AddViewCommand, SplitViewCommand {

    /**
     * Dispatches this command to the matching method of the visitor.
     * @param visitor The visitor.
     * @param <R> The result type.
     * @return The visitor's result.
     */
    <R> R accept(ConfigCommandVisitor<R> visitor);
}
