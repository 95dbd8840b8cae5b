package org.termconf.language.directive;

import org.termconf.language.diagnostics.CommandConstructionException;
import org.termconf.language.lexer.ConfigToken;
import org.termconf.language.parser.CommandContext;
import org.termconf.language.parser.ast.ConfigCommand;

import java.util.List;

/**
 * The base interface for all command handlers.
 * Each handler declares the grammar of a command and builds the command from the tokens
 * the parser matched against that grammar.
 */
public interface ICommandHandler {

    /**
     * @return The grammar the parser enforces before calling {@link #construct}.
     */
    CommandGrammar getGrammar();

    /**
     * Builds the command.
     *
     * @param context Gives access to error reporting for the current input.
     * @param commandToken The token holding the command name.
     * @param arguments The matched argument tokens. For fixed grammars these correspond one to one
     *                  with {@link CommandGrammar#expectedTypes()}.
     * @return The command.
     * @throws CommandConstructionException If the arguments are not valid for this command.
     */
    ConfigCommand construct(CommandContext context, ConfigToken commandToken, List<ConfigToken> arguments)
            throws CommandConstructionException;
}
