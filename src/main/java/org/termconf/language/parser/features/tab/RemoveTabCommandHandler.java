package org.termconf.language.parser.features.tab;

import org.termconf.language.directive.CommandGrammar;
import org.termconf.language.directive.ICommandHandler;
import org.termconf.language.lexer.ConfigToken;
import org.termconf.language.parser.CommandContext;
import org.termconf.language.parser.ast.ConfigCommand;
import org.termconf.language.parser.ast.RemoveTabCommand;

import java.util.List;

/**
 * Handler for the <code>rmtab</code> command, which removes the active tab.
 */
public class RemoveTabCommandHandler implements ICommandHandler {

    /** The command name. */
    public static final String NAME = "rmtab";

    private static final CommandGrammar GRAMMAR = CommandGrammar.fixed();

    @Override
    public CommandGrammar getGrammar() {
        return GRAMMAR;
    }

    @Override
    public ConfigCommand construct(CommandContext context, ConfigToken commandToken, List<ConfigToken> arguments) {
        return new RemoveTabCommand();
    }
}
