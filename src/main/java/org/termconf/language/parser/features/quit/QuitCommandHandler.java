package org.termconf.language.parser.features.quit;

import org.termconf.language.directive.CommandGrammar;
import org.termconf.language.directive.ICommandHandler;
import org.termconf.language.lexer.ConfigToken;
import org.termconf.language.parser.CommandContext;
import org.termconf.language.parser.ast.ConfigCommand;
import org.termconf.language.parser.ast.QuitCommand;

import java.util.List;

/**
 * Handler for the <code>q</code> command. It takes no arguments.
 */
public class QuitCommandHandler implements ICommandHandler {

    /** The command name. */
    public static final String NAME = "q";

    private static final CommandGrammar GRAMMAR = CommandGrammar.fixed();

    @Override
    public CommandGrammar getGrammar() {
        return GRAMMAR;
    }

    @Override
    public ConfigCommand construct(CommandContext context, ConfigToken commandToken, List<ConfigToken> arguments) {
        return new QuitCommand();
    }
}
