package org.termconf.language.parser.features.tab;

import org.termconf.language.directive.CommandGrammar;
import org.termconf.language.directive.ICommandHandler;
import org.termconf.language.lexer.ConfigToken;
import org.termconf.language.lexer.ConfigTokenType;
import org.termconf.language.parser.CommandContext;
import org.termconf.language.parser.ast.ConfigCommand;
import org.termconf.language.parser.ast.NewTabCommand;

import java.util.List;

/**
 * Handler for the <code>addtab</code> command.
 * The syntax is <code>addtab &lt;name&gt;</code>.
 */
public class NewTabCommandHandler implements ICommandHandler {

    /** The command name. */
    public static final String NAME = "addtab";

    private static final CommandGrammar GRAMMAR = CommandGrammar.fixed(ConfigTokenType.WORD);

    @Override
    public CommandGrammar getGrammar() {
        return GRAMMAR;
    }

    @Override
    public ConfigCommand construct(CommandContext context, ConfigToken commandToken, List<ConfigToken> arguments) {
        return new NewTabCommand(arguments.get(0));
    }
}
