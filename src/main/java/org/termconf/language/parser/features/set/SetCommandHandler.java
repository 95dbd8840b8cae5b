package org.termconf.language.parser.features.set;

import org.termconf.language.directive.CommandGrammar;
import org.termconf.language.directive.ICommandHandler;
import org.termconf.language.lexer.ConfigToken;
import org.termconf.language.lexer.ConfigTokenType;
import org.termconf.language.parser.CommandContext;
import org.termconf.language.parser.ast.ConfigCommand;
import org.termconf.language.parser.ast.SetCommand;

import java.util.List;

/**
 * Handler for the <code>set</code> command.
 * The syntax is <code>set &lt;variable&gt; &lt;value&gt;</code>.
 */
public class SetCommandHandler implements ICommandHandler {

    /** The command name. */
    public static final String NAME = "set";

    private static final CommandGrammar GRAMMAR = CommandGrammar.fixed(ConfigTokenType.WORD, ConfigTokenType.WORD);

    @Override
    public CommandGrammar getGrammar() {
        return GRAMMAR;
    }

    @Override
    public ConfigCommand construct(CommandContext context, ConfigToken commandToken, List<ConfigToken> arguments) {
        return new SetCommand(arguments.get(0), arguments.get(1));
    }
}
