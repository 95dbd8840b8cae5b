package org.termconf.language.parser.features.keymap;

import org.termconf.language.directive.CommandGrammar;
import org.termconf.language.directive.ICommandHandler;
import org.termconf.language.lexer.ConfigToken;
import org.termconf.language.lexer.ConfigTokenType;
import org.termconf.language.parser.CommandContext;
import org.termconf.language.parser.ast.ConfigCommand;
import org.termconf.language.parser.ast.UnmapCommand;

import java.util.List;

/**
 * Handler for the <code>unmap</code> command.
 * The syntax is <code>unmap &lt;view&gt; &lt;from&gt;</code>.
 */
public class UnmapCommandHandler implements ICommandHandler {

    /** The command name. */
    public static final String NAME = "unmap";

    private static final CommandGrammar GRAMMAR = CommandGrammar.fixed(ConfigTokenType.WORD, ConfigTokenType.WORD);

    @Override
    public CommandGrammar getGrammar() {
        return GRAMMAR;
    }

    @Override
    public ConfigCommand construct(CommandContext context, ConfigToken commandToken, List<ConfigToken> arguments) {
        return new UnmapCommand(arguments.get(0), arguments.get(1));
    }
}
