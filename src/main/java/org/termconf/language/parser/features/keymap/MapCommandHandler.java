package org.termconf.language.parser.features.keymap;

import org.termconf.language.directive.CommandGrammar;
import org.termconf.language.directive.ICommandHandler;
import org.termconf.language.lexer.ConfigToken;
import org.termconf.language.lexer.ConfigTokenType;
import org.termconf.language.parser.CommandContext;
import org.termconf.language.parser.ast.ConfigCommand;
import org.termconf.language.parser.ast.MapCommand;

import java.util.List;

/**
 * Handler for the <code>map</code> command.
 * The syntax is <code>map &lt;view&gt; &lt;from&gt; &lt;to&gt;</code>.
 */
public class MapCommandHandler implements ICommandHandler {

    /** The command name. */
    public static final String NAME = "map";

    private static final CommandGrammar GRAMMAR =
            CommandGrammar.fixed(ConfigTokenType.WORD, ConfigTokenType.WORD, ConfigTokenType.WORD);

    @Override
    public CommandGrammar getGrammar() {
        return GRAMMAR;
    }

    @Override
    public ConfigCommand construct(CommandContext context, ConfigToken commandToken, List<ConfigToken> arguments) {
        return new MapCommand(arguments.get(0), arguments.get(1), arguments.get(2));
    }
}
