package org.termconf.language.parser.features.view;

import org.termconf.language.diagnostics.CommandConstructionException;
import org.termconf.language.directive.CommandGrammar;
import org.termconf.language.directive.ICommandHandler;
import org.termconf.language.lexer.ConfigToken;
import org.termconf.language.parser.CommandContext;
import org.termconf.language.parser.ast.AddViewCommand;
import org.termconf.language.parser.ast.ConfigCommand;

import java.util.List;

/**
 * Handler for the <code>addview</code> command.
 * The syntax is <code>addview &lt;view&gt; [args...]</code>.
 */
public class AddViewCommandHandler implements ICommandHandler {

    /** The command name. */
    public static final String NAME = "addview";

    @Override
    public CommandGrammar getGrammar() {
        return CommandGrammar.variable();
    }

    @Override
    public ConfigCommand construct(CommandContext context, ConfigToken commandToken, List<ConfigToken> arguments)
            throws CommandConstructionException {
        if (arguments.isEmpty()) {
            throw ViewUsage.missingView(context, commandToken);
        }

        return new AddViewCommand(arguments.get(0), arguments.subList(1, arguments.size()));
    }
}
