package org.termconf.language.parser.features.view;

import org.termconf.language.diagnostics.CommandConstructionException;
import org.termconf.language.diagnostics.ConfigErrorCode;
import org.termconf.language.directive.CommandGrammar;
import org.termconf.language.directive.ICommandHandler;
import org.termconf.language.lexer.ConfigToken;
import org.termconf.language.parser.CommandContext;
import org.termconf.language.parser.ast.ConfigCommand;
import org.termconf.language.parser.ast.ContainerOrientation;
import org.termconf.language.parser.ast.SplitViewCommand;

import java.util.List;

/**
 * Handler for the <code>split</code>, <code>hsplit</code> and <code>vsplit</code> commands.
 * The syntax is <code>&lt;command&gt; &lt;view&gt; [args...]</code>; the orientation of the
 * split follows from the command name.
 */
public class SplitViewCommandHandler implements ICommandHandler {

    /** Splits in the orientation that best fits the available space. */
    public static final String SPLIT = "split";
    /** Splits horizontally. */
    public static final String HSPLIT = "hsplit";
    /** Splits vertically. */
    public static final String VSPLIT = "vsplit";

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

        ContainerOrientation orientation;
        switch (commandToken.text()) {
            case SPLIT -> orientation = ContainerOrientation.DYNAMIC;
            case HSPLIT -> orientation = ContainerOrientation.HORIZONTAL;
            case VSPLIT -> orientation = ContainerOrientation.VERTICAL;
            default -> throw new CommandConstructionException(context.error(ConfigErrorCode.UNRECOGNISED_COMMAND,
                    commandToken, "Unrecognised command: %s", commandToken.text()));
        }

        return new SplitViewCommand(orientation, arguments.get(0), arguments.subList(1, arguments.size()));
    }
}
