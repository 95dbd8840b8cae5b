package org.termconf.language.parser.features.theme;

import org.termconf.language.diagnostics.CommandConstructionException;
import org.termconf.language.diagnostics.ConfigErrorCode;
import org.termconf.language.directive.CommandGrammar;
import org.termconf.language.directive.ICommandHandler;
import org.termconf.language.lexer.ConfigToken;
import org.termconf.language.lexer.ConfigTokenType;
import org.termconf.language.parser.CommandContext;
import org.termconf.language.parser.ast.ConfigCommand;
import org.termconf.language.parser.ast.ThemeCommand;

import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Handler for the <code>theme</code> command.
 * The syntax is
 * <code>theme --name &lt;name&gt; --component &lt;component&gt; --bgcolor &lt;colour&gt; --fgcolor &lt;colour&gt;</code>,
 * with the four option/value pairs in any order.
 * <p>
 * Exactly four pairs are required, but the same switch may be repeated; the last value given
 * for a switch wins and a switch that was never given stays unset.
 */
public class ThemeCommandHandler implements ICommandHandler {

    /** The command name. */
    public static final String NAME = "theme";

    private static final CommandGrammar GRAMMAR = CommandGrammar.fixed(
            ConfigTokenType.OPTION, ConfigTokenType.WORD,
            ConfigTokenType.OPTION, ConfigTokenType.WORD,
            ConfigTokenType.OPTION, ConfigTokenType.WORD,
            ConfigTokenType.OPTION, ConfigTokenType.WORD);

    private static final Map<String, BiConsumer<Builder, ConfigToken>> OPTION_SETTERS = Map.of(
            "--name", (builder, value) -> builder.name = value,
            "--component", (builder, value) -> builder.component = value,
            "--bgcolor", (builder, value) -> builder.bgcolor = value,
            "--fgcolor", (builder, value) -> builder.fgcolor = value);

    @Override
    public CommandGrammar getGrammar() {
        return GRAMMAR;
    }

    @Override
    public ConfigCommand construct(CommandContext context, ConfigToken commandToken, List<ConfigToken> arguments)
            throws CommandConstructionException {
        Builder builder = new Builder();

        for (int i = 0; i + 1 < arguments.size(); i += 2) {
            ConfigToken optionToken = arguments.get(i);
            ConfigToken valueToken = arguments.get(i + 1);

            BiConsumer<Builder, ConfigToken> setter = OPTION_SETTERS.get(optionToken.text());
            if (setter == null) {
                throw new CommandConstructionException(context.error(ConfigErrorCode.INVALID_THEME_OPTION, optionToken,
                        "Invalid option for theme command: \"%s\"", optionToken.text()));
            }

            setter.accept(builder, valueToken);
        }

        return new ThemeCommand(builder.name, builder.component, builder.bgcolor, builder.fgcolor);
    }

    private static final class Builder {
        private ConfigToken name;
        private ConfigToken component;
        private ConfigToken bgcolor;
        private ConfigToken fgcolor;
    }
}
