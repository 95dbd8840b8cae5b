package org.termconf.language.parser.features.view;

import org.termconf.language.diagnostics.CommandConstructionException;
import org.termconf.language.diagnostics.ConfigErrorCode;
import org.termconf.language.lexer.ConfigToken;
import org.termconf.language.parser.CommandContext;

final class ViewUsage {

    private ViewUsage() {}

    static CommandConstructionException missingView(CommandContext context, ConfigToken commandToken) {
        return new CommandConstructionException(context.error(ConfigErrorCode.INVALID_USAGE, commandToken,
                "Invalid %1$s command. Usage: %1$s [VIEW] [ARGS...]", commandToken.text()));
    }
}
