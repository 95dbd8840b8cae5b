package org.termconf.language.directive;

import org.termconf.language.parser.features.keymap.MapCommandHandler;
import org.termconf.language.parser.features.keymap.UnmapCommandHandler;
import org.termconf.language.parser.features.quit.QuitCommandHandler;
import org.termconf.language.parser.features.set.SetCommandHandler;
import org.termconf.language.parser.features.tab.NewTabCommandHandler;
import org.termconf.language.parser.features.tab.RemoveTabCommandHandler;
import org.termconf.language.parser.features.theme.ThemeCommandHandler;
import org.termconf.language.parser.features.view.AddViewCommandHandler;
import org.termconf.language.parser.features.view.SplitViewCommandHandler;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A registry of command handlers, keyed by command name. Names are case sensitive.
 * <p>
 * A registry is immutable once built and may be shared between parsers on different threads.
 */
public final class CommandHandlerRegistry {

    private static final CommandHandlerRegistry BUILT_IN = initialize();

    private final Map<String, ICommandHandler> handlers;

    private CommandHandlerRegistry(Map<String, ICommandHandler> handlers) {
        this.handlers = Map.copyOf(handlers);
    }

    /**
     * Gets the handler for a given command name.
     * @param commandName The name of the command, exactly as written.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<ICommandHandler> get(String commandName) {
        return Optional.ofNullable(handlers.get(commandName));
    }

    /**
     * @return The names of all registered commands.
     */
    public Set<String> commandNames() {
        return handlers.keySet();
    }

    /**
     * @return The shared registry holding all built-in commands.
     */
    public static CommandHandlerRegistry builtIn() {
        return BUILT_IN;
    }

    /**
     * Builds a new registry with all the built-in handlers.
     * @return A new registry.
     */
    public static CommandHandlerRegistry initialize() {
        return builder()
                .register(SetCommandHandler.NAME, new SetCommandHandler())
                .register(ThemeCommandHandler.NAME, new ThemeCommandHandler())
                .register(MapCommandHandler.NAME, new MapCommandHandler())
                .register(UnmapCommandHandler.NAME, new UnmapCommandHandler())
                .register(QuitCommandHandler.NAME, new QuitCommandHandler())
                .register(NewTabCommandHandler.NAME, new NewTabCommandHandler())
                .register(RemoveTabCommandHandler.NAME, new RemoveTabCommandHandler())
                .register(AddViewCommandHandler.NAME, new AddViewCommandHandler())
                .register(SplitViewCommandHandler.VSPLIT, new SplitViewCommandHandler())
                .register(SplitViewCommandHandler.HSPLIT, new SplitViewCommandHandler())
                .register(SplitViewCommandHandler.SPLIT, new SplitViewCommandHandler())
                .build();
    }

    /**
     * @return A builder for a custom registry.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects handlers before freezing them into a {@link CommandHandlerRegistry}.
     */
    public static final class Builder {
        private final Map<String, ICommandHandler> handlers = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Registers a handler.
         * @param commandName The command name.
         * @param handler The handler.
         * @return This builder.
         * @throws IllegalArgumentException If the name is already registered.
         */
        public Builder register(String commandName, ICommandHandler handler) {
            if (handlers.putIfAbsent(commandName, handler) != null) {
                throw new IllegalArgumentException("Command '" + commandName + "' is already registered.");
            }
            return this;
        }

        /**
         * @return The immutable registry.
         */
        public CommandHandlerRegistry build() {
            return new CommandHandlerRegistry(handlers);
        }
    }
}
