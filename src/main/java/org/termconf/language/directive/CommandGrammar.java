package org.termconf.language.directive;

import org.termconf.language.lexer.ConfigTokenType;

import java.util.List;

/**
 * Describes the argument tokens a command accepts.
 *
 * @param expectedTypes For fixed grammars, the exact sequence of argument token types; empty for
 *                      commands without arguments and for variable grammars.
 * @param variableArity {@code true} if the command takes every token up to the end of the line.
 */
public record CommandGrammar(List<ConfigTokenType> expectedTypes, boolean variableArity) {

    public CommandGrammar {
        expectedTypes = List.copyOf(expectedTypes);
    }

    /**
     * Creates a grammar that matches exactly the given token types, in order.
     * @param expectedTypes The expected argument types.
     * @return The grammar.
     */
    public static CommandGrammar fixed(ConfigTokenType... expectedTypes) {
        return new CommandGrammar(List.of(expectedTypes), false);
    }

    /**
     * Creates a grammar that accepts any tokens up to the next terminator.
     * @return The grammar.
     */
    public static CommandGrammar variable() {
        return new CommandGrammar(List.of(), true);
    }
}
