package org.termconf.language.parser.features.view;

import org.termconf.language.diagnostics.CommandConstructionException;
import org.termconf.language.diagnostics.ConfigErrorCode;
import org.termconf.language.lexer.ConfigScanner;
import org.termconf.language.lexer.ConfigToken;
import org.termconf.language.lexer.ConfigTokenType;
import org.termconf.language.parser.ConfigParser;
import org.termconf.language.parser.ast.AddViewCommand;
import org.termconf.language.parser.ast.ContainerOrientation;
import org.termconf.language.parser.ast.SplitViewCommand;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains unit tests for the {@link SplitViewCommandHandler} and {@link AddViewCommandHandler}.
 */
@Tag("unit")
public class SplitViewCommandHandlerTest {

    private final ConfigParser context = new ConfigParser(ConfigScanner.of(""), "");

    private static ConfigToken word(String text) {
        return new ConfigToken(ConfigTokenType.WORD, text, 1, 1);
    }

    @Test
    void testVariableArityGrammar() {
        assertThat(new SplitViewCommandHandler().getGrammar().variableArity()).isTrue();
        assertThat(new AddViewCommandHandler().getGrammar().variableArity()).isTrue();
        assertThat(new AddViewCommandHandler().getGrammar().expectedTypes()).isEmpty();
    }

    @Test
    void testOrientationFromCommandName() throws CommandConstructionException {
        SplitViewCommandHandler handler = new SplitViewCommandHandler();
        List<ConfigToken> arguments = List.of(word("RefView"), word("extra"));

        SplitViewCommand split = (SplitViewCommand) handler.construct(context, word("split"), arguments);
        SplitViewCommand hsplit = (SplitViewCommand) handler.construct(context, word("hsplit"), arguments);
        SplitViewCommand vsplit = (SplitViewCommand) handler.construct(context, word("vsplit"), arguments);

        assertThat(split.orientation()).isEqualTo(ContainerOrientation.DYNAMIC);
        assertThat(hsplit.orientation()).isEqualTo(ContainerOrientation.HORIZONTAL);
        assertThat(vsplit.orientation()).isEqualTo(ContainerOrientation.VERTICAL);
        assertThat(split.view().text()).isEqualTo("RefView");
        assertThat(split.args()).extracting(ConfigToken::text).containsExactly("extra");
    }

    /**
     * Verifies that a handler registered under a name it does not know reports that name.
     */
    @Test
    void testUnrecognisedName() {
        CommandConstructionException e = catchThrowableOfType(
                () -> new SplitViewCommandHandler().construct(context, word("xsplit"), List.of(word("RefView"))),
                CommandConstructionException.class);

        assertThat(e.getError().code()).isEqualTo(ConfigErrorCode.UNRECOGNISED_COMMAND);
        assertThat(e.getError().message()).isEqualTo("Unrecognised command: xsplit");
    }

    @Test
    void testMissingViewNamesTheCommand() {
        assertThatThrownBy(() -> new SplitViewCommandHandler().construct(context, word("vsplit"), List.of()))
                .isInstanceOf(CommandConstructionException.class)
                .hasMessage("Invalid vsplit command. Usage: vsplit [VIEW] [ARGS...]");
    }

    /**
     * Verifies that the constructed command does not share the argument list it was built from.
     */
    @Test
    void testArgumentsAreCopied() throws CommandConstructionException {
        List<ConfigToken> arguments = new ArrayList<>(List.of(word("CommitView"), word("a")));

        var addView = new AddViewCommandHandler().construct(context, word("addview"), arguments);
        arguments.add(word("b"));

        assertThat(addView).isInstanceOfSatisfying(AddViewCommand.class,
                command -> assertThat(command.args()).extracting(ConfigToken::text).containsExactly("a"));
    }
}
