package org.termconf.cli.rendering;

import org.termconf.language.lexer.ConfigToken;
import org.termconf.language.lexer.ConfigTokenType;
import org.termconf.language.parser.ast.AddViewCommand;
import org.termconf.language.parser.ast.ConfigCommand;
import org.termconf.language.parser.ast.ConfigCommandVisitor;
import org.termconf.language.parser.ast.MapCommand;
import org.termconf.language.parser.ast.NewTabCommand;
import org.termconf.language.parser.ast.QuitCommand;
import org.termconf.language.parser.ast.RemoveTabCommand;
import org.termconf.language.parser.ast.SetCommand;
import org.termconf.language.parser.ast.SplitViewCommand;
import org.termconf.language.parser.ast.ThemeCommand;
import org.termconf.language.parser.ast.UnmapCommand;

import java.util.List;

/**
 * Renders commands back into the command language, one line per command.
 * Values that would not survive scanning as a plain word are quoted.
 */
public final class CommandDescriber implements ConfigCommandVisitor<String> {

    private static final CommandDescriber INSTANCE = new CommandDescriber();

    private CommandDescriber() {}

    /**
     * @param command The command.
     * @return The command as it would be written in a command file.
     */
    public static String describe(ConfigCommand command) {
        return command.accept(INSTANCE);
    }

    @Override
    public String visitSet(SetCommand command) {
        return "set " + word(command.variable()) + " " + word(command.value());
    }

    @Override
    public String visitTheme(ThemeCommand command) {
        StringBuilder line = new StringBuilder("theme");
        appendOption(line, "--name", command.name());
        appendOption(line, "--component", command.component());
        appendOption(line, "--bgcolor", command.bgcolor());
        appendOption(line, "--fgcolor", command.fgcolor());
        return line.toString();
    }

    @Override
    public String visitMap(MapCommand command) {
        return "map " + word(command.view()) + " " + word(command.from()) + " " + word(command.to());
    }

    @Override
    public String visitUnmap(UnmapCommand command) {
        return "unmap " + word(command.view()) + " " + word(command.from());
    }

    @Override
    public String visitQuit(QuitCommand command) {
        return "q";
    }

    @Override
    public String visitNewTab(NewTabCommand command) {
        return "addtab " + word(command.tabName());
    }

    @Override
    public String visitRemoveTab(RemoveTabCommand command) {
        return "rmtab";
    }

    @Override
    public String visitAddView(AddViewCommand command) {
        return withArgs("addview " + word(command.view()), command.args());
    }

    @Override
    public String visitSplitView(SplitViewCommand command) {
        String name = switch (command.orientation()) {
            case DYNAMIC -> "split";
            case HORIZONTAL -> "hsplit";
            case VERTICAL -> "vsplit";
        };
        return withArgs(name + " " + word(command.view()), command.args());
    }

    private static void appendOption(StringBuilder line, String option, ConfigToken value) {
        if (value != null) {
            line.append(' ').append(option).append(' ').append(word(value));
        }
    }

    private static String withArgs(String head, List<ConfigToken> args) {
        StringBuilder line = new StringBuilder(head);
        for (ConfigToken arg : args) {
            line.append(' ').append(word(arg));
        }
        return line.toString();
    }

    private static String word(ConfigToken token) {
        String text = token.text();
        if (!text.isEmpty()
                && text.chars().noneMatch(CommandDescriber::needsQuoting)
                && !(token.type() == ConfigTokenType.WORD && looksLikeOption(text))) {
            return text;
        }

        StringBuilder quoted = new StringBuilder("\"");
        for (char c : text.toCharArray()) {
            switch (c) {
                case '"' -> quoted.append("\\\"");
                case '\\' -> quoted.append("\\\\");
                case '\n' -> quoted.append("\\n");
                case '\t' -> quoted.append("\\t");
                default -> quoted.append(c);
            }
        }
        return quoted.append('"').toString();
    }

    // An unquoted word like this scans as an option.
    private static boolean looksLikeOption(String text) {
        return text.startsWith("--") && text.length() > 2;
    }

    private static boolean needsQuoting(int c) {
        return Character.isWhitespace(c) || c == ';' || c == '#' || c == '"' || c == '\\';
    }
}
