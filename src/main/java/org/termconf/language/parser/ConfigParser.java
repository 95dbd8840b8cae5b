package org.termconf.language.parser;

import org.termconf.language.diagnostics.CommandConstructionException;
import org.termconf.language.diagnostics.ConfigError;
import org.termconf.language.diagnostics.ConfigErrorCode;
import org.termconf.language.diagnostics.ConfigErrorFormatter;
import org.termconf.language.directive.CommandGrammar;
import org.termconf.language.directive.CommandHandlerRegistry;
import org.termconf.language.directive.ICommandHandler;
import org.termconf.language.lexer.ConfigScanner;
import org.termconf.language.lexer.ConfigToken;
import org.termconf.language.lexer.ConfigTokenType;
import org.termconf.language.lexer.TokenScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The parser for the command language. It pulls tokens from a {@link TokenScanner} and
 * produces one {@link org.termconf.language.parser.ast.ConfigCommand} per call to {@link #parseNext()}.
 * <p>
 * Errors are returned as values. After an error the parser discards the rest of the offending
 * command, so the next call starts at a command boundary.
 * <p>
 * A parser is not thread safe, but separate instances over separate inputs are independent.
 */
public class ConfigParser implements CommandContext {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigParser.class);

    private final TokenScanner scanner;
    private final String sourceLabel;
    private final CommandHandlerRegistry registry;
    private ConfigToken lastToken;

    /**
     * Constructs a new parser using the built-in commands.
     * @param scanner The token source. The parser takes exclusive ownership of it.
     * @param sourceLabel The label used to prefix error messages; may be empty.
     */
    public ConfigParser(TokenScanner scanner, String sourceLabel) {
        this(scanner, sourceLabel, CommandHandlerRegistry.builtIn());
    }

    /**
     * Constructs a new parser reading from a character stream, using the built-in commands.
     * @param reader The input.
     * @param sourceLabel The label used to prefix error messages; may be empty.
     */
    public ConfigParser(Reader reader, String sourceLabel) {
        this(new ConfigScanner(reader), sourceLabel);
    }

    /**
     * Constructs a new parser.
     * @param scanner The token source. The parser takes exclusive ownership of it.
     * @param sourceLabel The label used to prefix error messages; may be empty.
     * @param registry The commands this parser understands.
     */
    public ConfigParser(TokenScanner scanner, String sourceLabel, CommandHandlerRegistry registry) {
        this.scanner = scanner;
        this.sourceLabel = sourceLabel == null ? "" : sourceLabel;
        this.registry = registry;
    }

    /**
     * Parses the next command from the input.
     * <p>
     * Returns a command, the end of input, or an error. An error caused by a read failure of
     * the underlying input is returned without recovery and is {@linkplain ConfigError#isFatal() fatal}.
     *
     * @return The result; never {@code null}.
     */
    public ParseResult parseNext() {
        ParseResult result;
        try {
            result = parseStatement();
        } catch (IOException e) {
            LOG.debug("Failed to read from '{}': {}", sourceLabel, e.getMessage());
            return ParseResult.failure(ConfigErrorFormatter.scannerFailure(sourceLabel, e));
        }

        if (result.hasError()) {
            discardTokensUntilNextCommand();
        } else if (result.command() != null) {
            LOG.debug("Parsed command {}", result.command());
        }

        return result;
    }

    @Override
    public String getSourceLabel() {
        return sourceLabel;
    }

    @Override
    public ConfigError error(ConfigErrorCode code, ConfigToken token, String template, Object... args) {
        return ConfigErrorFormatter.error(code, sourceLabel, token, template, args);
    }

    private ParseResult parseStatement() throws IOException {
        while (true) {
            ConfigToken token = scan();

            switch (token.type()) {
                case WORD:
                    return parseCommand(token);
                case TERMINATOR:
                    continue;
                case EOF:
                    return ParseResult.atEnd();
                case OPTION:
                    return ParseResult.failure(error(ConfigErrorCode.UNEXPECTED_OPTION, token,
                            "Unexpected Option \"%s\"", token.text()));
                case INVALID:
                    return ParseResult.failure(error(ConfigErrorCode.SYNTAX_ERROR, token, "Syntax Error"));
                default:
                    return ParseResult.failure(error(ConfigErrorCode.UNEXPECTED_TOKEN, token,
                            "Unexpected token \"%s\"", token.text()));
            }
        }
    }

    private ParseResult parseCommand(ConfigToken commandToken) throws IOException {
        Optional<ICommandHandler> handlerOptional = registry.get(commandToken.text());
        if (handlerOptional.isEmpty()) {
            return ParseResult.failure(error(ConfigErrorCode.INVALID_COMMAND, commandToken,
                    "Invalid command \"%s\"", commandToken.text()));
        }

        ICommandHandler handler = handlerOptional.get();
        CommandGrammar grammar = handler.getGrammar();
        if (grammar.variableArity()) {
            return parseVariableArityCommand(handler, commandToken);
        }

        List<ConfigToken> arguments = new ArrayList<>(grammar.expectedTypes().size());
        for (ConfigTokenType expectedType : grammar.expectedTypes()) {
            ConfigToken token = scan();

            if (token.hasError()) {
                return ParseResult.failure(error(ConfigErrorCode.SYNTAX_ERROR, token, "Syntax Error"));
            }
            if (token.type() == ConfigTokenType.EOF) {
                return ParseResult.failureAtEnd(error(ConfigErrorCode.UNEXPECTED_EOF, token, "Unexpected EOF"));
            }
            if (token.type() != expectedType) {
                return ParseResult.failure(error(ConfigErrorCode.UNEXPECTED_TOKEN_TYPE, token,
                        "Expected %s but got %s: \"%s\"",
                        expectedType.displayName(), token.type().displayName(), token.text()));
            }

            arguments.add(token);
        }

        return construct(handler, commandToken, arguments);
    }

    private ParseResult parseVariableArityCommand(ICommandHandler handler, ConfigToken commandToken) throws IOException {
        List<ConfigToken> arguments = new ArrayList<>();

        while (true) {
            ConfigToken token = scan();

            if (token.hasError()) {
                return ParseResult.failure(error(ConfigErrorCode.SYNTAX_ERROR, token, "Syntax Error"));
            }
            if (token.type() == ConfigTokenType.EOF || token.type() == ConfigTokenType.TERMINATOR) {
                break;
            }

            arguments.add(token);
        }

        return construct(handler, commandToken, arguments);
    }

    private ParseResult construct(ICommandHandler handler, ConfigToken commandToken, List<ConfigToken> arguments) {
        try {
            return ParseResult.of(handler.construct(this, commandToken, arguments));
        } catch (CommandConstructionException e) {
            return ParseResult.failure(e.getError());
        }
    }

    /**
     * Reads the next token, skipping whitespace and comments.
     */
    private ConfigToken scan() throws IOException {
        ConfigToken token;
        do {
            token = scanner.scan();
        } while (token.type() == ConfigTokenType.WHITE_SPACE || token.type() == ConfigTokenType.COMMENT);

        lastToken = token;
        return token;
    }

    /**
     * Skips the remainder of a failed command. If the failure was detected on a terminator or
     * at the end of input the parser is already at a command boundary and nothing is skipped.
     * Read failures end the skip silently; the next call will report them.
     */
    private void discardTokensUntilNextCommand() {
        if (isCommandBoundary(lastToken)) {
            return;
        }

        int discarded = 0;
        try {
            ConfigToken token;
            do {
                token = scan();
                discarded++;
            } while (!isCommandBoundary(token));
        } catch (IOException e) {
            LOG.debug("Read failure while recovering in '{}': {}", sourceLabel, e.getMessage());
            return;
        }

        LOG.debug("Discarded {} token(s) while recovering in '{}'", discarded, sourceLabel);
    }

    private static boolean isCommandBoundary(ConfigToken token) {
        return token == null
                || token.type() == ConfigTokenType.TERMINATOR
                || token.type() == ConfigTokenType.EOF;
    }
}
