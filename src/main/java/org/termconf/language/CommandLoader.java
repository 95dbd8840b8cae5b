package org.termconf.language;

import org.termconf.config.LoaderSettings;
import org.termconf.language.diagnostics.ConfigError;
import org.termconf.language.diagnostics.DiagnosticsEngine;
import org.termconf.language.directive.CommandHandlerRegistry;
import org.termconf.language.lexer.ConfigScanner;
import org.termconf.language.parser.ConfigParser;
import org.termconf.language.parser.ParseResult;
import org.termconf.language.parser.ast.ConfigCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads command sources: whole configuration files, or single lines typed at a prompt.
 * <p>
 * A source is read to the end even if some of its commands are malformed; each error is
 * collected and reading continues with the next command. Reading stops early only if the input
 * itself fails or the configured error limit is reached.
 */
public class CommandLoader {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLoader.class);

    private final LoaderSettings settings;
    private final CommandHandlerRegistry registry;

    /**
     * Creates a loader for the built-in commands.
     * @param settings The loader settings.
     */
    public CommandLoader(LoaderSettings settings) {
        this(settings, CommandHandlerRegistry.builtIn());
    }

    /**
     * Creates a loader.
     * @param settings The loader settings.
     * @param registry The commands to recognise.
     */
    public CommandLoader(LoaderSettings settings, CommandHandlerRegistry registry) {
        this.settings = settings;
        this.registry = registry;
    }

    /**
     * Reads all commands from a file, using the file path as the source label.
     * @param file The file.
     * @return The commands and errors.
     * @throws IOException If the file cannot be opened.
     */
    public LoadResult load(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, settings.charset())) {
            return load(reader, file.toString());
        }
    }

    /**
     * Reads all commands from a character stream.
     * @param reader The input. It is not closed.
     * @param sourceLabel The label prefixed to error messages.
     * @return The commands and errors.
     */
    public LoadResult load(Reader reader, String sourceLabel) {
        ConfigParser parser = new ConfigParser(new ConfigScanner(reader), sourceLabel, registry);
        List<ConfigCommand> commands = new ArrayList<>();
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        while (true) {
            ParseResult result = parser.parseNext();

            if (result.hasError()) {
                ConfigError error = result.error();
                LOG.warn("{}", error.message());
                diagnostics.report(error);

                if (error.isFatal()) {
                    break;
                }
                if (settings.maxErrors() > 0 && diagnostics.errorCount() >= settings.maxErrors()) {
                    LOG.warn("Stopped reading '{}' after {} error(s)", sourceLabel, diagnostics.errorCount());
                    break;
                }
            } else if (result.command() != null) {
                commands.add(result.command());
            }

            if (result.endOfInput()) {
                break;
            }
        }

        LOG.info("Read {} command(s) with {} error(s) from '{}'", commands.size(), diagnostics.errorCount(), sourceLabel);
        return new LoadResult(sourceLabel, commands, diagnostics.getErrors());
    }

    /**
     * Parses every command of a line typed at a prompt. Commands on one line are separated by
     * {@code ;}; an error in one command does not hide the commands after it.
     * @param line The command line.
     * @return One result per command or error, in input order; empty for a blank line.
     */
    public List<ParseResult> parseLine(String line) {
        ConfigParser parser = new ConfigParser(ConfigScanner.of(line), settings.promptSourceLabel(), registry);
        List<ParseResult> results = new ArrayList<>();

        while (true) {
            ParseResult result = parser.parseNext();
            if (result.hasError() || result.command() != null) {
                results.add(result);
            }
            if (result.endOfInput() || (result.hasError() && result.error().isFatal())) {
                break;
            }
        }

        return results;
    }
}
