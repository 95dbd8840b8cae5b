package org.termconf.cli.commands;

import org.termconf.cli.CommandLineInterface;
import org.termconf.cli.rendering.CommandDescriber;
import org.termconf.config.LoaderSettings;
import org.termconf.language.CommandLoader;
import org.termconf.language.parser.ParseResult;
import org.termconf.language.parser.ast.QuitCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Reads commands interactively, one per line, and echoes how each was understood.
 * The session ends at the end of input or on <code>q</code>.
 */
@Command(name = "prompt", description = "Reads commands from standard input and prints how each one parses.")
public class PromptCommand implements Callable<Integer> {

    private static final String PROMPT = ":";

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private InputStream input = System.in;

    /**
     * Replaces the stream commands are read from.
     * @param input The new input.
     */
    public void setInput(InputStream input) {
        this.input = input;
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        LoaderSettings settings = LoaderSettings.fromConfig(parent.getConfig());
        CommandLoader loader = new CommandLoader(settings);
        int errors = 0;

        BufferedReader reader = new BufferedReader(new InputStreamReader(input, settings.charset()));
        while (true) {
            out.print(PROMPT);
            out.flush();

            String line = reader.readLine();
            if (line == null) {
                break;
            }
            if (line.isBlank()) {
                continue;
            }

            boolean quit = false;
            for (ParseResult result : loader.parseLine(line)) {
                if (result.hasError()) {
                    err.println(result.error().message());
                    err.flush();
                    errors++;
                } else {
                    out.println(CommandDescriber.describe(result.command()));
                    if (result.command() instanceof QuitCommand) {
                        quit = true;
                        break;
                    }
                }
            }
            if (quit) {
                break;
            }
        }

        out.println();
        return errors > 0 ? ParseCommand.EXIT_PARSE_ERRORS : 0;
    }
}
