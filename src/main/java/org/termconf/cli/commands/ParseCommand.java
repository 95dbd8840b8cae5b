package org.termconf.cli.commands;

import org.termconf.cli.CommandLineInterface;
import org.termconf.cli.rendering.CommandDescriber;
import org.termconf.cli.rendering.CommandJsonWriter;
import org.termconf.config.LoaderSettings;
import org.termconf.language.CommandLoader;
import org.termconf.language.LoadResult;
import org.termconf.language.diagnostics.ConfigError;
import org.termconf.language.parser.ast.ConfigCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "parse", description = "Parses a command file and prints the commands and errors it contains.")
public class ParseCommand implements Callable<Integer> {

    /** Exit code when the file was read but contained errors. */
    public static final int EXIT_PARSE_ERRORS = 1;
    /** Exit code when the file could not be found. */
    public static final int EXIT_MISSING_FILE = 2;

    @Option(names = {"-f", "--file"}, required = true, description = "The command file to parse.")
    private File file;

    @Option(names = {"-j", "--json"}, description = "Print the result as JSON.")
    private boolean json;

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (!file.isFile()) {
            err.println("File not found: " + file.getPath());
            return EXIT_MISSING_FILE;
        }

        CommandLoader loader = new CommandLoader(LoaderSettings.fromConfig(parent.getConfig()));
        LoadResult result = loader.load(file.toPath());

        if (json) {
            out.println(CommandJsonWriter.toJson(result));
        } else {
            for (ConfigCommand command : result.commands()) {
                out.println(CommandDescriber.describe(command));
            }
            for (ConfigError error : result.errors()) {
                err.println(error.message());
            }
        }

        return result.hasErrors() ? EXIT_PARSE_ERRORS : 0;
    }
}
