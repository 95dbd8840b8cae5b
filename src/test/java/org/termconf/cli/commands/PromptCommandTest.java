package org.termconf.cli.commands;

import org.termconf.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class PromptCommandTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String input) {
        CommandLine cmd = new CommandLine(new CommandLineInterface());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        PromptCommand prompt = cmd.getSubcommands().get("prompt").getCommand();
        prompt.setInput(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)));
        return cmd.execute("prompt");
    }

    /**
     * Verifies that each line is echoed or reported and that <code>q</code> ends the session.
     */
    @Test
    void testSessionEndsOnQuit() {
        int exitCode = run("set a b\n\nbogus x\nq\nset never reached\n");

        assertThat(exitCode).isEqualTo(ParseCommand.EXIT_PARSE_ERRORS);
        assertThat(out.toString()).contains("set a b").contains("q").doesNotContain("never");
        assertThat(err.toString().trim()).isEqualTo("Invalid command \"bogus\"");
    }

    @Test
    void testSessionEndsAtEndOfInput() {
        int exitCode = run("addtab Logs\nhsplit CommitView --all");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("addtab Logs").contains("hsplit CommitView --all");
        assertThat(err.toString()).isEmpty();
    }

    /**
     * Verifies that commands after a semicolon are run, so a trailing <code>q</code> ends the session.
     */
    @Test
    void testSeveralCommandsOnOneLine() {
        int exitCode = run("set a b; q\nset never reached\n");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("set a b" + System.lineSeparator() + "q").doesNotContain("never");
        assertThat(err.toString()).isEmpty();
    }
}
