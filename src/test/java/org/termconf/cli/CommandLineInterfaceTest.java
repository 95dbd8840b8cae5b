package org.termconf.cli;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class CommandLineInterfaceTest {

    @Test
    public void testCliInitialization() {
        CommandLine cmd = new CommandLine(new CommandLineInterface());

        assertThat(cmd.getCommandName()).isEqualTo("termconf");
        assertThat(cmd.getSubcommands()).containsKeys("parse", "prompt", "help");
    }

    @Test
    public void testNoSubcommandPrintsUsage() {
        CommandLine cmd = new CommandLine(new CommandLineInterface());
        StringWriter out = new StringWriter();
        cmd.setOut(new PrintWriter(out));

        int exitCode = cmd.execute();

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Usage: termconf").contains("parse").contains("prompt");
    }
}
