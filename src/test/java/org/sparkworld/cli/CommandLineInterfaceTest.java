package org.sparkworld.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.PrintWriter;
import java.io.StringWriter;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import picocli.CommandLine;

@Tag("unit")
class CommandLineInterfaceTest {

    @Test
    void registersAllSubcommands() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        assertThat(cmdLine.getSubcommands()).containsKeys("init", "tick", "inspect", "list", "help");
    }

    @Test
    void helpListsSubcommandsAndConfigOption() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));

        int exitCode = cmdLine.execute("--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("sparkworld", "--config", "init", "tick", "inspect", "list");
    }

    @Test
    void unknownOptionFails() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter err = new StringWriter();
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("tick", "--simulation", "sim-a", "--bogus");

        assertThat(exitCode).isNotZero();
        assertThat(err.toString()).contains("--bogus");
    }
}
