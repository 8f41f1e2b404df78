package org.sparkworld.cli.commands;

import java.util.concurrent.Callable;

import org.sparkworld.cli.CommandLineInterface;
import org.sparkworld.service.SparkWorldService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "init",
    description = "Create a new simulation and print its id"
)
public class InitCommand implements Callable<Integer> {

    @Option(names = {"-n", "--agents"}, description = "Number of genesis agents (default: ${DEFAULT-VALUE})", defaultValue = "3")
    private int agents;

    @Option(names = {"--name"}, description = "Name of the world (default: ${DEFAULT-VALUE})", defaultValue = "Spark-World")
    private String name;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        if (agents < 1) {
            err.println("--agents must be at least 1");
            return 1;
        }
        try (SparkWorldService service = parent.createService()) {
            out.println(service.initialize(agents, name));
            return 0;
        } catch (RuntimeException e) {
            err.println("Error creating simulation: " + e.getMessage());
            return 1;
        }
    }
}
