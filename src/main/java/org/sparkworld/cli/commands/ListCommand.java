package org.sparkworld.cli.commands;

import java.util.concurrent.Callable;

import org.sparkworld.cli.CommandLineInterface;
import org.sparkworld.service.SparkWorldService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "list",
    description = "List stored simulations with their latest tick"
)
public class ListCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        try (SparkWorldService service = parent.createService()) {
            for (String simulationId : service.listSimulations()) {
                var latest = service.getStore().latestTick(simulationId);
                out.println(simulationId + "\t" + (latest.isPresent() ? "tick " + latest.getAsLong() : "empty"));
            }
            return 0;
        } catch (RuntimeException e) {
            spec.commandLine().getErr().println("Error listing simulations: " + e.getMessage());
            return 1;
        }
    }
}
