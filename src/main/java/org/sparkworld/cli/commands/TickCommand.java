package org.sparkworld.cli.commands;

import java.util.concurrent.Callable;

import org.sparkworld.cli.CommandLineInterface;
import org.sparkworld.runtime.report.TickReport;
import org.sparkworld.service.SparkWorldService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "tick",
    description = "Advance a simulation by one or more ticks"
)
public class TickCommand implements Callable<Integer> {

    @Option(names = {"-s", "--simulation"}, required = true, description = "Simulation id")
    private String simulationId;

    @Option(names = {"--count"}, description = "Number of ticks to run (default: ${DEFAULT-VALUE})", defaultValue = "1")
    private int count;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        if (count < 1) {
            err.println("--count must be at least 1");
            return 1;
        }
        try (SparkWorldService service = parent.createService()) {
            for (int i = 0; i < count; i++) {
                TickReport report = service.tick(simulationId);
                out.println(report.summary());
            }
            return 0;
        } catch (RuntimeException e) {
            err.println("Error running " + simulationId + ": " + e.getMessage());
            return 1;
        }
    }
}
