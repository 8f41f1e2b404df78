package org.sparkworld.cli.commands;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.sparkworld.cli.CommandLineInterface;
import org.sparkworld.persistence.WorldSnapshot;
import org.sparkworld.persistence.WorldSnapshotCodec;
import org.sparkworld.service.SparkWorldService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "inspect",
    description = "Print a stored world state"
)
public class InspectCommand implements Callable<Integer> {

    @Option(names = {"-s", "--simulation"}, required = true, description = "Simulation id")
    private String simulationId;

    @Option(names = {"-t", "--tick"}, description = "Tick to show (default: latest)")
    private Long tick;

    @Option(names = {"-f", "--format"}, description = "Output format: json, summary (default: ${DEFAULT-VALUE})", defaultValue = "json")
    private String format;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        try (SparkWorldService service = parent.createService()) {
            WorldSnapshot snapshot = service.inspect(simulationId, tick);
            switch (format.toLowerCase()) {
                case "json" -> out.println(new WorldSnapshotCodec().encode(snapshot));
                case "summary" -> printSummary(out, snapshot);
                default -> {
                    err.println("Unknown format: " + format);
                    return 1;
                }
            }
            return 0;
        } catch (RuntimeException e) {
            err.println("Error inspecting " + simulationId + ": " + e.getMessage());
            return 1;
        }
    }

    private void printSummary(PrintWriter out, WorldSnapshot snapshot) {
        out.printf("%s '%s' at tick %d (seed %d)%n", snapshot.simulationId(), snapshot.name(), snapshot.tick(),
            snapshot.seed());
        out.printf("Benefactor %s: %d sparks%n", snapshot.benefactor().name(), snapshot.benefactor().balance());
        for (WorldSnapshot.AgentData agent : snapshot.agents()) {
            out.printf("  %-10s %-20s %-8s %3d sparks  %s%n", agent.id(), agent.persona().name(), agent.status(),
                agent.sparks(), agent.bondMates().isEmpty() ? "" : "bonded with " + String.join(", ", agent.bondMates()));
        }
        for (WorldSnapshot.BondData bond : snapshot.bonds()) {
            out.printf("  %s: %s (leader %s, mission %s)%n", bond.id(), String.join(", ", bond.members()),
                bond.leaderId(), bond.missionId());
        }
    }
}
