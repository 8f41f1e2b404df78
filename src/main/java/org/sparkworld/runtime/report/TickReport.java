package org.sparkworld.runtime.report;

import java.util.List;
import java.util.Map;

import org.sparkworld.runtime.action.PendingAction;
import org.sparkworld.runtime.ledger.LedgerEntry;
import org.sparkworld.runtime.raid.RaidResult;
import org.sparkworld.runtime.visibility.GrantOutcome;

/**
 * Immutable account of one completed tick, handed to the report listeners and returned
 * to the driver.
 *
 * @param simulationId The simulation.
 * @param tick The tick.
 * @param actions One action per agent that was alive when decisions were collected.
 * @param ledger Every spark movement, in order.
 * @param mintReceipts Minted units per receiving agent.
 * @param grants Benefactor answers applied this tick.
 * @param raids Raid results, in resolution order.
 * @param events Notable events, in order.
 * @param agentsVanished Agents that vanished.
 * @param agentsSpawned Agents that were spawned.
 * @param bondsFormed Bonds that were formed.
 * @param bondsDissolved Bonds that were dissolved.
 * @param missionsCompleted Missions that were completed.
 * @param meetingTranscripts Meeting transcript per mission.
 * @param aliveAgents Living agents after the tick.
 * @param activeBonds Live bonds after the tick.
 * @param benefactorBalance Benefactor balance after the tick.
 */
public record TickReport(
    String simulationId,
    long tick,
    List<PendingAction> actions,
    List<LedgerEntry> ledger,
    Map<String, Integer> mintReceipts,
    List<GrantOutcome> grants,
    List<RaidResult> raids,
    List<WorldEvent> events,
    List<String> agentsVanished,
    List<String> agentsSpawned,
    List<String> bondsFormed,
    List<String> bondsDissolved,
    List<String> missionsCompleted,
    Map<String, List<String>> meetingTranscripts,
    int aliveAgents,
    int activeBonds,
    int benefactorBalance
) {

    public TickReport {
        actions = List.copyOf(actions);
        ledger = List.copyOf(ledger);
        mintReceipts = Map.copyOf(mintReceipts);
        grants = List.copyOf(grants);
        raids = List.copyOf(raids);
        events = List.copyOf(events);
        agentsVanished = List.copyOf(agentsVanished);
        agentsSpawned = List.copyOf(agentsSpawned);
        bondsFormed = List.copyOf(bondsFormed);
        bondsDissolved = List.copyOf(bondsDissolved);
        missionsCompleted = List.copyOf(missionsCompleted);
        meetingTranscripts = Map.copyOf(meetingTranscripts);
    }

    /**
     * @param type The event type.
     * @return Events of that type, in order.
     */
    public List<WorldEvent> eventsOf(WorldEventType type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }

    /**
     * @return A one-line summary for logs and the CLI.
     */
    public String summary() {
        return String.format("tick=%d alive=%d bonds=%d benefactor=%d formed=%d dissolved=%d raids=%d spawned=%d vanished=%d",
            tick, aliveAgents, activeBonds, benefactorBalance, bondsFormed.size(), bondsDissolved.size(),
            raids.size(), agentsSpawned.size(), agentsVanished.size());
    }
}
