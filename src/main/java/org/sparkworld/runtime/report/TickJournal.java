package org.sparkworld.runtime.report;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sparkworld.runtime.action.PendingAction;
import org.sparkworld.runtime.ledger.LedgerEntry;
import org.sparkworld.runtime.raid.RaidResult;
import org.sparkworld.runtime.visibility.GrantOutcome;

import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;

/**
 * Collects everything that happens during one tick.
 * <p>
 * Created by the engine at the start of a tick, handed to every component and turned into
 * an immutable {@link TickReport} in the report stage. Main thread only.
 */
public class TickJournal {

    private static final Logger LOG = LoggerFactory.getLogger(TickJournal.class);

    private final long tick;
    private final List<PendingAction> actions = new ArrayList<>();
    private final List<LedgerEntry> ledger = new ArrayList<>();
    private final Object2IntLinkedOpenHashMap<String> mintReceipts = new Object2IntLinkedOpenHashMap<>();
    private final List<GrantOutcome> grants = new ArrayList<>();
    private final List<RaidResult> raids = new ArrayList<>();
    private final List<WorldEvent> events = new ArrayList<>();
    private final List<String> agentsVanished = new ArrayList<>();
    private final List<String> agentsSpawned = new ArrayList<>();
    private final List<String> bondsFormed = new ArrayList<>();
    private final List<String> bondsDissolved = new ArrayList<>();
    private final List<String> missionsCompleted = new ArrayList<>();
    private final Map<String, List<String>> meetingTranscripts = new LinkedHashMap<>();

    public TickJournal(long tick) {
        this.tick = tick;
    }

    public long getTick() {
        return tick;
    }

    public void recordAction(PendingAction action) {
        actions.add(action);
    }

    public void recordLedger(LedgerEntry entry) {
        ledger.add(entry);
    }

    /**
     * Counts minted units received by an agent.
     */
    public void recordMintReceipt(String agentId, int units) {
        mintReceipts.addTo(agentId, units);
    }

    public void recordGrant(GrantOutcome outcome) {
        grants.add(outcome);
    }

    public void recordRaid(RaidResult result) {
        raids.add(result);
    }

    public void recordMeeting(String missionId, List<String> transcript) {
        meetingTranscripts.put(missionId, List.copyOf(transcript));
    }

    public void event(WorldEventType type, String agentId, String targetId, String description) {
        events.add(new WorldEvent(tick, type, agentId, targetId, description));
    }

    /**
     * Records an action that was dropped as invalid.
     *
     * @param action The action.
     * @param reason Why it was dropped.
     */
    public void dropped(PendingAction action, String reason) {
        LOG.debug("Tick {}: dropped {} by {} (target {}): {}",
            tick, action.intent().wireName(), action.agentId(), action.targetId(), reason);
        event(WorldEventType.DROPPED_ACTION, action.agentId(), action.targetId(),
            action.intent().wireName() + " dropped: " + reason);
    }

    public void agentVanished(String agentId) {
        agentsVanished.add(agentId);
        event(WorldEventType.AGENT_VANISHED, agentId, null, agentId + " ran out of sparks and vanished");
    }

    public void agentSpawned(String agentId, String parentId) {
        agentsSpawned.add(agentId);
        event(WorldEventType.AGENT_SPAWNED, parentId, agentId, parentId + " spawned " + agentId);
    }

    public void bondFormed(String bondId, List<String> members) {
        bondsFormed.add(bondId);
        event(WorldEventType.BOND_FORMED, members.get(0), bondId, "Bond " + bondId + " formed by " + members);
    }

    public void bondDissolved(String bondId, String reason) {
        bondsDissolved.add(bondId);
        event(WorldEventType.BOND_DISSOLVED, null, bondId, "Bond " + bondId + " dissolved: " + reason);
    }

    public void missionCompleted(String missionId, String reason) {
        missionsCompleted.add(missionId);
        event(WorldEventType.MISSION_COMPLETED, null, missionId, "Mission " + missionId + " complete: " + reason);
    }

    public List<PendingAction> getActions() {
        return List.copyOf(actions);
    }

    public List<LedgerEntry> getLedger() {
        return List.copyOf(ledger);
    }

    public int getMintReceipt(String agentId) {
        return mintReceipts.getInt(agentId);
    }

    public List<GrantOutcome> getGrants() {
        return List.copyOf(grants);
    }

    public List<RaidResult> getRaids() {
        return List.copyOf(raids);
    }

    public List<WorldEvent> getEvents() {
        return List.copyOf(events);
    }

    public List<String> getAgentsVanished() {
        return List.copyOf(agentsVanished);
    }

    public List<String> getAgentsSpawned() {
        return List.copyOf(agentsSpawned);
    }

    public List<String> getBondsFormed() {
        return List.copyOf(bondsFormed);
    }

    public List<String> getBondsDissolved() {
        return List.copyOf(bondsDissolved);
    }

    /**
     * Builds the immutable report.
     *
     * @param simulationId The simulation.
     * @param aliveAgents Living agents at the end of the tick.
     * @param activeBonds Live bonds at the end of the tick.
     * @param benefactorBalance Benefactor balance at the end of the tick.
     * @return The report.
     */
    public TickReport toReport(String simulationId, int aliveAgents, int activeBonds, int benefactorBalance) {
        Map<String, Integer> receipts = new LinkedHashMap<>();
        mintReceipts.object2IntEntrySet().forEach(e -> receipts.put(e.getKey(), e.getIntValue()));
        return new TickReport(simulationId, tick, actions, ledger, receipts, grants, raids, events,
            agentsVanished, agentsSpawned, bondsFormed, bondsDissolved, missionsCompleted,
            meetingTranscripts, aliveAgents, activeBonds, benefactorBalance);
    }
}
