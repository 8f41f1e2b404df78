package org.sparkworld.persistence;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import org.sparkworld.runtime.action.PendingAction;
import org.sparkworld.runtime.model.Agent;
import org.sparkworld.runtime.model.AgentStatus;
import org.sparkworld.runtime.model.Benefactor;
import org.sparkworld.runtime.model.Bond;
import org.sparkworld.runtime.model.BondStatus;
import org.sparkworld.runtime.model.CharacterBlueprint;
import org.sparkworld.runtime.model.Mission;
import org.sparkworld.runtime.model.WorldState;
import org.sparkworld.runtime.visibility.PersonalEvent;
import org.sparkworld.runtime.visibility.RequestTables;
import org.sparkworld.runtime.visibility.TickGeneration;
import org.sparkworld.runtime.visibility.WorldNews;

/**
 * Serializable mirror of a {@link WorldState} between two ticks.
 * <p>
 * Holds plain values only, so it can be encoded by {@link WorldSnapshotCodec} and turned
 * back into an identical world with {@link #restore()}.
 */
public record WorldSnapshot(
    int formatVersion,
    String simulationId,
    String name,
    long seed,
    long tick,
    BenefactorData benefactor,
    List<AgentData> agents,
    List<BondData> bonds,
    List<MissionData> missions,
    GenerationData frozenGeneration,
    GenerationData currentGeneration,
    WorldNews latestNews,
    List<PendingAction> previousActions,
    Counters counters,
    Totals totals
) {

    public static final int FORMAT_VERSION = 1;

    public record BenefactorData(String name, int balance, int regenerationPerTick, int maxGrantPerRequest) {}

    public record AgentData(String id, CharacterBlueprint persona, int sparks, int age, long bornTick,
                            String parentId, AgentStatus status, BondStatus bondStatus, List<String> bondMates,
                            long vanishedTick) {}

    public record BondData(String id, List<String> members, String leaderId, long createdTick, String missionId,
                           int sparksGeneratedThisTick) {}

    public record MissionData(String id, String bondId, String title, String description, String goal,
                              String leaderId, long createdTick, String progress, Map<String, String> assignedTasks,
                              Mission.State state, Mission.CompletionReason completionReason, long completedTick) {}

    public record GenerationData(long tick, boolean frozen, List<PendingAction> bondRequests,
                                 List<PendingAction> messages, List<PendingAction> grantRequests,
                                 Map<String, List<PersonalEvent>> events) {}

    public record Counters(int nextAgentNumber, int nextBondNumber, int nextMissionNumber) {}

    public record Totals(long sparksMinted, long sparksLost, long raidsAttempted, long bondsFormed,
                         long agentsSpawned, long agentsVanished, long sparksGranted) {}

    /**
     * Captures a world between two ticks.
     *
     * @param world The world.
     * @return The snapshot.
     */
    public static WorldSnapshot capture(WorldState world) {
        Benefactor b = world.getBenefactor();
        List<AgentData> agents = new ArrayList<>();
        for (Agent a : world.getAgents()) {
            agents.add(new AgentData(a.getId(), a.getPersona(), a.getSparks(), a.getAge(), a.getBornTick(),
                a.getParentId(), a.getStatus(), a.getBondStatus(), new ArrayList<>(a.getBondMates()),
                a.getVanishedTick()));
        }
        List<BondData> bonds = new ArrayList<>();
        for (Bond bond : world.getBonds()) {
            bonds.add(new BondData(bond.getId(), new ArrayList<>(bond.getMembers()), bond.getLeaderId(),
                bond.getCreatedTick(), bond.getMissionId(), bond.getSparksGeneratedThisTick()));
        }
        List<MissionData> missions = new ArrayList<>();
        for (Mission m : world.getMissions()) {
            missions.add(new MissionData(m.getId(), m.getBondId(), m.getTitle(), m.getDescription(), m.getGoal(),
                m.getLeaderId(), m.getCreatedTick(), m.getProgress(), new LinkedHashMap<>(m.getAssignedTasks()),
                m.getState(), m.getCompletionReason(), m.getCompletedTick()));
        }
        WorldState.Totals t = world.getTotals();
        return new WorldSnapshot(FORMAT_VERSION, world.getSimulationId(), world.getName(), world.getSeed(),
            world.getTick(),
            new BenefactorData(b.getName(), b.getBalance(), b.getRegenerationPerTick(), b.getMaxGrantPerRequest()),
            agents, bonds, missions,
            capture(world.getRequestTables().frozen()), capture(world.getRequestTables().current()),
            world.getLatestNews(), world.getPreviousActions(),
            new Counters(world.getNextAgentNumber(), world.getNextBondNumber(), world.getNextMissionNumber()),
            new Totals(t.sparksMinted, t.sparksLost, t.raidsAttempted, t.bondsFormed, t.agentsSpawned,
                t.agentsVanished, t.sparksGranted));
    }

    private static GenerationData capture(TickGeneration generation) {
        Map<String, List<PersonalEvent>> events = new LinkedHashMap<>();
        generation.allEvents().forEach((agentId, list) -> events.put(agentId, new ArrayList<>(list)));
        return new GenerationData(generation.getTick(), generation.isFrozen(), generation.allBondRequests(),
            generation.allMessages(), generation.grantRequests(), events);
    }

    /**
     * Rebuilds the world.
     *
     * @return A new world equal to the captured one.
     * @throws PersistenceException if the snapshot is incomplete or of an unknown format.
     */
    public WorldState restore() {
        if (formatVersion != FORMAT_VERSION) {
            throw new PersistenceException("Unsupported snapshot format " + formatVersion + " for " + simulationId);
        }
        if (benefactor == null || agents == null || bonds == null || missions == null
            || frozenGeneration == null || currentGeneration == null || counters == null) {
            throw new PersistenceException("Snapshot of " + simulationId + " at tick " + tick + " is incomplete");
        }
        Benefactor restoredBenefactor = new Benefactor(benefactor.name(), benefactor.balance(),
            benefactor.regenerationPerTick(), benefactor.maxGrantPerRequest());
        RequestTables tables = new RequestTables(restore(frozenGeneration), restore(currentGeneration));
        WorldState world = new WorldState(simulationId, name, seed, tick, restoredBenefactor, tables);

        for (AgentData a : agents) {
            world.addAgent(Agent.restore(a.id(), a.persona(), a.sparks(), a.age(), a.bornTick(), a.parentId(),
                a.status(), a.bondStatus(), new LinkedHashSet<>(a.bondMates()), a.vanishedTick()));
        }
        for (BondData b : bonds) {
            Bond bond = new Bond(b.id(), b.members(), b.leaderId(), b.createdTick());
            bond.setMissionId(b.missionId());
            bond.setSparksGeneratedThisTick(b.sparksGeneratedThisTick());
            world.addBond(bond);
        }
        for (MissionData m : missions) {
            world.addMission(Mission.restore(m.id(), m.bondId(), m.title(), m.description(), m.goal(), m.leaderId(),
                m.createdTick(), m.progress(), m.assignedTasks() == null ? Map.of() : m.assignedTasks(), m.state(),
                m.completionReason(), m.completedTick()));
        }
        if (latestNews != null) {
            world.setLatestNews(latestNews);
        }
        world.setPreviousActions(previousActions == null ? List.of() : previousActions);
        world.restoreCounters(counters.nextAgentNumber(), counters.nextBondNumber(), counters.nextMissionNumber());
        if (totals != null) {
            WorldState.Totals t = world.getTotals();
            t.sparksMinted = totals.sparksMinted();
            t.sparksLost = totals.sparksLost();
            t.raidsAttempted = totals.raidsAttempted();
            t.bondsFormed = totals.bondsFormed();
            t.agentsSpawned = totals.agentsSpawned();
            t.agentsVanished = totals.agentsVanished();
            t.sparksGranted = totals.sparksGranted();
        }
        return world;
    }

    private static TickGeneration restore(GenerationData data) {
        TickGeneration generation = new TickGeneration(data.tick());
        nullToEmpty(data.bondRequests()).forEach(generation::addBondRequest);
        nullToEmpty(data.messages()).forEach(generation::addMessage);
        nullToEmpty(data.grantRequests()).forEach(generation::addGrantRequest);
        if (data.events() != null) {
            data.events().forEach((agentId, list) -> list.forEach(event -> generation.addEvent(agentId, event)));
        }
        if (data.frozen()) {
            generation.freeze();
        }
        return generation;
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
