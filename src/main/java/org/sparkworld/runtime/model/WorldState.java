package org.sparkworld.runtime.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.sparkworld.runtime.action.PendingAction;
import org.sparkworld.runtime.visibility.RequestTables;
import org.sparkworld.runtime.visibility.WorldNews;

/**
 * The complete entity model of one simulation.
 * <p>
 * A single explicit struct owned by the world engine and passed by reference into every
 * component. Nothing else in the system holds world state. Agents, bonds and missions are
 * kept in insertion order so that every iteration over them is deterministic.
 */
public class WorldState {

    private final String simulationId;
    private final String name;
    private final long seed;
    private long tick;
    private final Map<String, Agent> agents = new LinkedHashMap<>();
    private final Map<String, Bond> bonds = new LinkedHashMap<>();
    private final Map<String, Mission> missions = new LinkedHashMap<>();
    private final Benefactor benefactor;
    private final RequestTables requestTables;
    private WorldNews latestNews;
    private List<PendingAction> previousActions = List.of();
    private int nextAgentNumber = 1;
    private int nextBondNumber = 1;
    private int nextMissionNumber = 1;
    private final Totals totals = new Totals();

    /**
     * Running totals across the whole simulation.
     */
    public static final class Totals {
        public long sparksMinted;
        public long sparksLost;
        public long raidsAttempted;
        public long bondsFormed;
        public long agentsSpawned;
        public long agentsVanished;
        public long sparksGranted;
    }

    /**
     * Creates an empty world at tick 0.
     *
     * @param simulationId The simulation id.
     * @param name The human-readable simulation name.
     * @param seed The root random seed.
     * @param benefactor The benefactor pool.
     */
    public WorldState(String simulationId, String name, long seed, Benefactor benefactor) {
        this(simulationId, name, seed, 0L, benefactor, new RequestTables(1L));
    }

    /**
     * Creates a world at an arbitrary tick, used when restoring a snapshot.
     */
    public WorldState(String simulationId, String name, long seed, long tick,
                      Benefactor benefactor, RequestTables requestTables) {
        this.simulationId = simulationId;
        this.name = name;
        this.seed = seed;
        this.tick = tick;
        this.benefactor = benefactor;
        this.requestTables = requestTables;
        this.latestNews = WorldNews.empty(tick);
    }

    public String getSimulationId() {
        return simulationId;
    }

    public String getName() {
        return name;
    }

    public long getSeed() {
        return seed;
    }

    /**
     * @return The current tick; the single source of truth for timestamps.
     */
    public long getTick() {
        return tick;
    }

    /**
     * Advances the tick counter. Only the world engine calls this.
     *
     * @return The new tick.
     */
    public long advanceTick() {
        return ++tick;
    }

    public Benefactor getBenefactor() {
        return benefactor;
    }

    public RequestTables getRequestTables() {
        return requestTables;
    }

    public WorldNews getLatestNews() {
        return latestNews;
    }

    public void setLatestNews(WorldNews latestNews) {
        this.latestNews = latestNews;
    }

    /**
     * @return The actions of the previous tick, used as meeting context.
     */
    public List<PendingAction> getPreviousActions() {
        return previousActions;
    }

    public void setPreviousActions(List<PendingAction> previousActions) {
        this.previousActions = List.copyOf(previousActions);
    }

    public Totals getTotals() {
        return totals;
    }

    // ---- agents ----

    public void addAgent(Agent agent) {
        if (agents.putIfAbsent(agent.getId(), agent) != null) {
            throw new IllegalArgumentException("Duplicate agent id " + agent.getId());
        }
    }

    public Agent getAgent(String id) {
        return id == null ? null : agents.get(id);
    }

    /**
     * @return All agents, alive and vanished, in creation order (unmodifiable).
     */
    public Collection<Agent> getAgents() {
        return Collections.unmodifiableCollection(agents.values());
    }

    /**
     * @return A snapshot list of the living agents in creation order.
     */
    public List<Agent> getAliveAgents() {
        List<Agent> alive = new ArrayList<>();
        for (Agent agent : agents.values()) {
            if (agent.isAlive()) {
                alive.add(agent);
            }
        }
        return alive;
    }

    /**
     * Reserves the next agent id.
     *
     * @return An id of the form {@code agent_001}.
     */
    public String nextAgentId() {
        return String.format("agent_%03d", nextAgentNumber++);
    }

    // ---- bonds ----

    public void addBond(Bond bond) {
        if (bonds.putIfAbsent(bond.getId(), bond) != null) {
            throw new IllegalArgumentException("Duplicate bond id " + bond.getId());
        }
    }

    public Bond getBond(String id) {
        return id == null ? null : bonds.get(id);
    }

    public Bond removeBond(String id) {
        return bonds.remove(id);
    }

    /**
     * @return Live bonds in formation order (unmodifiable).
     */
    public Collection<Bond> getBonds() {
        return Collections.unmodifiableCollection(bonds.values());
    }

    /**
     * Finds the live bond an agent belongs to.
     *
     * @param agentId The agent.
     * @return The bond, or {@code null}.
     */
    public Bond findBondOf(String agentId) {
        for (Bond bond : bonds.values()) {
            if (bond.hasMember(agentId)) {
                return bond;
            }
        }
        return null;
    }

    public String nextBondId() {
        return String.format("bond_%03d", nextBondNumber++);
    }

    // ---- missions ----

    public void addMission(Mission mission) {
        if (missions.putIfAbsent(mission.getId(), mission) != null) {
            throw new IllegalArgumentException("Duplicate mission id " + mission.getId());
        }
    }

    public Mission getMission(String id) {
        return id == null ? null : missions.get(id);
    }

    /**
     * @return All missions, open and complete, in creation order (unmodifiable).
     */
    public Collection<Mission> getMissions() {
        return Collections.unmodifiableCollection(missions.values());
    }

    public String nextMissionId() {
        return String.format("mission_%03d", nextMissionNumber++);
    }

    // ---- counters, for persistence ----

    public int getNextAgentNumber() {
        return nextAgentNumber;
    }

    public int getNextBondNumber() {
        return nextBondNumber;
    }

    public int getNextMissionNumber() {
        return nextMissionNumber;
    }

    /**
     * Restores the id counters from a snapshot.
     */
    public void restoreCounters(int nextAgentNumber, int nextBondNumber, int nextMissionNumber) {
        this.nextAgentNumber = nextAgentNumber;
        this.nextBondNumber = nextBondNumber;
        this.nextMissionNumber = nextMissionNumber;
    }
}
