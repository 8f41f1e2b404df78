package org.sparkworld.runtime.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A single mind living in the world.
 * <p>
 * Agents are created by the character generator at genesis or by a spawn action and are
 * mutated every tick by the spark ledger, the bonding protocol and the raid resolver.
 * A vanished agent is never removed from the world; it stays for history with
 * {@link AgentStatus#VANISHED}.
 * <p>
 * <b>Thread safety:</b> Not thread-safe. Owned by the world engine during a tick.
 */
public class Agent {

    private final String id;
    private final CharacterBlueprint persona;
    private final String parentId;
    private final long bornTick;
    private int sparks;
    private int age;
    private AgentStatus status = AgentStatus.ALIVE;
    private BondStatus bondStatus = BondStatus.UNBONDED;
    private final Set<String> bondMates = new LinkedHashSet<>();
    private long vanishedTick = -1L;

    /**
     * Creates a new, alive and unbonded agent.
     *
     * @param id The unique agent id (e.g. {@code agent_001}).
     * @param persona The persona from the character generator.
     * @param sparks The starting spark balance.
     * @param bornTick The tick the agent entered the world.
     * @param parentId The spawning agent, or {@code null} for genesis agents.
     */
    public Agent(String id, CharacterBlueprint persona, int sparks, long bornTick, String parentId) {
        this.id = id;
        this.persona = persona;
        this.sparks = sparks;
        this.bornTick = bornTick;
        this.parentId = parentId;
    }

    public String getId() {
        return id;
    }

    public CharacterBlueprint getPersona() {
        return persona;
    }

    /**
     * @return The persona name, or the id if no persona is attached.
     */
    public String getName() {
        return persona != null && persona.name() != null ? persona.name() : id;
    }

    public String getParentId() {
        return parentId;
    }

    public long getBornTick() {
        return bornTick;
    }

    public int getSparks() {
        return sparks;
    }

    /**
     * Adds sparks to the balance.
     *
     * @param amount The amount to add, must not be negative.
     */
    public void addSparks(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0, got " + amount);
        }
        this.sparks += amount;
    }

    /**
     * Removes sparks from the balance. Upkeep may drive the balance to zero or below,
     * which hands the agent to the vanish procedure.
     *
     * @param amount The amount to remove, must not be negative.
     */
    public void takeSparks(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0, got " + amount);
        }
        this.sparks -= amount;
    }

    public int getAge() {
        return age;
    }

    /**
     * Increments the age by one tick.
     */
    public void growOlder() {
        this.age++;
    }

    /**
     * Raid strength: age plus current sparks.
     *
     * @return The strength at the moment of the call.
     */
    public int getStrength() {
        return age + sparks;
    }

    public AgentStatus getStatus() {
        return status;
    }

    public boolean isAlive() {
        return status == AgentStatus.ALIVE;
    }

    public long getVanishedTick() {
        return vanishedTick;
    }

    /**
     * Marks the agent as vanished. Bond cleanup is the caller's responsibility.
     *
     * @param tick The tick of vanishing.
     * @throws IllegalStateException if the agent already vanished.
     */
    public void vanish(long tick) {
        if (status == AgentStatus.VANISHED) {
            throw new IllegalStateException("Agent " + id + " already vanished at tick " + vanishedTick);
        }
        this.status = AgentStatus.VANISHED;
        this.vanishedTick = tick;
    }

    public BondStatus getBondStatus() {
        return bondStatus;
    }

    public boolean isBonded() {
        return bondStatus.isBonded();
    }

    /**
     * @return An unmodifiable view of the ids of this agent's bond-mates.
     */
    public Set<String> getBondMates() {
        return Collections.unmodifiableSet(bondMates);
    }

    /**
     * Joins a bond: sets the status and replaces the bond-mate set.
     *
     * @param status {@link BondStatus#BONDED} or {@link BondStatus#LEADER}.
     * @param mates The other members of the bond.
     */
    public void joinBond(BondStatus status, Set<String> mates) {
        if (!status.isBonded()) {
            throw new IllegalArgumentException("joinBond requires a bonded status, got " + status);
        }
        this.bondStatus = status;
        this.bondMates.clear();
        this.bondMates.addAll(mates);
        this.bondMates.remove(id);
    }

    /**
     * Leaves the current bond: clears all bond-mate references.
     */
    public void leaveBond() {
        this.bondStatus = BondStatus.UNBONDED;
        this.bondMates.clear();
    }

    /**
     * Restores mutable state from a snapshot.
     */
    void restore(int age, AgentStatus status, BondStatus bondStatus, Set<String> mates, long vanishedTick) {
        this.age = age;
        this.status = status;
        this.bondStatus = bondStatus;
        this.bondMates.clear();
        this.bondMates.addAll(mates);
        this.vanishedTick = vanishedTick;
    }

    /**
     * Rebuilds an agent from persisted fields.
     *
     * @return The restored agent.
     */
    public static Agent restore(String id, CharacterBlueprint persona, int sparks, int age, long bornTick,
                                String parentId, AgentStatus status, BondStatus bondStatus,
                                Set<String> bondMates, long vanishedTick) {
        Agent agent = new Agent(id, persona, sparks, bornTick, parentId);
        agent.restore(age, status, bondStatus, bondMates, vanishedTick);
        return agent;
    }

    @Override
    public String toString() {
        return id + "[" + getName() + ", sparks=" + sparks + ", age=" + age + ", " + status + ", " + bondStatus + "]";
    }
}
