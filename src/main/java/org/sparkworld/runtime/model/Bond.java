package org.sparkworld.runtime.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A mutually agreed group of two or more agents that mints sparks every tick.
 * <p>
 * Membership is fixed at formation. A bond is deleted, never shrunk, when a member
 * vanishes or when its mission is judged complete.
 */
public class Bond {

    private final String id;
    private final Set<String> members;
    private final String leaderId;
    private final long createdTick;
    private String missionId;
    private int sparksGeneratedThisTick;

    /**
     * Creates a bond.
     *
     * @param id The bond id (e.g. {@code bond_001}).
     * @param members The members in discovery order; at least two.
     * @param leaderId The leader, must be a member.
     * @param createdTick The tick of formation.
     */
    public Bond(String id, List<String> members, String leaderId, long createdTick) {
        if (members.size() < 2) {
            throw new IllegalArgumentException("A bond needs at least 2 members, got " + members);
        }
        if (!members.contains(leaderId)) {
            throw new IllegalArgumentException("Leader " + leaderId + " is not a member of " + members);
        }
        this.id = id;
        this.members = Collections.unmodifiableSet(new LinkedHashSet<>(members));
        this.leaderId = leaderId;
        this.createdTick = createdTick;
    }

    public String getId() {
        return id;
    }

    /**
     * @return The members in formation order (unmodifiable).
     */
    public Set<String> getMembers() {
        return members;
    }

    public boolean hasMember(String agentId) {
        return members.contains(agentId);
    }

    public int size() {
        return members.size();
    }

    public String getLeaderId() {
        return leaderId;
    }

    public long getCreatedTick() {
        return createdTick;
    }

    public String getMissionId() {
        return missionId;
    }

    public void setMissionId(String missionId) {
        this.missionId = missionId;
    }

    public int getSparksGeneratedThisTick() {
        return sparksGeneratedThisTick;
    }

    public void setSparksGeneratedThisTick(int sparksGeneratedThisTick) {
        this.sparksGeneratedThisTick = sparksGeneratedThisTick;
    }

    @Override
    public String toString() {
        return id + members + " leader=" + leaderId;
    }
}
