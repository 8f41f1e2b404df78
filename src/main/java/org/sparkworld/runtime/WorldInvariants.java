package org.sparkworld.runtime;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.sparkworld.runtime.model.Agent;
import org.sparkworld.runtime.model.Bond;
import org.sparkworld.runtime.model.BondStatus;
import org.sparkworld.runtime.model.Mission;
import org.sparkworld.runtime.model.WorldState;

/**
 * Structural checks run at the end of every tick.
 */
public final class WorldInvariants {

    private WorldInvariants() {}

    /**
     * Lists every violated invariant.
     *
     * @param world The world.
     * @return Human-readable violations, empty when the world is consistent.
     */
    public static List<String> check(WorldState world) {
        List<String> violations = new ArrayList<>();
        if (world.getBenefactor().getBalance() < 0) {
            violations.add("benefactor balance is negative");
        }

        Set<String> bondedAgents = new HashSet<>();
        for (Bond bond : world.getBonds()) {
            if (bond.size() < 2) {
                violations.add(bond.getId() + " has fewer than two members");
            }
            for (String memberId : bond.getMembers()) {
                Agent member = world.getAgent(memberId);
                if (member == null) {
                    violations.add(bond.getId() + " contains unknown agent " + memberId);
                    continue;
                }
                if (!bondedAgents.add(memberId)) {
                    violations.add(memberId + " is a member of more than one bond");
                }
                if (!member.isAlive()) {
                    violations.add(bond.getId() + " contains vanished agent " + memberId);
                }
                BondStatus expected = memberId.equals(bond.getLeaderId()) ? BondStatus.LEADER : BondStatus.BONDED;
                if (member.getBondStatus() != expected) {
                    violations.add(memberId + " has bond status " + member.getBondStatus() + ", expected " + expected);
                }
                Set<String> expectedMates = new HashSet<>(bond.getMembers());
                expectedMates.remove(memberId);
                if (!member.getBondMates().equals(expectedMates)) {
                    violations.add(memberId + " bond-mates " + member.getBondMates() + " do not match " + bond.getId());
                }
            }
            Mission mission = world.getMission(bond.getMissionId());
            if (mission == null) {
                violations.add(bond.getId() + " has no mission");
            } else if (mission.isComplete() || !mission.getBondId().equals(bond.getId())) {
                violations.add(bond.getId() + " points at " + mission.getId() + " which is not its open mission");
            }
        }

        for (Agent agent : world.getAgents()) {
            if (agent.isAlive() && agent.getSparks() < 0) {
                violations.add(agent.getId() + " is alive with " + agent.getSparks() + " sparks");
            }
            if (agent.isBonded() && !bondedAgents.contains(agent.getId())) {
                violations.add(agent.getId() + " is " + agent.getBondStatus() + " but in no bond");
            }
            if (!agent.isBonded() && !agent.getBondMates().isEmpty()) {
                violations.add(agent.getId() + " is unbonded but has bond-mates");
            }
        }

        for (Mission mission : world.getMissions()) {
            if (!mission.isComplete() && world.getBond(mission.getBondId()) == null) {
                violations.add("open " + mission.getId() + " references deleted " + mission.getBondId());
            }
        }
        return violations;
    }

    /**
     * @param world The world.
     * @throws WorldCorruptionException if any invariant is violated.
     */
    public static void verify(WorldState world) {
        List<String> violations = check(world);
        if (!violations.isEmpty()) {
            throw new WorldCorruptionException(world.getTick(), violations);
        }
    }
}
