package org.sparkworld.runtime.lifecycle;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sparkworld.runtime.model.Agent;
import org.sparkworld.runtime.model.Bond;
import org.sparkworld.runtime.model.Mission;
import org.sparkworld.runtime.model.WorldState;
import org.sparkworld.runtime.report.TickJournal;
import org.sparkworld.runtime.visibility.PersonalEvent;
import org.sparkworld.runtime.visibility.TickGeneration;

/**
 * Removes agents from the world and tears down their bonds.
 * <p>
 * Both operations cascade within the same tick: once they return, no bond contains a
 * vanished agent and no open mission points at a deleted bond.
 */
public class VanishProcedure {

    private static final Logger LOG = LoggerFactory.getLogger(VanishProcedure.class);

    /**
     * Vanishes every living agent whose balance is zero or less.
     *
     * @param world The world.
     * @param journal The tick journal.
     * @return The agents that vanished, in creation order.
     */
    public List<Agent> sweep(WorldState world, TickJournal journal) {
        List<Agent> vanished = new ArrayList<>();
        for (Agent agent : world.getAliveAgents()) {
            if (agent.getSparks() <= 0) {
                vanish(world, agent, journal);
                vanished.add(agent);
            }
        }
        return vanished;
    }

    /**
     * Marks the agent vanished and dissolves its bond.
     *
     * @param world The world.
     * @param agent A living agent.
     * @param journal The tick journal.
     */
    public void vanish(WorldState world, Agent agent, TickJournal journal) {
        agent.vanish(journal.getTick());
        world.getTotals().agentsVanished++;
        journal.agentVanished(agent.getId());
        LOG.debug("Tick {}: {} ({}) vanished", journal.getTick(), agent.getId(), agent.getName());

        Bond bond = world.findBondOf(agent.getId());
        if (bond != null) {
            TickGeneration current = world.getRequestTables().current();
            for (String mateId : bond.getMembers()) {
                if (!mateId.equals(agent.getId())) {
                    current.addEvent(mateId, new PersonalEvent(PersonalEvent.Type.BOND_MATE_VANISHED,
                        agent.getName() + " vanished", 0, agent.getId(), journal.getTick()));
                }
            }
            dissolve(world, bond, Mission.CompletionReason.BOND_DISSOLVED, journal);
        }
    }

    /**
     * Deletes a bond, releases its members and closes its mission.
     *
     * @param world The world.
     * @param bond A live bond.
     * @param reason Why the mission ends; {@link Mission.CompletionReason#GOAL_MET} when the
     *               mission was completed first and caused the dissolution.
     * @param journal The tick journal.
     */
    public void dissolve(WorldState world, Bond bond, Mission.CompletionReason reason, TickJournal journal) {
        TickGeneration current = world.getRequestTables().current();
        for (String memberId : bond.getMembers()) {
            Agent member = world.getAgent(memberId);
            member.leaveBond();
            if (member.isAlive()) {
                current.addEvent(memberId, new PersonalEvent(PersonalEvent.Type.BOND_DISSOLVED,
                    "Bond " + bond.getId() + " dissolved (" + reason + ")", 0, null, journal.getTick()));
            }
        }
        world.removeBond(bond.getId());
        journal.bondDissolved(bond.getId(), reason.name());

        Mission mission = world.getMission(bond.getMissionId());
        if (mission != null && !mission.isComplete()) {
            mission.complete(reason, journal.getTick());
            journal.missionCompleted(mission.getId(), reason.name());
        }
    }
}
