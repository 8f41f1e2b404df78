package org.sparkworld.runtime.visibility;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.sparkworld.runtime.WorldRules;
import org.sparkworld.runtime.action.ActionIntent;
import org.sparkworld.runtime.action.PendingAction;
import org.sparkworld.runtime.model.Agent;
import org.sparkworld.runtime.model.Bond;
import org.sparkworld.runtime.model.Mission;
import org.sparkworld.runtime.model.WorldState;
import org.sparkworld.runtime.report.TickJournal;

/**
 * Builds what an agent is allowed to know.
 * <p>
 * Observations read inter-agent traffic exclusively from the frozen generation of the
 * {@link RequestTables}; nothing written during the running tick can leak into them.
 */
public class VisibilityGateway {

    private final WorldRules rules;

    public VisibilityGateway(WorldRules rules) {
        this.rules = rules;
    }

    /**
     * Builds the observation of one agent for the running tick.
     *
     * @param world The world.
     * @param agent A living agent.
     * @param grantOutcome The answer to the agent's last grant request, or {@code null}.
     * @param meetingNotes Transcript per mission id from this tick's meetings.
     * @return The immutable observation.
     */
    public Observation observe(WorldState world, Agent agent, GrantOutcome grantOutcome,
                               Map<String, List<String>> meetingNotes) {
        TickGeneration frozen = world.getRequestTables().frozen();
        String id = agent.getId();

        Observation.SelfView self = new Observation.SelfView(id, agent.getPersona(), agent.getSparks(),
            agent.getAge(), agent.getStatus(), agent.getBondStatus(), agent.getBondMates());
        List<PendingAction> bondOffers = frozen.bondRequestsFor(id);

        return new Observation(world.getTick(), self, frozen.messagesFor(id), bondOffers, grantOutcome,
            frozen.eventsFor(id), world.getLatestNews(), missionStatus(world, agent, meetingNotes),
            availableIntents(agent, bondOffers));
    }

    private static Observation.MissionStatus missionStatus(WorldState world, Agent agent,
                                                           Map<String, List<String>> meetingNotes) {
        if (!agent.isBonded()) {
            return null;
        }
        Bond bond = world.findBondOf(agent.getId());
        Mission mission = bond == null ? null : world.getMission(bond.getMissionId());
        if (mission == null) {
            return null;
        }
        return new Observation.MissionStatus(mission.getId(), mission.getTitle(), mission.getDescription(),
            mission.getGoal(), mission.getProgress(), mission.getLeaderId(), mission.getAssignedTasks(),
            mission.isComplete(), new ArrayList<>(bond.getMembers()),
            meetingNotes.getOrDefault(mission.getId(), List.of()));
    }

    private List<ActionIntent> availableIntents(Agent agent, List<PendingAction> bondOffers) {
        List<ActionIntent> intents = new ArrayList<>();
        if (!agent.isBonded()) {
            intents.add(ActionIntent.BOND_REQUEST);
            if (!bondOffers.isEmpty()) {
                intents.add(ActionIntent.BOND_ACCEPT);
            }
        }
        intents.add(ActionIntent.RAID);
        if (agent.isBonded() && agent.getSparks() >= rules.spawnCost()) {
            intents.add(ActionIntent.SPAWN);
        }
        intents.add(ActionIntent.REQUEST_GRANT);
        intents.add(ActionIntent.MESSAGE);
        intents.add(ActionIntent.IDLE);
        return intents;
    }

    /**
     * Compiles the public news of a finished tick, shown to everyone in the next tick.
     *
     * @param world The world at the end of the tick.
     * @param journal The journal of the tick.
     * @return The news.
     */
    public static WorldNews compileNews(WorldState world, TickJournal journal) {
        Map<String, WorldNews.PublicProfile> directory = new LinkedHashMap<>();
        for (Agent agent : world.getAliveAgents()) {
            directory.put(agent.getId(), new WorldNews.PublicProfile(agent.getName(),
                agent.getPersona().species(), agent.getPersona().homeRealm()));
        }
        return new WorldNews(journal.getTick(), directory.size(), world.getBonds().size(),
            journal.getAgentsVanished(), journal.getAgentsSpawned(), journal.getBondsFormed(),
            journal.getBondsDissolved(), directory);
    }
}
