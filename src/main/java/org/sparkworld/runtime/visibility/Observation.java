package org.sparkworld.runtime.visibility;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.sparkworld.runtime.action.ActionIntent;
import org.sparkworld.runtime.action.PendingAction;
import org.sparkworld.runtime.model.AgentStatus;
import org.sparkworld.runtime.model.BondStatus;
import org.sparkworld.runtime.model.CharacterBlueprint;

/**
 * The read-only snapshot a decision oracle may consume for one agent in one tick.
 * <p>
 * Inter-agent content (inbox, bond offers, personal events, world news) always comes from
 * the previous tick's frozen generation. The grant outcome is the benefactor's answer
 * computed earlier in this tick to a request made in the previous tick.
 *
 * @param tick The tick being decided.
 * @param self The observing agent's own state.
 * @param inbox Direct messages sent to the agent in the previous tick.
 * @param bondOffers Bond requests addressed to the agent in the previous tick.
 * @param grantOutcome The benefactor's answer to the agent's last request, or {@code null}.
 * @param eventsSinceLast What happened to the agent in the previous tick.
 * @param news Public world news as of the end of the previous tick.
 * @param mission The agent's mission, or {@code null} if unbonded.
 * @param availableIntents Intents the agent may choose from.
 */
public record Observation(
    long tick,
    SelfView self,
    List<PendingAction> inbox,
    List<PendingAction> bondOffers,
    GrantOutcome grantOutcome,
    List<PersonalEvent> eventsSinceLast,
    WorldNews news,
    MissionStatus mission,
    List<ActionIntent> availableIntents
) {

    public Observation {
        inbox = List.copyOf(inbox);
        bondOffers = List.copyOf(bondOffers);
        eventsSinceLast = List.copyOf(eventsSinceLast);
        availableIntents = List.copyOf(availableIntents);
    }

    /**
     * The observing agent's own state.
     */
    public record SelfView(
        String agentId,
        CharacterBlueprint persona,
        int sparks,
        int age,
        AgentStatus status,
        BondStatus bondStatus,
        Set<String> bondMates
    ) {
        public SelfView {
            bondMates = Set.copyOf(bondMates);
        }
    }

    /**
     * Mission context for bonded agents.
     */
    public record MissionStatus(
        String missionId,
        String title,
        String description,
        String goal,
        String progress,
        String leaderId,
        Map<String, String> assignedTasks,
        boolean complete,
        List<String> teamMembers,
        List<String> meetingNotes
    ) {
        public MissionStatus {
            assignedTasks = Map.copyOf(assignedTasks);
            teamMembers = List.copyOf(teamMembers);
            meetingNotes = List.copyOf(meetingNotes);
        }
    }
}
