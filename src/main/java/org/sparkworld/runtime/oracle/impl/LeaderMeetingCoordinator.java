package org.sparkworld.runtime.oracle.impl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.sparkworld.runtime.action.PendingAction;
import org.sparkworld.runtime.model.CharacterBlueprint;
import org.sparkworld.runtime.model.Mission;
import org.sparkworld.runtime.spi.IMissionMeetingCoordinator;
import org.sparkworld.runtime.spi.IRandomProvider;
import org.sparkworld.runtime.spi.MeetingOutcome;

import com.typesafe.config.Config;

/**
 * Offline meeting: the leader opens, every member reports what it did last tick, and the
 * leader hands out tasks from a rotating list.
 */
public class LeaderMeetingCoordinator implements IMissionMeetingCoordinator {

    private static final List<String> TASKS = List.of("gather sparks", "scout for allies", "guard the bond",
        "petition the benefactor");

    public LeaderMeetingCoordinator(IRandomProvider random, Config options) {
        // stateless
    }

    @Override
    public MeetingOutcome conductMeeting(Mission mission, Map<String, CharacterBlueprint> members, long tick,
                                         List<PendingAction> previousActions) {
        List<String> transcript = new ArrayList<>();
        CharacterBlueprint leader = members.get(mission.getLeaderId());
        String leaderName = leader == null ? mission.getLeaderId() : leader.name();
        transcript.add(leaderName + ": Tick " + tick + ", we continue '" + mission.getTitle() + "'.");
        for (PendingAction action : previousActions) {
            CharacterBlueprint member = members.get(action.agentId());
            if (member != null) {
                transcript.add(member.name() + ": Last tick I chose " + action.intent().wireName() + ".");
            }
        }
        Map<String, String> assignments = new LinkedHashMap<>();
        int offset = (int) (tick % TASKS.size());
        int index = 0;
        for (String memberId : members.keySet()) {
            assignments.put(memberId, TASKS.get((offset + index++) % TASKS.size()));
        }
        transcript.add(leaderName + ": Tasks are set: " + assignments + ".");
        return new MeetingOutcome(transcript, assignments);
    }
}
