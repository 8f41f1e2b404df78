package org.sparkworld.runtime.spi;

import java.util.List;
import java.util.Map;

import org.sparkworld.runtime.action.PendingAction;
import org.sparkworld.runtime.model.CharacterBlueprint;
import org.sparkworld.runtime.model.Mission;

/**
 * Runs the per-tick meeting of a bond before its members decide.
 */
public interface IMissionMeetingCoordinator extends IWorldCollaborator {

    /**
     * @param mission The open mission.
     * @param members Member id to persona, leader first.
     * @param tick The current tick.
     * @param previousActions The members' actions of the previous tick.
     * @return Transcript and task assignments.
     */
    MeetingOutcome conductMeeting(Mission mission, Map<String, CharacterBlueprint> members,
                                  long tick, List<PendingAction> previousActions);
}
