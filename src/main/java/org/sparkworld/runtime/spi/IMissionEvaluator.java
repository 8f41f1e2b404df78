package org.sparkworld.runtime.spi;

import java.util.List;

import org.sparkworld.runtime.action.PendingAction;
import org.sparkworld.runtime.model.Mission;

/**
 * Judges mission progress at the end of a tick.
 */
public interface IMissionEvaluator extends IWorldCollaborator {

    /**
     * @param mission The open mission.
     * @param actions This tick's actions of the bond members.
     * @return The verdict.
     */
    ProgressEvaluation evaluateProgress(Mission mission, List<PendingAction> actions);
}
