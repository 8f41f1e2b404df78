package org.sparkworld.runtime.oracle.impl;

import java.util.List;

import org.sparkworld.runtime.action.ActionIntent;
import org.sparkworld.runtime.action.PendingAction;
import org.sparkworld.runtime.model.Mission;
import org.sparkworld.runtime.spi.IMissionEvaluator;
import org.sparkworld.runtime.spi.IRandomProvider;
import org.sparkworld.runtime.spi.ProgressEvaluation;

import com.typesafe.config.Config;

/**
 * Offline evaluator that declares a mission complete once its bond has worked on it for
 * {@code duration} ticks (option, default 8).
 */
public class DurationMissionEvaluator implements IMissionEvaluator {

    private final int duration;

    public DurationMissionEvaluator(IRandomProvider random, Config options) {
        this.duration = options.hasPath("duration") ? options.getInt("duration") : 8;
    }

    @Override
    public ProgressEvaluation evaluateProgress(Mission mission, List<PendingAction> actions) {
        long tick = actions.isEmpty() ? mission.getCreatedTick() : actions.get(0).tick();
        long elapsed = tick - mission.getCreatedTick();
        long busy = actions.stream().filter(a -> a.intent() != ActionIntent.IDLE).count();
        if (elapsed >= duration) {
            return new ProgressEvaluation(true, "After " + elapsed + " ticks the goal '" + mission.getGoal() + "' is met");
        }
        return new ProgressEvaluation(false, "Tick " + elapsed + " of " + duration + ": "
            + busy + " of " + actions.size() + " members were busy");
    }
}
