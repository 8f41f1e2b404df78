package org.sparkworld.runtime.spi;

import org.sparkworld.runtime.visibility.Observation;

/**
 * Chooses one action for one agent per tick.
 * <p>
 * The oracle only ever sees the {@link Observation} built by the visibility gateway.
 * A blank or unknown target in the returned decision is treated as no target.
 * </p>
 */
public interface IDecisionOracle extends IWorldCollaborator {

    /**
     * Decides what the agent does this tick.
     *
     * @param agentId The deciding agent.
     * @param observation Everything the agent is allowed to know.
     * @return The decision, never {@code null}.
     */
    Decision decide(String agentId, Observation observation);
}
