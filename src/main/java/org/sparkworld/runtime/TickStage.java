package org.sparkworld.runtime;

/**
 * The stages of a tick, in execution order.
 */
public enum TickStage {
    UPKEEP_AND_MINT,
    BENEFACTOR,
    AGENT_DECISIONS,
    SPARK_DISTRIBUTION,
    ACTION_RESOLUTION,
    REPORT
}
