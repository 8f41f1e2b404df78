package org.sparkworld.runtime.spi;

/**
 * Verdict on a mission after a tick's actions.
 *
 * @param isComplete Whether the goal is met.
 * @param progressSummary The new progress text.
 */
public record ProgressEvaluation(boolean isComplete, String progressSummary) {}
