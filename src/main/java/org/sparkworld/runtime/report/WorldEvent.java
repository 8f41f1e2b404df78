package org.sparkworld.runtime.report;

/**
 * A notable thing that happened during a tick.
 *
 * @param tick The tick.
 * @param type What kind of thing.
 * @param agentId The agent it is mainly about, or {@code null}.
 * @param targetId A second party, or {@code null}.
 * @param description Human-readable details.
 */
public record WorldEvent(long tick, WorldEventType type, String agentId, String targetId, String description) {}
