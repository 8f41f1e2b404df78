package org.sparkworld.runtime.report;

/**
 * Kinds of notable things that happen during a tick.
 */
public enum WorldEventType {
    AGENT_VANISHED,
    AGENT_SPAWNED,
    SPAWN_REFUSED,
    BOND_REQUESTED,
    BOND_FORMED,
    BOND_DISSOLVED,
    RAID,
    GRANT,
    MESSAGE_SENT,
    MISSION_CREATED,
    MISSION_PROGRESS,
    MISSION_COMPLETED,
    ORACLE_FAILURE,
    DROPPED_ACTION
}
