package org.sparkworld.runtime.visibility;

/**
 * Something that happened to one agent, delivered with the next tick's observation.
 *
 * @param type What happened.
 * @param description Short human-readable description.
 * @param sparkChange Signed spark delta for the receiving agent.
 * @param sourceAgentId Who caused it, or {@code null}.
 * @param tick The tick in which it happened.
 */
public record PersonalEvent(Type type, String description, int sparkChange, String sourceAgentId, long tick) {

    /**
     * Event categories.
     */
    public enum Type {
        RAID_ATTACK,
        RAID_DEFENSE,
        BOND_FORMED,
        BOND_DISSOLVED,
        BOND_MATE_VANISHED,
        GRANT_RECEIVED,
        SPAWNED_CHILD,
        ACTION_REFUSED
    }
}
