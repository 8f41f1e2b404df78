package org.sparkworld.runtime.model;

/**
 * Bond membership status of an agent.
 */
public enum BondStatus {
    UNBONDED,
    BONDED,
    /** Bonded and designated leader of its bond. */
    LEADER;

    /**
     * @return {@code true} for {@link #BONDED} and {@link #LEADER}.
     */
    public boolean isBonded() {
        return this != UNBONDED;
    }
}
