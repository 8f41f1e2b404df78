package org.sparkworld.runtime.raid;

/**
 * How a raid ended.
 */
public enum RaidOutcome {
    /** The attacker won and stole sparks. */
    SUCCESS,
    /** The attacker lost and paid the stake to the defender. */
    FAILURE,
    /** The attacker could not put up the stake; nothing happened. */
    INSUFFICIENT_STAKE
}
