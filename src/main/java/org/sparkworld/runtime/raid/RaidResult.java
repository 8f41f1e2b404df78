package org.sparkworld.runtime.raid;

/**
 * The result of one raid.
 *
 * @param attackerId The attacker.
 * @param defenderId The defender.
 * @param outcome How it ended.
 * @param attackerStrength Attacker age plus sparks at resolution time.
 * @param defenderStrength Defender age plus sparks at resolution time.
 * @param successProbability The attacker's chance of winning.
 * @param sparksTransferred Positive when the attacker gained, negative when it lost.
 * @param tick The tick of the raid.
 */
public record RaidResult(
    String attackerId,
    String defenderId,
    RaidOutcome outcome,
    int attackerStrength,
    int defenderStrength,
    double successProbability,
    int sparksTransferred,
    long tick
) {}
