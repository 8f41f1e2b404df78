package org.sparkworld.runtime;

import com.typesafe.config.Config;

/**
 * Economy constants of a world.
 *
 * @param upkeepCost Sparks every living agent pays per tick.
 * @param initialSparks Sparks of a genesis agent.
 * @param raidStake Sparks an attacker must hold to raid and loses on failure.
 * @param minSteal Lower bound of a successful raid's loot.
 * @param maxSteal Upper bound of a successful raid's loot.
 * @param spawnCost Sparks a parent pays to spawn.
 * @param newbornSparks Sparks a newborn starts with.
 * @param verifyInvariants Whether invariants are checked at the end of each tick.
 */
public record WorldRules(
    int upkeepCost,
    int initialSparks,
    int raidStake,
    int minSteal,
    int maxSteal,
    int spawnCost,
    int newbornSparks,
    boolean verifyInvariants
) {

    public WorldRules {
        if (upkeepCost < 0 || initialSparks < 1 || raidStake < 0 || spawnCost < 0 || newbornSparks < 1) {
            throw new IllegalArgumentException("Invalid economy constants");
        }
        if (minSteal < 0 || maxSteal < minSteal) {
            throw new IllegalArgumentException("Invalid raid loot range [" + minSteal + ", " + maxSteal + "]");
        }
    }

    /**
     * @return The standard rules: upkeep 1, genesis 5, stake 1, loot 1..5, spawn 5, newborn 5.
     */
    public static WorldRules defaults() {
        return new WorldRules(1, 5, 1, 1, 5, 5, 5, true);
    }

    /**
     * Reads the rules from a {@code sparkworld.world} block.
     *
     * @param world The block.
     * @return The rules.
     */
    public static WorldRules fromConfig(Config world) {
        return new WorldRules(
            world.getInt("upkeep-cost"),
            world.getInt("initial-sparks"),
            world.getInt("raid.stake"),
            world.getInt("raid.min-steal"),
            world.getInt("raid.max-steal"),
            world.getInt("spawn.cost"),
            world.getInt("spawn.newborn-sparks"),
            world.getBoolean("verify-invariants"));
    }
}
