package org.sparkworld.runtime.visibility;

import java.util.List;
import java.util.Map;

/**
 * Public knowledge about the world as of the end of a tick, shown to every agent in the
 * following tick.
 *
 * @param tick The tick the news describes.
 * @param aliveAgents Number of living agents.
 * @param activeBonds Number of live bonds.
 * @param agentsVanished Agents that vanished during the tick.
 * @param agentsSpawned Agents that were spawned during the tick.
 * @param bondsFormed Bonds formed during the tick.
 * @param bondsDissolved Bonds dissolved during the tick.
 * @param directory Public information (name, species, realm) of every living agent.
 */
public record WorldNews(
    long tick,
    int aliveAgents,
    int activeBonds,
    List<String> agentsVanished,
    List<String> agentsSpawned,
    List<String> bondsFormed,
    List<String> bondsDissolved,
    Map<String, PublicProfile> directory
) {

    public WorldNews {
        agentsVanished = List.copyOf(agentsVanished);
        agentsSpawned = List.copyOf(agentsSpawned);
        bondsFormed = List.copyOf(bondsFormed);
        bondsDissolved = List.copyOf(bondsDissolved);
        directory = Map.copyOf(directory);
    }

    /**
     * What everyone knows about a living agent.
     *
     * @param name Display name.
     * @param species Species.
     * @param homeRealm Home realm.
     */
    public record PublicProfile(String name, String species, String homeRealm) {}

    /**
     * @param tick The tick.
     * @return News for a world in which nothing has happened yet.
     */
    public static WorldNews empty(long tick) {
        return new WorldNews(tick, 0, 0, List.of(), List.of(), List.of(), List.of(), Map.of());
    }
}
