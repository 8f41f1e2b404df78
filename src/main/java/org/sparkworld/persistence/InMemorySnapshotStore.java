package org.sparkworld.persistence;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Keeps snapshots in memory as encoded JSON, so every load yields an independent world.
 * Intended for tests and throwaway runs.
 */
public class InMemorySnapshotStore implements ISnapshotStore {

    private final WorldSnapshotCodec codec = new WorldSnapshotCodec();
    private final Map<String, NavigableMap<Long, String>> snapshots = new ConcurrentHashMap<>();

    public InMemorySnapshotStore() {
        this(ConfigFactory.empty());
    }

    public InMemorySnapshotStore(Config options) {
        // no options
    }

    @Override
    public void save(WorldSnapshot snapshot) {
        snapshots.computeIfAbsent(snapshot.simulationId(), k -> new TreeMap<>())
            .put(snapshot.tick(), codec.encode(snapshot));
    }

    @Override
    public WorldSnapshot load(String simulationId, long tick) {
        NavigableMap<Long, String> ticks = snapshots.get(simulationId);
        String json = ticks == null ? null : ticks.get(tick);
        if (json == null) {
            throw new PersistenceException("No snapshot of " + simulationId + " at tick " + tick);
        }
        return codec.decode(json);
    }

    @Override
    public OptionalLong latestTick(String simulationId) {
        NavigableMap<Long, String> ticks = snapshots.get(simulationId);
        return ticks == null || ticks.isEmpty() ? OptionalLong.empty() : OptionalLong.of(ticks.lastKey());
    }

    @Override
    public List<String> listSimulations() {
        List<String> ids = new ArrayList<>(snapshots.keySet());
        ids.sort(null);
        return ids;
    }
}
