package org.sparkworld.persistence;

import java.util.List;
import java.util.OptionalLong;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Stores world snapshots keyed by simulation id and tick.
 * <p>
 * Implementations must provide a constructor with signature:
 * {@code (com.typesafe.config.Config options)}
 * </p>
 */
public interface ISnapshotStore {

    /**
     * Stores a snapshot, replacing any previous one for the same simulation and tick.
     *
     * @param snapshot The snapshot.
     * @throws PersistenceException if the snapshot cannot be written.
     */
    void save(WorldSnapshot snapshot);

    /**
     * @param simulationId The simulation.
     * @param tick The tick.
     * @return The snapshot.
     * @throws PersistenceException if there is none or it cannot be read.
     */
    WorldSnapshot load(String simulationId, long tick);

    /**
     * @param simulationId The simulation.
     * @return The highest stored tick, or empty if the simulation is unknown.
     */
    OptionalLong latestTick(String simulationId);

    /**
     * @return Ids of all stored simulations, sorted.
     */
    List<String> listSimulations();

    /**
     * Loads the newest snapshot of a simulation.
     *
     * @throws PersistenceException if the simulation is unknown.
     */
    default WorldSnapshot loadLatest(String simulationId) {
        OptionalLong latest = latestTick(simulationId);
        if (latest.isEmpty()) {
            throw new PersistenceException("Unknown simulation: " + simulationId);
        }
        return load(simulationId, latest.getAsLong());
    }

    /**
     * Creates a store from a {@code { className, options }} block.
     *
     * @param block The {@code sparkworld.persistence} block.
     * @return The store.
     */
    static ISnapshotStore fromConfig(Config block) {
        String className = block.getString("className");
        Config options = block.hasPath("options") ? block.getConfig("options") : ConfigFactory.empty();
        try {
            Object store = Class.forName(className).getConstructor(Config.class).newInstance(options);
            if (!(store instanceof ISnapshotStore snapshotStore)) {
                throw new IllegalArgumentException(className + " does not implement ISnapshotStore");
            }
            return snapshotStore;
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Failed to instantiate snapshot store: " + className, e);
        }
    }
}
