package org.sparkworld.service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sparkworld.persistence.ISnapshotStore;
import org.sparkworld.persistence.WorldSnapshot;
import org.sparkworld.runtime.BenefactorPolicy;
import org.sparkworld.runtime.WorldEngine;
import org.sparkworld.runtime.WorldRules;
import org.sparkworld.runtime.internal.services.SeededRandomProvider;
import org.sparkworld.runtime.model.WorldState;
import org.sparkworld.runtime.oracle.OracleInvoker;
import org.sparkworld.runtime.oracle.WorldCollaborators;
import org.sparkworld.runtime.report.TickReport;
import org.sparkworld.runtime.spi.IRandomProvider;

import com.typesafe.config.Config;

/**
 * Driver surface of the world: create simulations and advance them tick by tick.
 * <p>
 * Every completed tick is persisted, so a simulation can be continued by a later process.
 * Engines are cached per simulation; a tick that fails, or whose snapshot cannot be saved,
 * evicts the cached engine so the next call starts again from the last persisted snapshot.
 * <p>
 * <b>Thread safety:</b> Not thread-safe.
 */
public class SparkWorldService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SparkWorldService.class);

    private final WorldRules rules;
    private final BenefactorPolicy benefactorPolicy;
    private final ISnapshotStore store;
    private final OracleInvoker invoker;
    private final Function<IRandomProvider, WorldCollaborators> collaboratorFactory;
    private final Long fixedSeed;
    private final Map<String, WorldEngine> engines = new HashMap<>();

    /**
     * @param rules Economy constants.
     * @param benefactorPolicy Genesis setup of the benefactor.
     * @param store Where snapshots go.
     * @param invoker The oracle bridge; closed with this service.
     * @param collaboratorFactory Creates the collaborators of a simulation from its root random provider.
     * @param fixedSeed Seed for new simulations, or {@code null} for a fresh random seed each time.
     */
    public SparkWorldService(WorldRules rules, BenefactorPolicy benefactorPolicy, ISnapshotStore store,
                             OracleInvoker invoker, Function<IRandomProvider, WorldCollaborators> collaboratorFactory,
                             Long fixedSeed) {
        this.rules = rules;
        this.benefactorPolicy = benefactorPolicy;
        this.store = store;
        this.invoker = invoker;
        this.collaboratorFactory = collaboratorFactory;
        this.fixedSeed = fixedSeed;
    }

    /**
     * Builds a service from the resolved root configuration.
     *
     * @param config The root configuration (containing {@code sparkworld}).
     * @return The service.
     */
    public static SparkWorldService fromConfig(Config config) {
        Config sparkworld = config.getConfig("sparkworld");
        Config world = sparkworld.getConfig("world");
        Config oracles = sparkworld.getConfig("oracles");
        List<? extends Config> reporters = sparkworld.getConfigList("reporters");
        Long seed = null;
        if (world.hasPath("seed") && !"random".equalsIgnoreCase(world.getString("seed"))) {
            seed = world.getLong("seed");
        }
        return new SparkWorldService(
            WorldRules.fromConfig(world),
            BenefactorPolicy.fromConfig(sparkworld.getConfig("benefactor")),
            ISnapshotStore.fromConfig(sparkworld.getConfig("persistence")),
            new OracleInvoker(oracles.getDuration("timeout").toMillis()),
            random -> WorldCollaborators.fromConfig(oracles, reporters, random),
            seed);
    }

    /**
     * Creates a new simulation and persists its tick-0 state.
     *
     * @param numAgents Number of genesis agents.
     * @param name Human-readable name.
     * @return The new simulation id.
     */
    public String initialize(int numAgents, String name) {
        String simulationId = "sim-" + LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss"))
            + "-" + UUID.randomUUID().toString().substring(0, 8);
        long seed = fixedSeed != null ? fixedSeed : UUID.randomUUID().getMostSignificantBits();
        WorldEngine engine = WorldEngine.genesis(simulationId, name, numAgents, seed, rules, benefactorPolicy,
            collaboratorFactory.apply(new SeededRandomProvider(seed)), invoker);
        store.save(WorldSnapshot.capture(engine.snapshot()));
        engines.put(simulationId, engine);
        return simulationId;
    }

    /**
     * Runs one tick of a simulation and persists the result.
     *
     * @param simulationId The simulation.
     * @return The tick report.
     */
    public TickReport tick(String simulationId) {
        WorldEngine engine = engines.computeIfAbsent(simulationId, this::restore);
        try {
            TickReport report = engine.tick();
            store.save(WorldSnapshot.capture(engine.snapshot()));
            return report;
        } catch (RuntimeException e) {
            engines.remove(simulationId);
            LOG.error("Tick of {} failed, the simulation stays at its last saved tick: {}", simulationId, e.getMessage());
            throw e;
        }
    }

    /**
     * @param simulationId The simulation.
     * @param tick The tick, or {@code null} for the latest.
     * @return The stored snapshot.
     */
    public WorldSnapshot inspect(String simulationId, Long tick) {
        return tick == null ? store.loadLatest(simulationId) : store.load(simulationId, tick);
    }

    public List<String> listSimulations() {
        return store.listSimulations();
    }

    public ISnapshotStore getStore() {
        return store;
    }

    private WorldEngine restore(String simulationId) {
        WorldState world = store.loadLatest(simulationId).restore();
        LOG.debug("Restored {} at tick {}", simulationId, world.getTick());
        return new WorldEngine(world, rules,
            collaboratorFactory.apply(new SeededRandomProvider(world.getSeed()).deriveFor("resume", world.getTick())),
            invoker);
    }

    @Override
    public void close() {
        invoker.close();
    }
}
