package org.sparkworld.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.sparkworld.persistence.ISnapshotStore;
import org.sparkworld.persistence.InMemorySnapshotStore;
import org.sparkworld.persistence.PersistenceException;
import org.sparkworld.persistence.WorldSnapshot;
import org.sparkworld.runtime.BenefactorPolicy;
import org.sparkworld.runtime.TestWorlds;
import org.sparkworld.runtime.WorldCorruptionException;
import org.sparkworld.runtime.WorldRules;
import org.sparkworld.runtime.oracle.OracleInvoker;
import org.sparkworld.runtime.oracle.impl.HeuristicDecisionOracle;
import org.sparkworld.runtime.oracle.impl.WhimsicalBenefactorOracle;
import org.sparkworld.runtime.report.TickReport;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("unit")
class SparkWorldServiceTest {

    private ISnapshotStore store;
    private final List<SparkWorldService> services = new ArrayList<>();

    @BeforeEach
    void setUp() {
        store = new InMemorySnapshotStore();
    }

    @AfterEach
    void tearDown() {
        services.forEach(SparkWorldService::close);
    }

    private SparkWorldService newService() {
        SparkWorldService service = new SparkWorldService(WorldRules.defaults(), BenefactorPolicy.defaults(), store,
            new OracleInvoker(2000L),
            random -> TestWorlds.collaborators(
                new HeuristicDecisionOracle(random.deriveFor("decision", 0), ConfigFactory.empty()),
                new WhimsicalBenefactorOracle(random.deriveFor("benefactor", 0), ConfigFactory.empty())),
            99L);
        services.add(service);
        return service;
    }

    @Test
    void initializePersistsGenesis() {
        SparkWorldService service = newService();

        String id = service.initialize(3, "Glowmarsh");

        assertThat(id).startsWith("sim-");
        assertThat(service.listSimulations()).containsExactly(id);
        WorldSnapshot genesis = service.inspect(id, null);
        assertThat(genesis.tick()).isZero();
        assertThat(genesis.name()).isEqualTo("Glowmarsh");
        assertThat(genesis.seed()).isEqualTo(99L);
        assertThat(genesis.agents()).hasSize(3);
    }

    @Test
    void everyTickIsPersisted() {
        SparkWorldService service = newService();
        String id = service.initialize(3, "Glowmarsh");

        service.tick(id);
        TickReport second = service.tick(id);

        assertThat(second.tick()).isEqualTo(2L);
        assertThat(store.latestTick(id)).hasValue(2L);
        assertThat(service.inspect(id, 1L).tick()).isEqualTo(1L);
    }

    @Test
    void anotherServiceContinuesFromTheStore() {
        String id = newService().initialize(3, "Glowmarsh");
        newService().tick(id);

        TickReport report = newService().tick(id);

        assertThat(report.tick()).isEqualTo(2L);
        assertThat(store.latestTick(id)).hasValue(2L);
    }

    @Test
    void failedTickIsNotPersistedAndTheEngineIsReloaded() {
        String id = newService().initialize(2, "Glowmarsh");
        WorldSnapshot good = store.loadLatest(id);
        WorldSnapshot.GenerationData current = good.currentGeneration();
        store.save(new WorldSnapshot(good.formatVersion(), good.simulationId(), good.name(), good.seed(), good.tick(),
            good.benefactor(), good.agents(), good.bonds(), good.missions(), good.frozenGeneration(),
            new WorldSnapshot.GenerationData(7L, false, current.bondRequests(), current.messages(),
                current.grantRequests(), current.events()),
            good.latestNews(), good.previousActions(), good.counters(), good.totals()));
        SparkWorldService service = newService();

        assertThatThrownBy(() -> service.tick(id)).isInstanceOf(WorldCorruptionException.class);
        assertThat(store.latestTick(id)).hasValue(0L);

        store.save(good);
        assertThat(service.tick(id).tick()).isEqualTo(1L);
    }

    @Test
    void failedSaveRewindsToTheLastStoredTick() {
        FlakyStore flaky = new FlakyStore();
        store = flaky;
        SparkWorldService service = newService();
        String id = service.initialize(3, "Glowmarsh");

        flaky.failNextSave = true;
        assertThatThrownBy(() -> service.tick(id))
            .isInstanceOf(PersistenceException.class)
            .hasMessageContaining("disk full");
        assertThat(store.latestTick(id)).hasValue(0L);

        TickReport retried = service.tick(id);

        assertThat(retried.tick()).isEqualTo(1L);
        assertThat(store.latestTick(id)).hasValue(1L);
        assertThat(service.inspect(id, 1L).tick()).isEqualTo(1L);
    }

    @Test
    void unknownSimulationCannotBeTicked() {
        SparkWorldService service = newService();

        assertThatThrownBy(() -> service.tick("sim-missing"))
            .isInstanceOf(PersistenceException.class)
            .hasMessageContaining("Unknown simulation");
    }

    @Test
    void configuredServicesWithTheSameSeedAgree() {
        Config config = ConfigFactory.parseString("""
            sparkworld.world.seed = 7
            sparkworld.persistence.className = "org.sparkworld.persistence.InMemorySnapshotStore"
            sparkworld.reporters = []
            """).withFallback(ConfigFactory.defaultReference()).resolve();

        List<Integer> first = runConfigured(config);
        List<Integer> second = runConfigured(config);

        assertThat(first).isEqualTo(second);
    }

    private List<Integer> runConfigured(Config config) {
        try (SparkWorldService service = SparkWorldService.fromConfig(config)) {
            String id = service.initialize(4, "Seeded");
            for (int i = 0; i < 8; i++) {
                service.tick(id);
            }
            return service.inspect(id, null).agents().stream().map(WorldSnapshot.AgentData::sparks).toList();
        }
    }

    private static class FlakyStore extends InMemorySnapshotStore {

        private boolean failNextSave;

        @Override
        public void save(WorldSnapshot snapshot) {
            if (failNextSave) {
                failNextSave = false;
                throw new PersistenceException("disk full");
            }
            super.save(snapshot);
        }
    }
}
