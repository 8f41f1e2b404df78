package org.sparkworld.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sparkworld.runtime.TestWorlds;
import org.sparkworld.runtime.model.WorldState;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
class FileSystemSnapshotStoreTest {

    @TempDir
    Path tempDir;

    private FileSystemSnapshotStore store;

    @BeforeEach
    void setUp() {
        store = new FileSystemSnapshotStore(tempDir);
    }

    private static WorldSnapshot snapshotAt(long tick) {
        WorldState world = TestWorlds.world(2, 5);
        for (int i = 0; i < tick; i++) {
            world.advanceTick();
            world.getRequestTables().rotate(world.getTick() + 1);
        }
        return WorldSnapshot.capture(world);
    }

    @Test
    void savesOneFilePerTickWithoutLeftovers() throws IOException {
        store.save(snapshotAt(0));
        store.save(snapshotAt(3));

        Path simulation = tempDir.resolve("sim-test");
        assertThat(simulation.resolve("tick-000000000.json")).isRegularFile();
        assertThat(simulation.resolve("tick-000000003.json")).isRegularFile();
        try (Stream<Path> files = Files.list(simulation)) {
            assertThat(files).noneMatch(f -> f.getFileName().toString().endsWith(".tmp"));
        }
    }

    @Test
    void latestTickIsTheHighestStored() {
        store.save(snapshotAt(3));
        store.save(snapshotAt(12));
        store.save(snapshotAt(7));

        assertThat(store.latestTick("sim-test")).hasValue(12L);
        assertThat(store.loadLatest("sim-test").tick()).isEqualTo(12L);
        assertThat(store.load("sim-test", 7).tick()).isEqualTo(7L);
    }

    @Test
    void unknownSimulationHasNoTicks() {
        assertThat(store.latestTick("sim-nope")).isEmpty();
        assertThat(store.listSimulations()).isEmpty();
        assertThatThrownBy(() -> store.loadLatest("sim-nope"))
            .isInstanceOf(PersistenceException.class)
            .hasMessageContaining("Unknown simulation");
        assertThatThrownBy(() -> store.load("sim-nope", 0))
            .isInstanceOf(PersistenceException.class);
    }

    @Test
    void listsStoredSimulations() {
        store.save(snapshotAt(0));

        assertThat(store.listSimulations()).containsExactly("sim-test");
    }

    @Test
    void rejectsIdsThatEscapeTheRootDirectory() {
        assertThatThrownBy(() -> store.latestTick("../outside"))
            .isInstanceOf(PersistenceException.class)
            .hasMessageContaining("Invalid simulation id");
        assertThatThrownBy(() -> store.load("..", 0))
            .isInstanceOf(PersistenceException.class);
    }

    @Test
    void corruptFileIsReportedAsPersistenceFailure() throws IOException {
        Path simulation = Files.createDirectories(tempDir.resolve("sim-bad"));
        Files.writeString(simulation.resolve("tick-000000001.json"), "{ not json");

        assertThat(store.latestTick("sim-bad")).hasValue(1L);
        assertThatThrownBy(() -> store.loadLatest("sim-bad"))
            .isInstanceOf(PersistenceException.class);
    }

    @Test
    void requiresRootDirectoryOption() {
        assertThatThrownBy(() -> new FileSystemSnapshotStore(ConfigFactory.empty()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("root-directory");
    }
}
