package org.sparkworld.persistence;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Stores each snapshot as a JSON file {@code <root>/<simulationId>/tick-000000042.json}.
 * <p>
 * Writes go to a {@code .tmp} file next to the target first and are then moved into place
 * atomically, so a reader never sees a half-written snapshot.
 * <p>
 * Options: {@code root-directory} (required; relative paths resolve against the working
 * directory).
 */
public class FileSystemSnapshotStore implements ISnapshotStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileSystemSnapshotStore.class);
    private static final Pattern TICK_FILE = Pattern.compile("tick-(\\d+)\\.json");
    private static final Pattern SIMULATION_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path rootDirectory;
    private final WorldSnapshotCodec codec = new WorldSnapshotCodec();

    public FileSystemSnapshotStore(Config options) {
        this(rootFrom(options));
    }

    public FileSystemSnapshotStore(Path rootDirectory) {
        this.rootDirectory = rootDirectory.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.rootDirectory);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot create root-directory: " + this.rootDirectory, e);
        }
        if (!Files.isWritable(this.rootDirectory)) {
            throw new IllegalArgumentException("root-directory is not writable: " + this.rootDirectory);
        }
    }

    private static Path rootFrom(Config options) {
        if (!options.hasPath("root-directory")) {
            throw new IllegalArgumentException("root-directory is required for FileSystemSnapshotStore");
        }
        return Paths.get(options.getString("root-directory"));
    }

    public Path getRootDirectory() {
        return rootDirectory;
    }

    @Override
    public void save(WorldSnapshot snapshot) {
        Path file = tickFile(snapshot.simulationId(), snapshot.tick());
        Path tempFile = file.resolveSibling(file.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(tempFile, codec.encode(snapshot), StandardCharsets.UTF_8);
            Files.move(tempFile, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupEx) {
                LOG.warn("Failed to clean up temp file after write failure: {}", tempFile, cleanupEx);
            }
            throw new PersistenceException("Failed to write snapshot " + file, e);
        }
        LOG.debug("Saved snapshot of {} at tick {} to {}", snapshot.simulationId(), snapshot.tick(), file);
    }

    @Override
    public WorldSnapshot load(String simulationId, long tick) {
        Path file = tickFile(simulationId, tick);
        if (!Files.isRegularFile(file)) {
            throw new PersistenceException("No snapshot of " + simulationId + " at tick " + tick + " (" + file + ")");
        }
        try {
            return codec.decode(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new PersistenceException("Failed to read snapshot " + file, e);
        }
    }

    @Override
    public OptionalLong latestTick(String simulationId) {
        Path directory = simulationDirectory(simulationId);
        if (!Files.isDirectory(directory)) {
            return OptionalLong.empty();
        }
        long latest = -1L;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "tick-*.json")) {
            for (Path file : files) {
                Matcher matcher = TICK_FILE.matcher(file.getFileName().toString());
                if (matcher.matches()) {
                    latest = Math.max(latest, Long.parseLong(matcher.group(1)));
                }
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to list snapshots of " + simulationId, e);
        }
        return latest < 0 ? OptionalLong.empty() : OptionalLong.of(latest);
    }

    @Override
    public List<String> listSimulations() {
        List<String> ids = new ArrayList<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(rootDirectory, Files::isDirectory)) {
            for (Path dir : dirs) {
                ids.add(dir.getFileName().toString());
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to list simulations in " + rootDirectory, e);
        }
        ids.sort(null);
        return ids;
    }

    private Path simulationDirectory(String simulationId) {
        if (simulationId == null || !SIMULATION_ID.matcher(simulationId).matches() || simulationId.startsWith(".")) {
            throw new PersistenceException("Invalid simulation id: " + simulationId);
        }
        return rootDirectory.resolve(simulationId);
    }

    private Path tickFile(String simulationId, long tick) {
        return simulationDirectory(simulationId).resolve(String.format("tick-%09d.json", tick));
    }
}
