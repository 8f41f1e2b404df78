package org.sparkworld.runtime;

import java.util.List;

/**
 * Thrown when the world state violates one of its invariants, e.g. a bond that still
 * contains a vanished agent. Aborts the running tick; the caller must not persist the state.
 */
public class WorldCorruptionException extends RuntimeException {

    private final List<String> violations;

    public WorldCorruptionException(String message) {
        super(message);
        this.violations = List.of(message);
    }

    public WorldCorruptionException(long tick, List<String> violations) {
        super("World invariants violated at tick " + tick + ": " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
