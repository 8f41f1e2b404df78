package org.sparkworld.runtime.visibility;

/**
 * Double buffer of {@link TickGeneration}s that implements the one-tick visibility delay.
 * <p>
 * The engine writes everything produced during tick {@code T} into {@link #current()} and
 * builds every observation of tick {@code T} exclusively from {@link #frozen()}, which holds
 * what was produced during {@code T-1}. {@link #rotate(long)} runs once at the tick boundary:
 * the current generation is frozen and becomes readable, the previous frozen generation is
 * discarded (unaccepted bond requests expire with it), and a fresh current generation is
 * started.
 */
public class RequestTables {

    private TickGeneration frozen;
    private TickGeneration current;

    /**
     * Creates tables for a world whose next tick is {@code nextTick}.
     *
     * @param nextTick The tick the current generation will collect for.
     */
    public RequestTables(long nextTick) {
        this.frozen = new TickGeneration(nextTick - 1);
        this.frozen.freeze();
        this.current = new TickGeneration(nextTick);
    }

    /**
     * Restores tables from persisted generations.
     *
     * @param frozen A frozen generation.
     * @param current A writable generation.
     */
    public RequestTables(TickGeneration frozen, TickGeneration current) {
        if (!frozen.isFrozen()) {
            frozen.freeze();
        }
        this.frozen = frozen;
        this.current = current;
    }

    /**
     * @return The generation being filled during the running tick.
     */
    public TickGeneration current() {
        return current;
    }

    /**
     * @return The read-only generation produced in the previous tick.
     */
    public TickGeneration frozen() {
        return frozen;
    }

    /**
     * Swaps the generations at the tick boundary.
     *
     * @param nextTick The tick the new current generation will collect for.
     */
    public void rotate(long nextTick) {
        current.freeze();
        this.frozen = current;
        this.current = new TickGeneration(nextTick);
    }
}
