package org.sparkworld.runtime.oracle;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sparkworld.runtime.report.TickJournal;
import org.sparkworld.runtime.report.WorldEventType;

/**
 * Blocking request/response bridge to external collaborators with a hard timeout.
 * <p>
 * Each call runs on a daemon worker while the tick thread waits at most {@code timeoutMillis}.
 * A timeout, an exception or a {@code null} answer yields the caller's fallback, is logged at
 * WARN and is recorded as an {@link WorldEventType#ORACLE_FAILURE} event. The world never
 * stalls on a slow collaborator.
 * <p>
 * <b>Thread safety:</b> {@link #call} must only be called from the tick thread.
 * {@link #close()} is idempotent.
 */
public class OracleInvoker implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(OracleInvoker.class);

    private final ExecutorService executor;
    private final long timeoutMillis;
    private int failures = 0;

    /**
     * @param timeoutMillis Maximum time to wait for one answer, must be positive.
     */
    public OracleInvoker(long timeoutMillis) {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("Oracle timeout must be positive, got " + timeoutMillis);
        }
        this.timeoutMillis = timeoutMillis;
        AtomicInteger threadNumber = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "oracle-worker-" + threadNumber.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Calls a collaborator and waits for its answer.
     *
     * @param what A short description for logs, e.g. {@code "decision oracle for agent_001"}.
     * @param call The call.
     * @param fallback Supplies the safe default.
     * @param journal The tick journal, or {@code null} outside a tick.
     * @param <T> The answer type.
     * @return The answer, or the fallback.
     */
    public <T> T call(String what, Callable<T> call, Supplier<T> fallback, TickJournal journal) {
        Future<T> future = executor.submit(call);
        String failure;
        try {
            T answer = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
            if (answer != null) {
                return answer;
            }
            failure = "returned no answer";
        } catch (TimeoutException e) {
            future.cancel(true);
            failure = "timed out after " + timeoutMillis + " ms";
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            failure = "failed: " + cause.getMessage();
            LOG.debug("{} failed", what, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            failure = "was interrupted";
        }
        failures++;
        if (journal != null) {
            LOG.warn("Tick {}: {} {}, using fallback", journal.getTick(), what, failure);
            journal.event(WorldEventType.ORACLE_FAILURE, null, null, what + " " + failure);
        } else {
            LOG.warn("{} {}, using fallback", what, failure);
        }
        return fallback.get();
    }

    /**
     * @return Number of calls that fell back since creation.
     */
    public int getFailureCount() {
        return failures;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
