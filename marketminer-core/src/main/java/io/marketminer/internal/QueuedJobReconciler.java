package io.marketminer.internal;

import io.marketminer.core.Job;
import io.marketminer.spi.QueuedJobSweeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic sweep for jobs left {@code QUEUED} by an admission that died between persisting and dispatching.
 *
 * <p>A job still {@code QUEUED} after {@code staleAfter} is marked {@code FAILED}. The update is conditional
 * on the status, so a job the worker already picked up is never touched. {@code staleAfter} should be
 * longer than the queue's maximum retry duration.
 *
 * <p>Trade-off: status is otherwise written only by the worker, and the sweep cannot tell a lost dispatch
 * from a task still waiting in a backed-up queue. Such a task may later run for a job already marked
 * {@code FAILED}. The sweep is off unless enabled.
 */
public class QueuedJobReconciler {
    private static final Logger log = LoggerFactory.getLogger(QueuedJobReconciler.class);

    private final QueuedJobSweeper sweeper;
    private final Duration interval;
    private final Duration staleAfter;
    private final int batchSize;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private ScheduledExecutorService scheduler;

    public QueuedJobReconciler(QueuedJobSweeper sweeper, Duration interval, Duration staleAfter, int batchSize) {
        this.sweeper = Objects.requireNonNull(sweeper, "sweeper must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        this.staleAfter = Objects.requireNonNull(staleAfter, "staleAfter must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be a positive duration");
        }
        if (staleAfter.isZero() || staleAfter.isNegative()) {
            throw new IllegalArgumentException("staleAfter must be a positive duration");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be a positive number");
        }
        this.batchSize = batchSize;
    }

    /**
     * Start sweeping. Idempotent.
     */
    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("marketminer.reconciler");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::sweepSafely, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Reconciler started interval={} staleAfter={} batchSize={}", interval, staleAfter, batchSize);
    }

    /**
     * Stop sweeping. Idempotent.
     */
    public synchronized void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Reconciler did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            scheduler = null;
        }
        log.info("Reconciler stopped.");
    }

    public boolean isRunning() {
        return started.get();
    }

    /**
     * One pass over at most {@code batchSize} stale jobs.
     *
     * @return number of jobs marked {@code FAILED}
     */
    public int sweepOnce() {
        Instant now = nowInstant();
        Instant cutoff = now.minus(staleAfter);

        List<Job> stale = sweeper.findQueuedCreatedBefore(cutoff, batchSize);
        int failed = 0;
        for (Job job : stale) {
            if (sweeper.failIfStillQueued(job.id(), now)) {
                failed++;
                log.warn("Marked undispatched job FAILED jobId={} domain={} createdAt={}", job.id(), job.domain(), job.createdAt());
            }
        }
        log.debug("Reconciler sweep finished candidates={} failed={} cutoff={}", stale.size(), failed, cutoff);
        return failed;
    }

    private void sweepSafely() {
        try {
            sweepOnce();
        } catch (Exception e) {
            log.error("Reconciler sweep failed msg={}", e.getMessage(), e);
        }
    }

    protected Instant nowInstant() {
        return Instant.now();
    }
}
