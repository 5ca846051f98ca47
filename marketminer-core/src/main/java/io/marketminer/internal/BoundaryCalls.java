package io.marketminer.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs calls to external systems under a fixed deadline.
 *
 * <p>Each call is handed to the executor and awaited for at most {@code timeout}. On expiry the task is
 * cancelled (interrupted) and {@link BoundaryTimeoutException} is thrown. Exceptions raised by the call
 * itself are rethrown unchanged, so callers can still tell e.g. "queue not found" from other failures.
 *
 * <p>A zero timeout disables the deadline and runs the call on the caller's thread.
 */
public final class BoundaryCalls {
    private static final Logger log = LoggerFactory.getLogger(BoundaryCalls.class);

    private static final int RUNNING = 0;
    private static final int DONE = 1;
    private static final int ABANDONED = 2;

    private final ExecutorService executor;
    private final Duration timeout;

    public BoundaryCalls(ExecutorService executor, Duration timeout) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
    }

    private BoundaryCalls() {
        this.executor = null;
        this.timeout = Duration.ZERO;
    }

    /**
     * No deadline, calls run inline.
     */
    public static BoundaryCalls inline() {
        return new BoundaryCalls();
    }

    public Duration timeout() {
        return timeout;
    }

    public <T> T call(String operation, Supplier<T> call) {
        Objects.requireNonNull(call, "call must not be null");
        if (executor == null || timeout.isZero()) {
            return call.get();
        }

        Callable<T> task = call::get;
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("boundary call timed out operation={} timeout={}", operation, timeout);
            throw new BoundaryTimeoutException(operation, timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + operation, e);
        } catch (ExecutionException e) {
            throw rethrow(operation, e.getCause());
        }
    }

    public void run(String operation, Runnable call) {
        Objects.requireNonNull(call, "call must not be null");
        call(operation, () -> {
            call.run();
            return null;
        });
    }

    /**
     * Like {@link #run(String, Runnable)} for calls whose effect may still land after the deadline.
     *
     * <p>On timeout the call is not cancelled. It is left to finish, and {@code undo} runs on the same
     * worker thread right after it. A call that completes while the deadline fires counts as completed
     * and {@code undo} does not run.
     */
    public void runOrUndo(String operation, Runnable call, Runnable undo) {
        Objects.requireNonNull(call, "call must not be null");
        Objects.requireNonNull(undo, "undo must not be null");
        if (executor == null || timeout.isZero()) {
            call.run();
            return;
        }

        AtomicInteger state = new AtomicInteger(RUNNING);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Future<?> future = executor.submit(() -> {
            try {
                call.run();
            } catch (RuntimeException | Error e) {
                failure.set(e);
                throw e;
            } finally {
                if (!state.compareAndSet(RUNNING, DONE)) {
                    log.warn("abandoned boundary call finished, undoing operation={}", operation);
                    undo.run();
                }
            }
        });

        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return;
        } catch (TimeoutException e) {
            if (state.compareAndSet(RUNNING, ABANDONED)) {
                log.warn("boundary call timed out, undo pending operation={} timeout={}", operation, timeout);
                throw new BoundaryTimeoutException(operation, timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (state.compareAndSet(RUNNING, ABANDONED)) {
                throw new IllegalStateException("Interrupted while waiting for " + operation, e);
            }
        } catch (ExecutionException e) {
            throw rethrow(operation, e.getCause());
        }

        // finished at the deadline
        Throwable f = failure.get();
        if (f != null) {
            throw rethrow(operation, f);
        }
    }

    private static RuntimeException rethrow(String operation, Throwable cause) {
        if (cause instanceof RuntimeException re) {
            return re;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        return new IllegalStateException(operation + " failed", cause);
    }
}
