package io.marketminer.internal;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoundaryCallsTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void inlineCallsShouldRunOnCallerThread() {
        AtomicReference<Thread> ran = new AtomicReference<>();

        BoundaryCalls.inline().run("noop", () -> ran.set(Thread.currentThread()));

        assertSame(Thread.currentThread(), ran.get());
    }

    @Test
    void boundedCallShouldReturnValue() {
        BoundaryCalls calls = new BoundaryCalls(executor, Duration.ofSeconds(5));

        AtomicReference<Thread> ran = new AtomicReference<>();
        String result = calls.call("echo", () -> {
            ran.set(Thread.currentThread());
            return "ok";
        });

        assertEquals("ok", result);
        assertNotEquals(Thread.currentThread(), ran.get());
    }

    @Test
    void slowCallShouldTimeOut() {
        BoundaryCalls calls = new BoundaryCalls(executor, Duration.ofMillis(100));

        BoundaryTimeoutException ex = assertThrows(BoundaryTimeoutException.class, () -> calls.run("slow", () -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));

        assertEquals("slow", ex.getOperation());
    }

    @Test
    void abandonedCallShouldFinishThenUndo() throws Exception {
        BoundaryCalls calls = new BoundaryCalls(executor, Duration.ofMillis(100));
        List<String> events = new CopyOnWriteArrayList<>();
        CountDownLatch undone = new CountDownLatch(1);

        assertThrows(BoundaryTimeoutException.class, () -> calls.runOrUndo("slow-write", () -> {
            sleepQuietly(400);
            events.add("write");
        }, () -> {
            events.add("undo");
            undone.countDown();
        }));

        assertTrue(undone.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("write", "undo"), events);
    }

    @Test
    void callWithinDeadlineShouldNotUndo() {
        BoundaryCalls calls = new BoundaryCalls(executor, Duration.ofSeconds(5));
        AtomicInteger undos = new AtomicInteger();

        calls.runOrUndo("fast-write", () -> {
        }, undos::incrementAndGet);

        assertEquals(0, undos.get());
    }

    @Test
    void failureShouldBeRethrownUnwrapped() {
        BoundaryCalls calls = new BoundaryCalls(executor, Duration.ofSeconds(5));
        IllegalStateException failure = new IllegalStateException("boom");

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> calls.run("failing", () -> {
            throw failure;
        }));

        assertSame(failure, thrown);
    }

    @Test
    void negativeTimeoutShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BoundaryCalls(executor, Duration.ofSeconds(-1)));
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
