package org.endlesssource.scrobbler.dispatch;

import org.endlesssource.scrobbler.api.BackendException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class RetrierTest {
    private final AtomicLong nanos = new AtomicLong();
    private final List<Duration> sleeps = new ArrayList<>();
    private final Retrier retrier = new Retrier(duration -> {
        sleeps.add(duration);
        nanos.addAndGet(duration.toNanos());
    }, nanos::get);

    @Test
    void call_successOnFirstAttempt_doesNotSleep() throws Exception {
        String result = retrier.call(RetryPolicy.NOW_PLAYING, "test", () -> "ok");
        assertEquals("ok", result);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void call_transientFailures_retriedWithBackoff() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        String result = retrier.call(RetryPolicy.NOW_PLAYING, "test", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new BackendException("busy", true);
            }
            return "done";
        });
        assertEquals("done", result);
        assertEquals(3, attempts.get());
        assertEquals(List.of(Duration.ofMillis(500), Duration.ofMillis(1000)), sleeps);
    }

    @Test
    void call_nowPlayingBudgetExhausted_throwsLastFailure() {
        AtomicInteger attempts = new AtomicInteger();
        BackendException thrown = assertThrows(BackendException.class,
                () -> retrier.call(RetryPolicy.NOW_PLAYING, "test", () -> {
                    throw new BackendException("down " + attempts.incrementAndGet(), true);
                }));
        assertEquals(5, attempts.get());
        assertEquals("down 5", thrown.getMessage());
        assertEquals(List.of(Duration.ofMillis(500), Duration.ofMillis(1000), Duration.ofMillis(2000),
                Duration.ofMillis(4000)), sleeps);
    }

    @Test
    void call_scrobbleBudgetExhausted_staysWithinThirtySeconds() {
        AtomicInteger attempts = new AtomicInteger();
        assertThrows(BackendException.class, () -> retrier.call(RetryPolicy.SCROBBLE, "test", () -> {
            attempts.incrementAndGet();
            throw new BackendException("down", true);
        }));
        assertEquals(6, attempts.get());
        assertTrue(Duration.ofNanos(nanos.get()).compareTo(Duration.ofSeconds(30)) <= 0);
    }

    @Test
    void call_nonRetryableFailure_retriedUntilBudgetExhausted() {
        AtomicInteger attempts = new AtomicInteger();
        BackendException thrown = assertThrows(BackendException.class,
                () -> retrier.call(RetryPolicy.SCROBBLE, "test", () -> {
                    throw new BackendException("bad credentials " + attempts.incrementAndGet(), false);
                }));
        assertEquals(6, attempts.get());
        assertEquals("bad credentials 6", thrown.getMessage());
        assertFalse(thrown.isRetryable());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4),
                Duration.ofSeconds(8), Duration.ofSeconds(10)), sleeps);
    }

    @Test
    void call_nonRetryableFailureThenSuccess_returnsResult() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        String result = retrier.call(RetryPolicy.NOW_PLAYING, "test", () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new BackendException("rejected", false);
            }
            return "accepted";
        });
        assertEquals("accepted", result);
        assertEquals(2, attempts.get());
    }

    @Test
    void call_runtimeException_propagatesImmediately() {
        AtomicInteger attempts = new AtomicInteger();
        assertThrows(IllegalStateException.class, () -> retrier.call(RetryPolicy.SCROBBLE, "test", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("bug");
        }));
        assertEquals(1, attempts.get());
    }

    @Test
    void call_noRetryPolicy_makesSingleAttempt() {
        AtomicInteger attempts = new AtomicInteger();
        assertThrows(BackendException.class, () -> retrier.call(RetryPolicy.noRetry(), "test", () -> {
            attempts.incrementAndGet();
            throw new BackendException("down", true);
        }));
        assertEquals(1, attempts.get());
    }

    @Test
    void call_interruptedWhileWaiting_restoresFlagAndThrows() {
        Retrier interrupting = new Retrier(duration -> {
            throw new InterruptedException();
        }, nanos::get);
        try {
            assertThrows(BackendException.class, () -> interrupting.call(RetryPolicy.SCROBBLE, "test", () -> {
                throw new BackendException("down", true);
            }));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
