package com.prioritymind.core.session;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SessionLocksTest {

    private final SessionLocks locks = new SessionLocks();

    @Test
    @DisplayName("sets the MDC during the work and clears it afterwards")
    void mdc() {
        String seen = locks.withLock("s1", "adjust", () -> MDC.get("sessionId") + "/" + MDC.get("operation"));

        assertEquals("s1/adjust", seen);
        assertNull(MDC.get("sessionId"));
    }

    @Test
    @DisplayName("clears the MDC when the work throws")
    void mdcOnFailure() {
        assertThrows(IllegalStateException.class, () -> locks.withLock("s1", "adjust", () -> {
            throw new IllegalStateException("boom");
        }));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("work on the same session never overlaps")
    void serializesSameSession() throws InterruptedException {
        var inside = new AtomicInteger();
        var maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        var done = new CountDownLatch(20);

        for (int i = 0; i < 20; i++) {
            pool.submit(() -> {
                locks.withLock("s1", "op", () -> {
                    int now = inside.incrementAndGet();
                    maxInside.accumulateAndGet(now, Math::max);
                    Thread.onSpinWait();
                    inside.decrementAndGet();
                    return null;
                });
                done.countDown();
            });
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        pool.shutdown();
        assertEquals(1, maxInside.get());
    }
}
