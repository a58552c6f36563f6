package com.rolebind.common.infra;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FlushLoopTest {

    @Test
    void start_flushesOnEveryTick() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(3);
        try (FlushLoop loop = new FlushLoop("test-flush", 10, latch::countDown)) {
            loop.start();
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void close_flushesOnceMoreEvenWithoutStart() {
        AtomicInteger flushes = new AtomicInteger();
        FlushLoop loop = new FlushLoop("test-flush", 60_000, flushes::incrementAndGet);

        loop.close();
        loop.close();

        assertEquals(1, flushes.get());
    }

    @Test
    void failingFlush_doesNotStopLaterTicks() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(3);
        try (FlushLoop loop = new FlushLoop("test-flush", 10, () -> {
            latch.countDown();
            throw new IllegalStateException("disk full");
        })) {
            loop.start();
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void failingFinalFlush_doesNotEscapeClose() {
        FlushLoop loop = new FlushLoop("test-flush", 60_000, () -> {
            throw new IllegalStateException("disk full");
        });

        assertDoesNotThrow(loop::close);
    }

    @Test
    void nonPositiveInterval_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FlushLoop("test-flush", 0, () -> {
        }));
    }
}
