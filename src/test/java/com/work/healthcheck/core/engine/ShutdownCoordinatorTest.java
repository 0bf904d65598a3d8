package com.work.healthcheck.core.engine;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ShutdownCoordinatorTest {

    @Test
    public void request_before_wait_is_not_lost() throws Exception {
        ShutdownCoordinator coordinator = new ShutdownCoordinator();
        assertFalse(coordinator.requestShutdown());
        long start = System.nanoTime();
        assertTrue(coordinator.awaitNextRound(Duration.ofHours(1)));
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 1000);
    }

    @Test
    public void interval_elapses_without_request() throws Exception {
        ShutdownCoordinator coordinator = new ShutdownCoordinator();
        assertFalse(coordinator.awaitNextRound(Duration.ofMillis(20)));
        assertEquals(-1, coordinator.getLastFailureCount());
        coordinator.recordFailures(1);
        assertEquals(1, coordinator.getLastFailureCount());
    }

    @Test
    public void request_wakes_sleeper_and_waits_for_exit() throws Exception {
        ShutdownCoordinator coordinator = new ShutdownCoordinator();
        CountDownLatch sleeping = new CountDownLatch(1);
        Thread worker = new Thread(() -> {
            try {
                sleeping.countDown();
                coordinator.awaitNextRound(Duration.ofHours(1));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                coordinator.markExited();
            }
        });
        assertTrue(coordinator.registerWorker(worker));
        worker.start();
        assertTrue(sleeping.await(2, TimeUnit.SECONDS));

        assertTimeoutPreemptively(Duration.ofSeconds(2), () -> assertTrue(coordinator.requestShutdown()));
        assertTrue(coordinator.isExited());
        // 第二次调用直接返回
        assertTimeoutPreemptively(Duration.ofSeconds(1), () -> assertTrue(coordinator.requestShutdown()));
    }

    @Test
    public void register_after_request_is_refused() {
        ShutdownCoordinator coordinator = new ShutdownCoordinator();
        coordinator.requestShutdown();
        assertFalse(coordinator.registerWorker(new Thread(() -> { })));
    }
}
