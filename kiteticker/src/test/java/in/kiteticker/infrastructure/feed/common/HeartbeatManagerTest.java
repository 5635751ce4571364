package in.kiteticker.infrastructure.feed.common;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for HeartbeatManager.
 *
 * Tests:
 * - Periodic ping sending
 * - Beat and pong timestamps
 * - Timeout detection and recovery
 * - Lifecycle management
 */
class HeartbeatManagerTest {

    private ScheduledExecutorService scheduler;
    private HeartbeatManager heartbeat;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        if (heartbeat != null) {
            heartbeat.stop();
        }
        scheduler.shutdownNow();
    }

    @Test
    void testInitialState() {
        heartbeat = new HeartbeatManager("TEST", scheduler, Duration.ofSeconds(1), Duration.ofSeconds(2), healthy -> {});

        assertNull(heartbeat.getLastBeatTime());
        assertNull(heartbeat.getLastPongTime(), "No pongs received yet");
    }

    @Test
    void testPeriodicPingSending() throws InterruptedException {
        CountDownLatch pingLatch = new CountDownLatch(3);
        heartbeat = new HeartbeatManager("TEST", scheduler, Duration.ofMillis(50), null, healthy -> {});

        heartbeat.start(pingLatch::countDown);

        assertTrue(pingLatch.await(2, TimeUnit.SECONDS), "Should send 3 pings within 2 seconds");
    }

    @Test
    void testStopCancelsPings() throws InterruptedException {
        AtomicInteger pings = new AtomicInteger();
        heartbeat = new HeartbeatManager("TEST", scheduler, Duration.ofMillis(20), null, healthy -> {});

        heartbeat.start(pings::incrementAndGet);
        Thread.sleep(100);
        heartbeat.stop();
        int afterStop = pings.get();
        Thread.sleep(100);

        assertTrue(pings.get() <= afterStop + 1, "At most an in-flight ping after stop");
    }

    @Test
    void testBeatDoesNotCountAsPong() {
        heartbeat = new HeartbeatManager("TEST", scheduler, Duration.ofSeconds(1), null, healthy -> {});
        Instant before = Instant.now();

        heartbeat.recordBeat();

        assertFalse(heartbeat.getLastBeatTime().isBefore(before));
        assertNull(heartbeat.getLastPongTime());
    }

    @Test
    void testPongAdvancesBeatTime() throws InterruptedException {
        heartbeat = new HeartbeatManager("TEST", scheduler, Duration.ofSeconds(1), null, healthy -> {});

        heartbeat.recordBeat();
        Instant beat = heartbeat.getLastBeatTime();
        Thread.sleep(5);
        heartbeat.recordPong();

        assertTrue(heartbeat.getLastBeatTime().isAfter(beat), "Pong is a heartbeat too");
        assertEquals(heartbeat.getLastPongTime(), heartbeat.getLastBeatTime());
    }

    @Test
    void testStartLeavesPongTimeUnset() throws InterruptedException {
        AtomicBoolean unhealthy = new AtomicBoolean(false);
        heartbeat = new HeartbeatManager("TEST", scheduler, Duration.ofMillis(20), Duration.ofSeconds(5),
            healthy -> unhealthy.set(!healthy));

        heartbeat.start(() -> {});
        Thread.sleep(100);

        assertNull(heartbeat.getLastPongTime(), "No pong arrived yet");
        assertNull(heartbeat.getLastBeatTime());
        assertFalse(unhealthy.get(), "Timeout counts from start, not from the epoch");
    }

    @Test
    void testTimeoutReportsUnhealthyOnce() throws InterruptedException {
        AtomicInteger unhealthyCalls = new AtomicInteger();
        CountDownLatch unhealthyLatch = new CountDownLatch(1);
        heartbeat = new HeartbeatManager("TEST", scheduler, Duration.ofMillis(20), Duration.ofMillis(60), healthy -> {
            if (!healthy) {
                unhealthyCalls.incrementAndGet();
                unhealthyLatch.countDown();
            }
        });

        heartbeat.start(() -> {});

        assertTrue(unhealthyLatch.await(2, TimeUnit.SECONDS), "Timeout should be detected");
        Thread.sleep(150);
        assertEquals(1, unhealthyCalls.get(), "Health callback fires only on change");
    }

    @Test
    void testPongRecoversHealth() throws InterruptedException {
        AtomicBoolean healthStatus = new AtomicBoolean(true);
        CountDownLatch unhealthyLatch = new CountDownLatch(1);
        heartbeat = new HeartbeatManager("TEST", scheduler, Duration.ofMillis(20), Duration.ofMillis(60), healthy -> {
            healthStatus.set(healthy);
            if (!healthy) {
                unhealthyLatch.countDown();
            }
        });

        heartbeat.start(() -> {});
        assertTrue(unhealthyLatch.await(2, TimeUnit.SECONDS));
        heartbeat.stop();

        heartbeat.recordPong();

        assertTrue(healthStatus.get(), "Pong should restore health");
    }

    @Test
    void testNoTimeoutWhenDisabled() throws InterruptedException {
        AtomicBoolean unhealthy = new AtomicBoolean(false);
        heartbeat = new HeartbeatManager("TEST", scheduler, Duration.ofMillis(10), Duration.ZERO,
            healthy -> unhealthy.set(!healthy));

        heartbeat.start(() -> {});
        Thread.sleep(100);

        assertFalse(unhealthy.get());
    }

    @Test
    void testPingFailureDoesNotStopHeartbeat() throws InterruptedException {
        CountDownLatch pingLatch = new CountDownLatch(3);
        heartbeat = new HeartbeatManager("TEST", scheduler, Duration.ofMillis(20), null, healthy -> {});

        heartbeat.start(() -> {
            pingLatch.countDown();
            throw new IllegalStateException("socket gone");
        });

        assertTrue(pingLatch.await(2, TimeUnit.SECONDS));
    }
}
