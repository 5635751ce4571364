package in.kiteticker.infrastructure.feed.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Liveness tracking for the ticker connection.
 *
 * Two signals are recorded:
 * <ul>
 *   <li>beats - 1-byte binary frames the server sends when there is nothing to tick</li>
 *   <li>pongs - transport level replies to the pings sent by this manager</li>
 * </ul>
 * Either one advances the heartbeat time; pongs also have their own timestamp.
 * While started, a ping is sent every {@code pingInterval}. If a pong timeout is
 * configured and no pong arrives within it, the connection is reported unhealthy
 * through the health callback (once per change).
 *
 * Tasks run on the scheduler passed in; the manager does not own it.
 *
 * Usage:
 * <pre>
 * HeartbeatManager heartbeat = new HeartbeatManager(
 *     "KITE",
 *     eventLoop,
 *     Duration.ofSeconds(3),   // ping every 3 seconds
 *     Duration.ofSeconds(10),  // unhealthy after 10 seconds without pong
 *     isHealthy -> {
 *         if (!isHealthy) {
 *             reconnect();
 *         }
 *     }
 * );
 *
 * heartbeat.start(connection::sendPing);
 * // When pong received:
 * heartbeat.recordPong();
 * heartbeat.stop();
 * </pre>
 */
public class HeartbeatManager {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatManager.class);

    private final String feedName;
    private final ScheduledExecutorService scheduler;
    private final Duration pingInterval;
    private final Duration pongTimeout;
    private final Consumer<Boolean> healthCallback;

    private volatile ScheduledFuture<?> pingTask;
    private volatile Instant lastPongTime;
    private volatile Instant lastBeatTime;
    // Reference point for the pong timeout; reset on start and on every pong
    private volatile Instant pongClock;
    private volatile boolean running = false;
    private volatile boolean healthy = true;

    /**
     * @param pongTimeout {@code null} or zero disables timeout detection
     */
    public HeartbeatManager(String feedName,
                            ScheduledExecutorService scheduler,
                            Duration pingInterval,
                            Duration pongTimeout,
                            Consumer<Boolean> healthCallback) {
        if (pingInterval.isNegative() || pingInterval.isZero()) {
            throw new IllegalArgumentException("Ping interval must be positive");
        }
        this.feedName = feedName;
        this.scheduler = scheduler;
        this.pingInterval = pingInterval;
        this.pongTimeout = pongTimeout == null || pongTimeout.isZero() ? null : pongTimeout;
        this.healthCallback = healthCallback;
    }

    /**
     * Start sending periodic pings. The pong clock starts now, so a fresh
     * connection is not reported stale before its first ping round trip.
     */
    public synchronized void start(Runnable pingFunction) {
        if (running) {
            log.warn("[{}] Heartbeat already running", feedName);
            return;
        }

        log.debug("[{}] Starting heartbeat (ping interval: {}ms, pong timeout: {})",
            feedName, pingInterval.toMillis(), pongTimeout != null ? pongTimeout.toMillis() + "ms" : "off");

        running = true;
        healthy = true;
        pongClock = Instant.now();

        pingTask = scheduler.scheduleAtFixedRate(() -> {
            try {
                sendPing(pingFunction);
                checkTimeout();
            } catch (Exception e) {
                log.error("[{}] Heartbeat round failed", feedName, e);
            }
        }, pingInterval.toMillis(), pingInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stop sending pings. Recorded timestamps are kept.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        log.debug("[{}] Stopping heartbeat", feedName);
        running = false;

        if (pingTask != null) {
            pingTask.cancel(false);
            pingTask = null;
        }
    }

    /**
     * Record a transport pong. Counts as a heartbeat too, and marks the
     * connection healthy again if it was stale.
     */
    public void recordPong() {
        Instant now = Instant.now();
        lastPongTime = now;
        lastBeatTime = now;
        pongClock = now;

        if (!healthy) {
            log.info("[{}] Pong received, connection healthy again", feedName);
            markHealthy();
        }
    }

    /**
     * Record a 1-byte heartbeat frame from the server.
     */
    public void recordBeat() {
        lastBeatTime = Instant.now();
    }

    /**
     * @return time of the last heartbeat frame or pong, or null if neither was received
     */
    public Instant getLastBeatTime() {
        return lastBeatTime;
    }

    /**
     * @return time of the last pong, or null until the first pong arrives
     */
    public Instant getLastPongTime() {
        return lastPongTime;
    }

    private void sendPing(Runnable pingFunction) {
        if (!running) {
            return;
        }

        log.trace("[{}] Sending ping", feedName);

        try {
            pingFunction.run();
        } catch (Exception e) {
            log.warn("[{}] Ping function threw exception: {}", feedName, e.getMessage());
        }
    }

    private void checkTimeout() {
        if (!running || pongTimeout == null || isWithinTimeout()) {
            return;
        }

        log.warn("[{}] Heartbeat timeout - no pong received for {}ms", feedName, pongTimeout.toMillis());
        markUnhealthy();
    }

    private boolean isWithinTimeout() {
        if (pongTimeout == null) {
            return true;
        }
        Instant since = pongClock;
        if (since == null) {
            return false;
        }
        return Duration.between(since, Instant.now()).compareTo(pongTimeout) < 0;
    }

    private void markHealthy() {
        if (healthy) {
            return;
        }

        healthy = true;
        notifyHealth(true);
    }

    private void markUnhealthy() {
        if (!healthy) {
            return;
        }

        healthy = false;
        notifyHealth(false);
    }

    private void notifyHealth(boolean isHealthy) {
        if (healthCallback == null) {
            return;
        }
        try {
            healthCallback.accept(isHealthy);
        } catch (Exception e) {
            log.error("[{}] Health callback threw exception", feedName, e);
        }
    }
}
