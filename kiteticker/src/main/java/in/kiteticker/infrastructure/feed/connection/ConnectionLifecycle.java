package in.kiteticker.infrastructure.feed.connection;

import in.kiteticker.infrastructure.feed.common.HeartbeatManager;
import in.kiteticker.infrastructure.feed.common.ReconnectionPolicy;
import in.kiteticker.infrastructure.feed.metrics.FeedMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Owns the socket to the ticker endpoint: connect, liveness, close handling and
 * automatic reconnection.
 *
 * All state changes happen on a single-thread event loop. Transport events are
 * re-posted onto it and tagged with the generation of the socket that produced
 * them; events of a socket that was replaced or closed are dropped.
 *
 * Close handling:
 * <ul>
 *   <li>close code 1000 - close callback only, no reconnect</li>
 *   <li>any other code - error callback, close callback, then reconnect when enabled</li>
 *   <li>transport error or failed handshake - connect-error callback, socket aborted,
 *       then reconnect when enabled</li>
 * </ul>
 *
 * Reconnect attempts are scheduled on the event loop with the delay of the
 * {@link ReconnectionPolicy}. Once the policy is exhausted the reconnect-fail
 * callback fires once and the state becomes {@link ConnectionState#CLOSED}.
 */
public class ConnectionLifecycle {
    private static final Logger log = LoggerFactory.getLogger(ConnectionLifecycle.class);

    public static final int NORMAL_CLOSURE = 1000;
    public static final int ABNORMAL_CLOSURE = 1006;

    static final String PING_TIMEOUT_REASON = "ping timed out";

    /**
     * Lifecycle events, delivered on the event loop.
     */
    public interface Listener {

        /** Socket open; subscriptions may be restored here. */
        void onConnected();

        void onText(String text);

        /** Binary frame other than a heartbeat. */
        void onTickFrame(byte[] frame);

        void onConnectError(Throwable error);

        void onError(int code, String reason);

        void onClose(int code, String reason);

        void onTryReconnect(int attempt);

        void onReconnectFail();
    }

    private final FeedTransport transport;
    private final ScheduledExecutorService eventLoop;
    private final Supplier<URI> endpoint;
    private final Duration connectTimeout;
    private final boolean reconnectEnabled;
    private final ReconnectionPolicy reconnectionPolicy;
    private final HeartbeatManager heartbeat;
    private final FeedMetrics metrics;
    private final Listener listener;

    private final AtomicBoolean reconnecting = new AtomicBoolean(false);
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile FeedConnection connection;

    // event loop only
    private int generation = 0;
    private boolean stopped = false;
    private ScheduledFuture<?> pendingAttempt;
    private CompletableFuture<Void> pendingClose;

    private ConnectionLifecycle(Builder builder) {
        this.transport = builder.transport;
        this.eventLoop = builder.eventLoop;
        this.endpoint = builder.endpoint;
        this.connectTimeout = builder.connectTimeout;
        this.reconnectEnabled = builder.reconnectEnabled;
        this.reconnectionPolicy = builder.reconnectionPolicy;
        this.metrics = builder.metrics;
        this.listener = builder.listener;
        this.heartbeat = new HeartbeatManager(
            "KITE-WS",
            eventLoop,
            builder.pingInterval,
            reconnectEnabled ? builder.pongTimeout : null,
            healthy -> {
                if (!healthy) {
                    post(this::handlePingTimeout);
                }
            });
    }

    /**
     * Open the socket. Starts a fresh reconnect campaign. Ignored while a
     * socket is open or being opened.
     */
    public void connect() {
        post(() -> {
            ConnectionState current = state;
            if (current == ConnectionState.CONNECTING
                || current == ConnectionState.CONNECTED
                || current == ConnectionState.RECONNECTING) {
                log.warn("[KITE-WS] connect() ignored, connection is {}", current);
                return;
            }
            stopped = false;
            reconnectionPolicy.reset();
            reconnecting.set(false);
            cancelPendingAttempt();
            openConnection();
        });
    }

    /**
     * Close the socket normally and cancel any pending reconnect. The close
     * callback fires once the server acknowledges the close.
     *
     * @return completes once the connection is closed
     */
    public CompletableFuture<Void> stop() {
        CompletableFuture<Void> closed = new CompletableFuture<>();
        boolean posted = post(() -> {
            stopped = true;
            cancelPendingAttempt();
            heartbeat.stop();
            reconnecting.set(false);

            FeedConnection current = connection;
            if (current == null) {
                invalidate();
                state = ConnectionState.CLOSED;
                log.info("[KITE-WS] Stopped");
                closed.complete(null);
                return;
            }

            if (pendingClose != null) {
                pendingClose.whenComplete((ignored, error) -> closed.complete(null));
                return;
            }

            log.info("[KITE-WS] Closing connection");
            pendingClose = closed;
            int closingGeneration = generation;
            current.close(NORMAL_CLOSURE, "").whenComplete((ignored, error) -> {
                if (error != null) {
                    log.warn("[KITE-WS] Close handshake failed: {}", rootCause(error).getMessage());
                    post(() -> forceClose(closingGeneration));
                }
            });
            try {
                eventLoop.schedule(() -> forceClose(closingGeneration), connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("[KITE-WS] Event loop shutting down, close acknowledgement not awaited");
            }
        });
        if (!posted) {
            closed.complete(null);
        }
        return closed;
    }

    /**
     * Send a text message on the open socket.
     *
     * @throws FeedNotConnectedException if no socket is open
     */
    public CompletableFuture<Void> send(String text, String operation) {
        FeedConnection current = connection;
        ConnectionState currentState = state;
        if (current == null || currentState != ConnectionState.CONNECTED) {
            throw new FeedNotConnectedException(currentState, operation);
        }
        return current.sendText(text).whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("[KITE-WS] Failed to send {}: {}", operation, rootCause(error).getMessage());
            }
        });
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    public boolean isReconnecting() {
        return reconnecting.get();
    }

    public ConnectionState getState() {
        return state;
    }

    public Instant getLastBeatTime() {
        return heartbeat.getLastBeatTime();
    }

    public Instant getLastPongTime() {
        return heartbeat.getLastPongTime();
    }

    public int getReconnectAttempts() {
        return reconnectionPolicy.getAttemptCount();
    }

    // ════════════════════════════════════════════════════════════════════════
    // EVENT LOOP
    // ════════════════════════════════════════════════════════════════════════

    private void openConnection() {
        int openingGeneration = ++generation;
        state = reconnecting.get() ? ConnectionState.RECONNECTING : ConnectionState.CONNECTING;

        CompletableFuture<FeedConnection> opening;
        try {
            URI uri = endpoint.get();
            log.info("[KITE-WS] Connecting to {}://{}{} (generation {})",
                uri.getScheme(), uri.getHost(), uri.getPath(), openingGeneration);
            opening = transport.open(uri, connectTimeout, new GenerationListener(openingGeneration));
        } catch (RuntimeException e) {
            handleTransportError(openingGeneration, e);
            return;
        }

        opening.whenComplete((ignored, error) -> {
            if (error != null) {
                post(() -> handleTransportError(openingGeneration, rootCause(error)));
            }
        });
    }

    private void handleOpen(int eventGeneration, FeedConnection opened) {
        if (eventGeneration != generation || stopped) {
            log.debug("[KITE-WS] Dropping socket of generation {}", eventGeneration);
            opened.abort();
            return;
        }

        connection = opened;
        state = ConnectionState.CONNECTED;
        reconnectionPolicy.recordSuccess();
        reconnecting.set(false);
        metrics.recordConnectionEvent(FeedMetrics.ConnectionEvent.CONNECTED);
        log.info("[KITE-WS] Connected");

        heartbeat.start(() -> opened.sendPing().whenComplete((ignored, error) -> {
            if (error != null) {
                log.debug("[KITE-WS] Ping failed: {}", rootCause(error).getMessage());
            }
        }));

        notify("onConnected", listener::onConnected);
    }

    private void handleText(int eventGeneration, String text) {
        if (eventGeneration != generation) {
            return;
        }
        metrics.recordFrame(FeedMetrics.FRAME_TEXT);
        notify("onText", () -> listener.onText(text));
    }

    private void handleBinary(int eventGeneration, byte[] frame) {
        if (eventGeneration != generation) {
            return;
        }
        if (frame.length == 1) {
            heartbeat.recordBeat();
            metrics.recordFrame(FeedMetrics.FRAME_HEARTBEAT);
            return;
        }
        metrics.recordFrame(FeedMetrics.FRAME_TICKS);
        notify("onTickFrame", () -> listener.onTickFrame(frame));
    }

    private void handlePong(int eventGeneration) {
        if (eventGeneration == generation) {
            heartbeat.recordPong();
        }
    }

    private void handleTransportError(int eventGeneration, Throwable error) {
        if (eventGeneration != generation) {
            return;
        }
        invalidate();
        heartbeat.stop();

        FeedConnection current = connection;
        connection = null;
        if (current != null) {
            current.abort();
        }

        log.warn("[KITE-WS] Connection error: {}", error.getMessage());
        state = stopped ? ConnectionState.CLOSED : ConnectionState.DISCONNECTED;
        metrics.recordConnectionEvent(FeedMetrics.ConnectionEvent.ERROR);
        notify("onConnectError", () -> listener.onConnectError(error));
        completePendingClose();

        if (reconnectEnabled && !stopped) {
            reconnect();
        }
    }

    private void handleClose(int eventGeneration, int code, String reason) {
        if (eventGeneration != generation) {
            return;
        }
        invalidate();
        heartbeat.stop();
        connection = null;

        String closeReason = reason == null ? "" : reason;
        state = stopped ? ConnectionState.CLOSED : ConnectionState.DISCONNECTED;
        metrics.recordConnectionEvent(FeedMetrics.ConnectionEvent.DISCONNECTED);

        if (code != NORMAL_CLOSURE) {
            log.warn("[KITE-WS] Connection closed abnormally: {} - {}", code, closeReason);
            notify("onError", () -> listener.onError(code, closeReason));
        } else {
            log.info("[KITE-WS] Connection closed");
        }
        notify("onClose", () -> listener.onClose(code, closeReason));
        completePendingClose();

        if (code != NORMAL_CLOSURE && reconnectEnabled && !stopped && !reconnecting.get()) {
            reconnect();
        }
    }

    private void handlePingTimeout() {
        FeedConnection current = connection;
        if (current == null || state != ConnectionState.CONNECTED) {
            return;
        }
        log.warn("[KITE-WS] No pong within timeout, dropping connection");
        current.abort();
        handleClose(generation, ABNORMAL_CLOSURE, PING_TIMEOUT_REASON);
    }

    private void forceClose(int closingGeneration) {
        if (closingGeneration != generation || connection == null) {
            return;
        }
        log.warn("[KITE-WS] Server did not acknowledge close, aborting");
        connection.abort();
        handleClose(closingGeneration, NORMAL_CLOSURE, "");
    }

    private void reconnect() {
        reconnecting.set(true);

        if (!reconnectionPolicy.beginAttempt()) {
            log.error("[KITE-WS] Giving up after {} reconnect attempts", reconnectionPolicy.getMaxAttempts());
            reconnecting.set(false);
            state = ConnectionState.CLOSED;
            metrics.recordConnectionEvent(FeedMetrics.ConnectionEvent.RECONNECT_FAILED);
            notify("onReconnectFail", listener::onReconnectFail);
            return;
        }

        int attempt = reconnectionPolicy.getAttemptCount();
        Duration delay = reconnectionPolicy.nextDelay();
        state = ConnectionState.RECONNECTING;
        log.info("[KITE-WS] Reconnect attempt {}/{} in {}ms",
            attempt, reconnectionPolicy.getMaxAttempts(), delay.toMillis());

        pendingAttempt = eventLoop.schedule(() -> {
            pendingAttempt = null;
            if (stopped) {
                return;
            }
            metrics.recordReconnectAttempt(attempt);
            notify("onTryReconnect", () -> listener.onTryReconnect(attempt));
            openConnection();
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void cancelPendingAttempt() {
        if (pendingAttempt != null) {
            pendingAttempt.cancel(false);
            pendingAttempt = null;
        }
    }

    private void completePendingClose() {
        if (pendingClose != null) {
            pendingClose.complete(null);
            pendingClose = null;
        }
    }

    private void invalidate() {
        generation++;
    }

    private boolean post(Runnable task) {
        try {
            eventLoop.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("[KITE-WS] Event handling failed", e);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            log.debug("[KITE-WS] Event loop shut down, event dropped");
            return false;
        }
    }

    private void notify(String callback, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.error("[KITE-WS] {} callback threw exception", callback, e);
        }
    }

    private static Throwable rootCause(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Transport events of one socket, re-posted onto the event loop.
     */
    private final class GenerationListener implements TransportListener {
        private final int socketGeneration;

        GenerationListener(int socketGeneration) {
            this.socketGeneration = socketGeneration;
        }

        @Override
        public void onOpen(FeedConnection opened) {
            post(() -> handleOpen(socketGeneration, opened));
        }

        @Override
        public void onText(String text) {
            post(() -> handleText(socketGeneration, text));
        }

        @Override
        public void onBinary(byte[] data) {
            post(() -> handleBinary(socketGeneration, data));
        }

        @Override
        public void onPong() {
            post(() -> handlePong(socketGeneration));
        }

        @Override
        public void onClose(int code, String reason) {
            post(() -> handleClose(socketGeneration, code, reason));
        }

        @Override
        public void onError(Throwable error) {
            post(() -> handleTransportError(socketGeneration, error));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for ConnectionLifecycle.
     */
    public static class Builder {
        private FeedTransport transport;
        private ScheduledExecutorService eventLoop;
        private Supplier<URI> endpoint;
        private Listener listener;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration pingInterval = Duration.ofSeconds(3);
        private Duration pongTimeout = Duration.ofSeconds(10);
        private boolean reconnectEnabled = false;
        private ReconnectionPolicy reconnectionPolicy = ReconnectionPolicy.forTickerFeed();
        private FeedMetrics metrics = FeedMetrics.noop();

        public Builder transport(FeedTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Single-thread scheduler all events run on. Not shut down by the lifecycle.
         */
        public Builder eventLoop(ScheduledExecutorService eventLoop) {
            this.eventLoop = eventLoop;
            return this;
        }

        /**
         * Endpoint supplier, evaluated for every attempt so refreshed credentials apply.
         */
        public Builder endpoint(Supplier<URI> endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder listener(Listener listener) {
            this.listener = listener;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder pingInterval(Duration pingInterval) {
            this.pingInterval = pingInterval;
            return this;
        }

        /**
         * Only applies when reconnect is enabled.
         */
        public Builder pongTimeout(Duration pongTimeout) {
            this.pongTimeout = pongTimeout;
            return this;
        }

        public Builder reconnectEnabled(boolean reconnectEnabled) {
            this.reconnectEnabled = reconnectEnabled;
            return this;
        }

        public Builder reconnectionPolicy(ReconnectionPolicy reconnectionPolicy) {
            this.reconnectionPolicy = reconnectionPolicy;
            return this;
        }

        public Builder metrics(FeedMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public ConnectionLifecycle build() {
            Objects.requireNonNull(transport, "transport");
            Objects.requireNonNull(eventLoop, "eventLoop");
            Objects.requireNonNull(endpoint, "endpoint");
            Objects.requireNonNull(listener, "listener");
            Objects.requireNonNull(connectTimeout, "connectTimeout");
            Objects.requireNonNull(pingInterval, "pingInterval");
            Objects.requireNonNull(reconnectionPolicy, "reconnectionPolicy");
            Objects.requireNonNull(metrics, "metrics");
            return new ConnectionLifecycle(this);
        }
    }
}
