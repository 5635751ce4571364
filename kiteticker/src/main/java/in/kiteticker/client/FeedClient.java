package in.kiteticker.client;

import in.kiteticker.domain.data.Postback;
import in.kiteticker.domain.data.Tick;
import in.kiteticker.domain.data.TickMode;
import in.kiteticker.infrastructure.feed.codec.BinaryTickDecoder;
import in.kiteticker.infrastructure.feed.codec.ControlChannelCodec;
import in.kiteticker.infrastructure.feed.codec.ControlMessageException;
import in.kiteticker.infrastructure.feed.codec.ControlMessageHandler;
import in.kiteticker.infrastructure.feed.codec.MalformedFrameException;
import in.kiteticker.infrastructure.feed.connection.ConnectionLifecycle;
import in.kiteticker.infrastructure.feed.connection.ConnectionState;
import in.kiteticker.infrastructure.feed.connection.FeedNotConnectedException;
import in.kiteticker.infrastructure.feed.connection.FeedTransport;
import in.kiteticker.infrastructure.feed.connection.JdkWebSocketTransport;
import in.kiteticker.infrastructure.feed.metrics.FeedMetrics;
import in.kiteticker.infrastructure.feed.subscription.FeedSubscriptionException;
import in.kiteticker.infrastructure.feed.subscription.SubscriptionEntry;
import in.kiteticker.infrastructure.feed.subscription.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * Streaming client for the Kite ticker WebSocket.
 *
 * Features:
 * - Binary tick decoding for LTP, quote and full modes (indices included)
 * - Order updates and server messages from the text channel
 * - Subscriptions remembered and restored with their modes after every reconnect
 * - Optional automatic reconnect with exponential backoff
 * - Heartbeat and pong tracking
 *
 * All callbacks run on a single event thread ("kite-ticker-events"), in the order
 * the server sent the frames. Callbacks should not block; a slow callback delays
 * every later frame.
 *
 * Usage:
 * <pre>
 * FeedClient client = new FeedClient(FeedConfig.builder(apiKey)
 *     .accessToken(accessToken)
 *     .reconnectEnabled(true)
 *     .build());
 *
 * client.onConnect(() -> {
 *     client.subscribe(List.of(408065L));
 *     client.setMode(TickMode.FULL, List.of(408065L));
 * });
 * client.onTicks(ticks -> ticks.forEach(System.out::println));
 * client.connect();
 * ...
 * client.shutdown();
 * </pre>
 */
public class FeedClient {
    private static final Logger log = LoggerFactory.getLogger(FeedClient.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(1);

    static final String EVENT_THREAD_NAME = "kite-ticker-events";

    private final FeedConfig config;
    private final String apiKey;
    private volatile String accessToken;

    private final FeedMetrics metrics;
    private final SubscriptionRegistry registry;
    private final BinaryTickDecoder decoder = new BinaryTickDecoder();
    private final ControlChannelCodec codec = new ControlChannelCodec();
    private final FeedCallbacks callbacks = new FeedCallbacks();
    private final ScheduledThreadPoolExecutor eventLoop;
    private final ConnectionLifecycle lifecycle;

    public FeedClient(FeedConfig config) {
        this(config, new JdkWebSocketTransport(), FeedMetrics.noop());
    }

    public FeedClient(FeedConfig config, FeedTransport transport, FeedMetrics metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.apiKey = config.apiKey();
        this.accessToken = config.accessToken();
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.registry = new SubscriptionRegistry(config.maxInstruments());

        this.eventLoop = new ScheduledThreadPoolExecutor(1, r -> {
            Thread thread = new Thread(r, EVENT_THREAD_NAME);
            thread.setDaemon(true);
            return thread;
        });
        this.eventLoop.setRemoveOnCancelPolicy(true);
        this.eventLoop.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);

        this.lifecycle = ConnectionLifecycle.builder()
            .transport(Objects.requireNonNull(transport, "transport"))
            .eventLoop(eventLoop)
            .endpoint(this::endpoint)
            .listener(new LifecycleEvents())
            .connectTimeout(config.connectTimeout())
            .pingInterval(config.pingInterval())
            .pongTimeout(config.pongTimeout())
            .reconnectEnabled(config.reconnectEnabled())
            .reconnectionPolicy(config.reconnectionPolicy())
            .metrics(metrics)
            .build();

        log.info("[KITE-WS] Client created for apiKey={} (reconnect={}, maxTries={}, maxInstruments={})",
            maskKey(apiKey), config.reconnectEnabled(), config.maxReconnectTries(), config.maxInstruments());
    }

    // ════════════════════════════════════════════════════════════════════════
    // CALLBACKS
    // ════════════════════════════════════════════════════════════════════════

    /** Called after every successful (re)connection, once subscriptions are restored. */
    public FeedClient onConnect(Runnable callback) {
        callbacks.onConnect = callback;
        return this;
    }

    public FeedClient onTicks(Consumer<List<Tick>> callback) {
        callbacks.onTicks = callback;
        return this;
    }

    public FeedClient onOrderUpdate(Consumer<Postback> callback) {
        callbacks.onOrderUpdate = callback;
        return this;
    }

    /** Raw text of "message" type control messages. */
    public FeedClient onMessage(Consumer<String> callback) {
        callbacks.onMessage = callback;
        return this;
    }

    /** Abnormal closes (with their close code) and server errors (code 0). */
    public FeedClient onError(StatusHandler callback) {
        callbacks.onError = callback;
        return this;
    }

    /** Failed handshakes and transport errors. */
    public FeedClient onConnectError(Consumer<Throwable> callback) {
        callbacks.onConnectError = callback;
        return this;
    }

    /** Called with the attempt number before each automatic reconnect attempt. */
    public FeedClient onTryReconnect(IntConsumer callback) {
        callbacks.onTryReconnect = callback;
        return this;
    }

    /** Called once when all reconnect attempts failed. */
    public FeedClient onReconnectFail(Runnable callback) {
        callbacks.onReconnectFail = callback;
        return this;
    }

    public FeedClient onClose(StatusHandler callback) {
        callbacks.onClose = callback;
        return this;
    }

    // ════════════════════════════════════════════════════════════════════════
    // CONNECTION
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Connect asynchronously. The connect callback (or connect-error callback) reports the outcome.
     *
     * @throws IllegalStateException if no access token is set
     */
    public void connect() {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalStateException("Access token not set");
        }
        if (eventLoop.isShutdown()) {
            throw new IllegalStateException("Client has been shut down");
        }
        lifecycle.connect();
    }

    /**
     * Close the connection normally. Automatic reconnection stops; subscriptions are kept
     * and restored by the next {@link #connect()}.
     */
    public void stop() {
        lifecycle.stop();
    }

    /**
     * Stop and release the event thread. The client cannot be reconnected afterwards.
     */
    public void shutdown() {
        try {
            // The lifecycle aborts after connectTimeout without a close ack; wait past that deadline
            Duration wait = config.connectTimeout().plus(SHUTDOWN_GRACE);
            lifecycle.stop().get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[KITE-WS] Connection did not close cleanly: {}", e.toString());
        }

        eventLoop.shutdown();
        try {
            if (!eventLoop.awaitTermination(5, TimeUnit.SECONDS)) {
                eventLoop.shutdownNow();
            }
        } catch (InterruptedException e) {
            eventLoop.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[KITE-WS] Client shut down");
    }

    public boolean isConnected() {
        return lifecycle.isConnected();
    }

    public boolean isReconnecting() {
        return lifecycle.isReconnecting();
    }

    public ConnectionState getState() {
        return lifecycle.getState();
    }

    /**
     * @return time of the last heartbeat frame or pong, or null if neither arrived yet
     */
    public Instant getLastBeatTime() {
        return lifecycle.getLastBeatTime();
    }

    /**
     * @return time of the last pong, or null until the first pong arrives
     */
    public Instant getLastPongTime() {
        return lifecycle.getLastPongTime();
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getAccessToken() {
        return accessToken;
    }

    /**
     * Replace the access token. Takes effect on the next connection attempt.
     */
    public void setAccessToken(String accessToken) {
        this.accessToken = accessToken;
    }

    // ════════════════════════════════════════════════════════════════════════
    // SUBSCRIPTIONS
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Subscribe to instruments. They stream in the server's default mode (quote)
     * until {@link #setMode(TickMode, Collection)} is called.
     *
     * @throws FeedNotConnectedException if not connected; nothing is recorded
     * @throws FeedSubscriptionException if the instrument limit would be exceeded
     */
    public void subscribe(Collection<Long> tokens) {
        requireConnected("subscribe");
        if (tokens.isEmpty()) {
            return;
        }
        registry.addChecked(tokens, null, () -> lifecycle.send(codec.subscribe(tokens), "subscribe"));
        metrics.updateSubscribedInstruments(registry.size());
        log.info("[KITE-WS] Subscribed {} tokens (total={})", tokens.size(), registry.size());
    }

    /**
     * @throws FeedNotConnectedException if not connected; nothing is removed
     */
    public void unsubscribe(Collection<Long> tokens) {
        requireConnected("unsubscribe");
        if (tokens.isEmpty()) {
            return;
        }
        lifecycle.send(codec.unsubscribe(tokens), "unsubscribe");
        registry.remove(tokens);
        metrics.updateSubscribedInstruments(registry.size());
        log.info("[KITE-WS] Unsubscribed {} tokens (total={})", tokens.size(), registry.size());
    }

    /**
     * Change the streaming mode of instruments. The mode is remembered for resubscription.
     *
     * @throws FeedNotConnectedException if not connected; nothing is recorded
     * @throws FeedSubscriptionException if the instrument limit would be exceeded
     */
    public void setMode(TickMode mode, Collection<Long> tokens) {
        Objects.requireNonNull(mode, "mode");
        requireConnected("mode");
        if (tokens.isEmpty()) {
            return;
        }
        registry.setModeChecked(mode, tokens, () -> lifecycle.send(codec.mode(mode, tokens), "mode"));
        metrics.updateSubscribedInstruments(registry.size());
        log.info("[KITE-WS] Set mode {} for {} tokens", mode.wireValue(), tokens.size());
    }

    /**
     * @return snapshot of the subscriptions that are restored on reconnect
     */
    public List<SubscriptionEntry> getSubscriptions() {
        return registry.entries();
    }

    private void requireConnected(String operation) {
        if (!lifecycle.isConnected()) {
            throw new FeedNotConnectedException(lifecycle.getState(), operation);
        }
    }

    private void resubscribe() {
        if (registry.isEmpty()) {
            return;
        }

        Map<TickMode, List<Long>> groups = registry.groupByMode();
        for (Map.Entry<TickMode, List<Long>> group : groups.entrySet()) {
            if (group.getValue().isEmpty()) {
                continue;
            }
            lifecycle.send(codec.mode(group.getKey(), group.getValue()), "resubscribe");
            log.info("[KITE-WS] Resubscribed {} tokens in {} mode", group.getValue().size(), group.getKey().wireValue());
        }
    }

    private URI endpoint() {
        String token = accessToken;
        if (token == null || token.isBlank()) {
            throw new IllegalStateException("Access token not set");
        }
        String url = config.urlTemplate()
            .replace(FeedConfig.API_KEY_PLACEHOLDER, URLEncoder.encode(apiKey, StandardCharsets.UTF_8))
            .replace(FeedConfig.ACCESS_TOKEN_PLACEHOLDER, URLEncoder.encode(token, StandardCharsets.UTF_8));
        return URI.create(url);
    }

    private static String maskKey(String key) {
        if (key == null || key.length() < 8)
            return "***";
        return key.substring(0, 4) + "****" + key.substring(key.length() - 4);
    }

    // ════════════════════════════════════════════════════════════════════════
    // EVENT THREAD
    // ════════════════════════════════════════════════════════════════════════

    private void handleTickFrame(byte[] frame) {
        List<Tick> ticks;
        try {
            ticks = decoder.decode(frame);
        } catch (MalformedFrameException e) {
            log.warn("[KITE-WS] Dropping frame: {}", e.getMessage());
            metrics.recordMalformedFrame();
            return;
        }
        if (ticks.isEmpty()) {
            return;
        }

        Map<TickMode, Integer> counts = new EnumMap<>(TickMode.class);
        for (Tick tick : ticks) {
            counts.merge(tick.mode(), 1, Integer::sum);
        }
        counts.forEach(metrics::recordTicks);

        callbacks.fireTicks(ticks);
    }

    private void handleText(String text) {
        try {
            ControlChannelCodec.MessageType type = codec.dispatch(text, new ControlEvents());
            metrics.recordControlMessage(type.wireValue());
        } catch (ControlMessageException e) {
            log.warn("[KITE-WS] Unusable control message: {}", e.getMessage());
            metrics.recordControlMessage("invalid");
            callbacks.fireError(0, e.getMessage());
        }
    }

    private final class ControlEvents implements ControlMessageHandler {

        @Override
        public void onOrderUpdate(Postback postback) {
            log.debug("[KITE-WS] Order update {} {}", postback.orderId(), postback.status());
            callbacks.fireOrderUpdate(postback);
        }

        @Override
        public void onMessage(String raw) {
            callbacks.fireMessage(raw);
        }

        @Override
        public void onError(int code, String message) {
            log.warn("[KITE-WS] Server error: {}", message);
            callbacks.fireError(code, message);
        }
    }

    private final class LifecycleEvents implements ConnectionLifecycle.Listener {

        @Override
        public void onConnected() {
            try {
                resubscribe();
            } catch (RuntimeException e) {
                log.error("[KITE-WS] Failed to restore subscriptions", e);
            }
            callbacks.fireConnect();
        }

        @Override
        public void onText(String text) {
            handleText(text);
        }

        @Override
        public void onTickFrame(byte[] frame) {
            handleTickFrame(frame);
        }

        @Override
        public void onConnectError(Throwable error) {
            callbacks.fireConnectError(error);
        }

        @Override
        public void onError(int code, String reason) {
            callbacks.fireError(code, reason);
        }

        @Override
        public void onClose(int code, String reason) {
            callbacks.fireClose(code, reason);
        }

        @Override
        public void onTryReconnect(int attempt) {
            callbacks.fireTryReconnect(attempt);
        }

        @Override
        public void onReconnectFail() {
            callbacks.fireReconnectFail();
        }
    }
}
