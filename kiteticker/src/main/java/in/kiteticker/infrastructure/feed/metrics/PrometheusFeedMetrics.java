package in.kiteticker.infrastructure.feed.metrics;

import in.kiteticker.domain.data.TickMode;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus implementation of FeedMetrics.
 *
 * Key Metrics:
 * - feed_frames_total{type} - Frames received (ticks, heartbeat, text)
 * - feed_ticks_total{mode} - Ticks decoded per mode
 * - feed_malformed_frames_total - Binary frames dropped as malformed
 * - feed_control_messages_total{type} - Text messages by wire type
 * - feed_connection_events_total{event} - Connection events
 * - feed_connection_status - Current status (1=connected, 0=disconnected)
 * - feed_reconnect_attempts_total - Automatic reconnect attempts
 * - feed_reconnect_attempt_number - Attempt number distribution within campaigns
 * - feed_subscribed_instruments - Instruments in the subscription registry
 *
 * Usage:
 * <pre>
 * PrometheusFeedMetrics metrics = new PrometheusFeedMetrics();
 * FeedClient client = new FeedClient(config, new JdkWebSocketTransport(), metrics);
 *
 * // Expose at /metrics endpoint
 * Undertow.builder().setHandler(new PrometheusMetricsHandler(metrics.getRegistry()))...
 * </pre>
 */
public class PrometheusFeedMetrics implements FeedMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusFeedMetrics.class);

    private final CollectorRegistry registry;

    // Frame metrics
    private final Counter frameCounter;
    private final Counter tickCounter;
    private final Counter malformedFrameCounter;
    private final Counter controlMessageCounter;

    // Connection metrics
    private final Counter connectionEventCounter;
    private final Gauge connectionStatus;
    private final Counter reconnectAttemptCounter;
    private final Histogram reconnectAttemptNumber;

    // Subscription metrics
    private final Gauge subscribedInstruments;

    public PrometheusFeedMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusFeedMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.frameCounter = Counter.build()
            .name("feed_frames_total")
            .help("Total number of frames received")
            .labelNames("type")
            .register(registry);

        this.tickCounter = Counter.build()
            .name("feed_ticks_total")
            .help("Total number of ticks decoded")
            .labelNames("mode")
            .register(registry);

        this.malformedFrameCounter = Counter.build()
            .name("feed_malformed_frames_total")
            .help("Total number of binary frames dropped as malformed")
            .register(registry);

        this.controlMessageCounter = Counter.build()
            .name("feed_control_messages_total")
            .help("Total number of control messages received")
            .labelNames("type")
            .register(registry);

        this.connectionEventCounter = Counter.build()
            .name("feed_connection_events_total")
            .help("Total number of connection events")
            .labelNames("event")
            .register(registry);

        this.connectionStatus = Gauge.build()
            .name("feed_connection_status")
            .help("Current connection status (1=connected, 0=disconnected)")
            .register(registry);

        this.reconnectAttemptCounter = Counter.build()
            .name("feed_reconnect_attempts_total")
            .help("Total number of automatic reconnect attempts")
            .register(registry);

        this.reconnectAttemptNumber = Histogram.build()
            .name("feed_reconnect_attempt_number")
            .help("Attempt number of each reconnect within its campaign")
            .buckets(1, 2, 3, 5, 10, 20, 30)
            .register(registry);

        this.subscribedInstruments = Gauge.build()
            .name("feed_subscribed_instruments")
            .help("Number of instruments currently subscribed")
            .register(registry);

        log.info("[FeedMetrics] Prometheus feed metrics initialized");
    }

    @Override
    public void recordFrame(String frameType) {
        frameCounter.labels(frameType).inc();
    }

    @Override
    public void recordTicks(TickMode mode, int count) {
        if (count > 0) {
            tickCounter.labels(mode.wireValue()).inc(count);
        }
    }

    @Override
    public void recordMalformedFrame() {
        malformedFrameCounter.inc();
    }

    @Override
    public void recordControlMessage(String messageType) {
        controlMessageCounter.labels(messageType).inc();
    }

    @Override
    public void recordConnectionEvent(ConnectionEvent event) {
        connectionEventCounter.labels(event.name()).inc();

        if (event == ConnectionEvent.CONNECTED) {
            connectionStatus.set(1);
        } else {
            connectionStatus.set(0);
        }
    }

    @Override
    public void recordReconnectAttempt(int attemptNumber) {
        reconnectAttemptCounter.inc();
        reconnectAttemptNumber.observe(attemptNumber);
    }

    @Override
    public void updateSubscribedInstruments(int count) {
        subscribedInstruments.set(count);
    }

    /**
     * Get Prometheus collector registry.
     * Use this to expose metrics at /metrics endpoint.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
