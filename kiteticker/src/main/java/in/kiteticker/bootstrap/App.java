package in.kiteticker.bootstrap;

import in.kiteticker.client.FeedClient;
import in.kiteticker.client.FeedConfig;
import in.kiteticker.domain.data.TickMode;
import in.kiteticker.infrastructure.feed.codec.TickJsonMapper;
import in.kiteticker.infrastructure.feed.connection.JdkWebSocketTransport;
import in.kiteticker.infrastructure.feed.metrics.PrometheusFeedMetrics;
import in.kiteticker.infrastructure.feed.metrics.PrometheusMetricsHandler;
import in.kiteticker.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Console ticker feed.
 *
 * Environment:
 * - KITE_API_KEY, KITE_ACCESS_TOKEN and the other FeedConfig variables
 * - KITE_TOKENS: comma separated instrument tokens to subscribe
 * - KITE_MODE: ltp, quote or full (default quote)
 * - METRICS_PORT: port of the /metrics endpoint (default 9091, 0 disables)
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);
    private static final Logger tickLog = LoggerFactory.getLogger("in.kiteticker.ticks");

    public static void main(String[] args) throws InterruptedException {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Kite Ticker Feed Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        FeedConfig config = FeedConfig.fromEnv();
        List<Long> tokens = parseTokens(Env.get("KITE_TOKENS", ""));
        TickMode mode = TickMode.fromWire(Env.get("KITE_MODE", TickMode.QUOTE.wireValue()));
        int metricsPort = Env.getInt("METRICS_PORT", 9091);

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusFeedMetrics metrics = new PrometheusFeedMetrics();
        Undertow metricsServer = null;
        if (metricsPort > 0) {
            metricsServer = Undertow.builder()
                .addHttpListener(metricsPort, "0.0.0.0")
                .setHandler(Handlers.path()
                    .addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry())))
                .build();
            metricsServer.start();
            log.info("✓ Prometheus /metrics endpoint on port {}", metricsPort);
        }

        // ═══════════════════════════════════════════════════════════════
        // Feed
        // ═══════════════════════════════════════════════════════════════
        FeedClient client = new FeedClient(config, new JdkWebSocketTransport(), metrics);
        CountDownLatch finished = new CountDownLatch(1);

        client.onConnect(() -> {
            log.info("✓ Connected, subscribing {} tokens in {} mode", tokens.size(), mode.wireValue());
            if (!tokens.isEmpty()) {
                client.subscribe(tokens);
                client.setMode(mode, tokens);
            }
        })
            .onTicks(ticks -> ticks.forEach(tick -> tickLog.info(TickJsonMapper.toJson(tick))))
            .onOrderUpdate(postback -> log.info("Order update: {} {} {}",
                postback.orderId(), postback.tradingSymbol(), postback.status()))
            .onMessage(message -> log.info("Server message: {}", message))
            .onError((code, reason) -> log.warn("Feed error {}: {}", code, reason))
            .onConnectError(error -> {
                log.warn("Connect error: {}", error.getMessage());
                if (!config.reconnectEnabled()) {
                    finished.countDown();
                }
            })
            .onTryReconnect(attempt -> log.info("Reconnect attempt {}", attempt))
            .onReconnectFail(() -> {
                log.error("Reconnect attempts exhausted, exiting");
                finished.countDown();
            })
            .onClose((code, reason) -> {
                log.info("Connection closed: {} {}", code, reason);
                if (!config.reconnectEnabled()) {
                    finished.countDown();
                }
            });

        Undertow serverToStop = metricsServer;
        AtomicBoolean stopped = new AtomicBoolean(false);
        Runnable shutdown = () -> {
            if (!stopped.compareAndSet(false, true)) {
                return;
            }
            log.info("Shutting down feed");
            client.shutdown();
            if (serverToStop != null) {
                serverToStop.stop();
            }
            finished.countDown();
        };
        Runtime.getRuntime().addShutdownHook(new Thread(shutdown, "kite-ticker-shutdown"));

        client.connect();
        finished.await();
        shutdown.run();
    }

    static List<Long> parseTokens(String value) {
        List<Long> tokens = new ArrayList<>();
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                tokens.add(Long.parseLong(trimmed));
            }
        }
        return tokens;
    }

    private App() {}
}
