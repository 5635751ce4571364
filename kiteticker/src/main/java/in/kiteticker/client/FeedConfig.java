package in.kiteticker.client;

import in.kiteticker.infrastructure.feed.common.ReconnectionPolicy;
import in.kiteticker.infrastructure.feed.subscription.SubscriptionRegistry;
import in.kiteticker.util.Env;

import java.time.Duration;

/**
 * Immutable settings of a {@link FeedClient}.
 *
 * The access token may be left out and supplied later with
 * {@link FeedClient#setAccessToken(String)}, but must be known before connecting.
 *
 * @param urlTemplate endpoint with {@code {api_key}} and {@code {access_token}} placeholders
 */
public record FeedConfig(
    String apiKey,
    String accessToken,
    String urlTemplate,
    Duration connectTimeout,
    boolean reconnectEnabled,
    Duration initialReconnectDelay,
    Duration maxReconnectDelay,
    int maxReconnectTries,
    Duration pingInterval,
    Duration pongTimeout,
    int maxInstruments
) {
    public static final String DEFAULT_URL_TEMPLATE =
        "wss://ws.kite.trade/?api_key={api_key}&access_token={access_token}";
    public static final String API_KEY_PLACEHOLDER = "{api_key}";
    public static final String ACCESS_TOKEN_PLACEHOLDER = "{access_token}";

    /**
     * Reconnect backoff derived from this configuration.
     */
    public ReconnectionPolicy reconnectionPolicy() {
        return ReconnectionPolicy.builder()
            .initialDelay(initialReconnectDelay)
            .maxDelay(maxReconnectDelay)
            .maxAttempts(maxReconnectTries)
            .build();
    }

    /**
     * Read the configuration from environment variables (or system properties):
     * KITE_API_KEY (required), KITE_ACCESS_TOKEN, KITE_WS_URL, KITE_CONNECT_TIMEOUT_SEC,
     * KITE_RECONNECT, KITE_RECONNECT_MAX_DELAY_SEC, KITE_RECONNECT_MAX_TRIES, KITE_MAX_INSTRUMENTS.
     */
    public static FeedConfig fromEnv() {
        Builder builder = builder(Env.require("KITE_API_KEY"))
            .accessToken(Env.get("KITE_ACCESS_TOKEN", null))
            .urlTemplate(Env.get("KITE_WS_URL", DEFAULT_URL_TEMPLATE))
            .connectTimeout(Env.getSeconds("KITE_CONNECT_TIMEOUT_SEC", Builder.DEFAULT_CONNECT_TIMEOUT))
            .reconnectEnabled(Env.getBool("KITE_RECONNECT", false))
            .maxReconnectDelay(Env.getSeconds("KITE_RECONNECT_MAX_DELAY_SEC", Builder.DEFAULT_MAX_RECONNECT_DELAY))
            .maxReconnectTries(Env.getInt("KITE_RECONNECT_MAX_TRIES", Builder.DEFAULT_MAX_RECONNECT_TRIES))
            .maxInstruments(Env.getInt("KITE_MAX_INSTRUMENTS", SubscriptionRegistry.DEFAULT_MAX_INSTRUMENTS));
        return builder.build();
    }

    public static Builder builder(String apiKey) {
        return new Builder(apiKey);
    }

    /**
     * Builder for FeedConfig.
     */
    public static class Builder {
        static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
        static final Duration DEFAULT_INITIAL_RECONNECT_DELAY = Duration.ofSeconds(2);
        static final Duration DEFAULT_MAX_RECONNECT_DELAY = Duration.ofSeconds(60);
        static final int DEFAULT_MAX_RECONNECT_TRIES = 30;
        static final Duration DEFAULT_PING_INTERVAL = Duration.ofSeconds(3);
        static final Duration DEFAULT_PONG_TIMEOUT = Duration.ofSeconds(10);

        private final String apiKey;
        private String accessToken;
        private String urlTemplate = DEFAULT_URL_TEMPLATE;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private boolean reconnectEnabled = false;
        private Duration initialReconnectDelay = DEFAULT_INITIAL_RECONNECT_DELAY;
        private Duration maxReconnectDelay = DEFAULT_MAX_RECONNECT_DELAY;
        private int maxReconnectTries = DEFAULT_MAX_RECONNECT_TRIES;
        private Duration pingInterval = DEFAULT_PING_INTERVAL;
        private Duration pongTimeout = DEFAULT_PONG_TIMEOUT;
        private int maxInstruments = SubscriptionRegistry.DEFAULT_MAX_INSTRUMENTS;

        private Builder(String apiKey) {
            if (apiKey == null || apiKey.isBlank()) {
                throw new IllegalArgumentException("API key is required");
            }
            this.apiKey = apiKey;
        }

        public Builder accessToken(String accessToken) {
            this.accessToken = accessToken;
            return this;
        }

        public Builder urlTemplate(String urlTemplate) {
            if (urlTemplate == null || !urlTemplate.contains(API_KEY_PLACEHOLDER)
                || !urlTemplate.contains(ACCESS_TOKEN_PLACEHOLDER)) {
                throw new IllegalArgumentException(
                    "URL template must contain " + API_KEY_PLACEHOLDER + " and " + ACCESS_TOKEN_PLACEHOLDER);
            }
            this.urlTemplate = urlTemplate;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = requirePositive(connectTimeout, "Connect timeout");
            return this;
        }

        public Builder reconnectEnabled(boolean reconnectEnabled) {
            this.reconnectEnabled = reconnectEnabled;
            return this;
        }

        public Builder initialReconnectDelay(Duration initialReconnectDelay) {
            this.initialReconnectDelay = requirePositive(initialReconnectDelay, "Initial reconnect delay");
            return this;
        }

        public Builder maxReconnectDelay(Duration maxReconnectDelay) {
            this.maxReconnectDelay = requirePositive(maxReconnectDelay, "Max reconnect delay");
            return this;
        }

        public Builder maxReconnectTries(int maxReconnectTries) {
            if (maxReconnectTries <= 0) {
                throw new IllegalArgumentException("Max reconnect tries must be positive");
            }
            this.maxReconnectTries = maxReconnectTries;
            return this;
        }

        public Builder pingInterval(Duration pingInterval) {
            this.pingInterval = requirePositive(pingInterval, "Ping interval");
            return this;
        }

        /**
         * {@link Duration#ZERO} disables the pong timeout.
         */
        public Builder pongTimeout(Duration pongTimeout) {
            if (pongTimeout == null || pongTimeout.isNegative()) {
                throw new IllegalArgumentException("Pong timeout cannot be negative");
            }
            this.pongTimeout = pongTimeout;
            return this;
        }

        public Builder maxInstruments(int maxInstruments) {
            if (maxInstruments <= 0) {
                throw new IllegalArgumentException("Max instruments must be positive");
            }
            this.maxInstruments = maxInstruments;
            return this;
        }

        public FeedConfig build() {
            if (initialReconnectDelay.compareTo(maxReconnectDelay) > 0) {
                throw new IllegalArgumentException("Initial reconnect delay cannot exceed max reconnect delay");
            }
            return new FeedConfig(apiKey, accessToken, urlTemplate, connectTimeout, reconnectEnabled,
                initialReconnectDelay, maxReconnectDelay, maxReconnectTries, pingInterval, pongTimeout,
                maxInstruments);
        }

        private static Duration requirePositive(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
