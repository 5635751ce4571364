package in.kiteticker.client;

import in.kiteticker.infrastructure.feed.common.ReconnectionPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class FeedConfigTest {

    private static final String[] PROPERTIES = {
        "KITE_API_KEY", "KITE_ACCESS_TOKEN", "KITE_RECONNECT", "KITE_RECONNECT_MAX_TRIES",
        "KITE_RECONNECT_MAX_DELAY_SEC", "KITE_CONNECT_TIMEOUT_SEC", "KITE_MAX_INSTRUMENTS"
    };

    @AfterEach
    void tearDown() {
        for (String property : PROPERTIES) {
            System.clearProperty(property);
        }
    }

    @Test
    void testDefaults() {
        FeedConfig config = FeedConfig.builder("kitefront").build();

        assertEquals("kitefront", config.apiKey());
        assertNull(config.accessToken());
        assertEquals(FeedConfig.DEFAULT_URL_TEMPLATE, config.urlTemplate());
        assertEquals(Duration.ofSeconds(5), config.connectTimeout());
        assertFalse(config.reconnectEnabled());
        assertEquals(Duration.ofSeconds(2), config.initialReconnectDelay());
        assertEquals(Duration.ofSeconds(60), config.maxReconnectDelay());
        assertEquals(30, config.maxReconnectTries());
        assertEquals(Duration.ofSeconds(3), config.pingInterval());
        assertEquals(Duration.ofSeconds(10), config.pongTimeout());
        assertEquals(3000, config.maxInstruments());
    }

    @Test
    void testReconnectionPolicyFollowsSettings() {
        ReconnectionPolicy policy = FeedConfig.builder("kitefront")
            .initialReconnectDelay(Duration.ofSeconds(1))
            .maxReconnectDelay(Duration.ofSeconds(5))
            .maxReconnectTries(4)
            .build()
            .reconnectionPolicy();

        assertEquals(Duration.ofSeconds(1), policy.nextDelay());
        assertEquals(Duration.ofSeconds(2), policy.nextDelay());
        assertEquals(Duration.ofSeconds(4), policy.nextDelay());
        assertEquals(Duration.ofSeconds(5), policy.nextDelay(), "Capped at the max delay");
        assertEquals(4, policy.getMaxAttempts());
    }

    @Test
    void testInvalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> FeedConfig.builder(null));
        assertThrows(IllegalArgumentException.class, () -> FeedConfig.builder(" "));
        assertThrows(IllegalArgumentException.class,
            () -> FeedConfig.builder("k").urlTemplate("wss://ws.kite.trade/?api_key={api_key}"));
        assertThrows(IllegalArgumentException.class,
            () -> FeedConfig.builder("k").connectTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> FeedConfig.builder("k").maxReconnectTries(0));
        assertThrows(IllegalArgumentException.class,
            () -> FeedConfig.builder("k").maxInstruments(-1));
        assertThrows(IllegalArgumentException.class,
            () -> FeedConfig.builder("k").pongTimeout(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> FeedConfig.builder("k")
            .initialReconnectDelay(Duration.ofSeconds(10))
            .maxReconnectDelay(Duration.ofSeconds(5))
            .build());
    }

    @Test
    void testZeroPongTimeoutIsAllowed() {
        assertEquals(Duration.ZERO, FeedConfig.builder("k").pongTimeout(Duration.ZERO).build().pongTimeout());
    }

    @Test
    void testFromEnvReadsSystemProperties() {
        System.setProperty("KITE_API_KEY", "envkey");
        System.setProperty("KITE_ACCESS_TOKEN", "envtoken");
        System.setProperty("KITE_RECONNECT", "true");
        System.setProperty("KITE_RECONNECT_MAX_TRIES", "7");
        System.setProperty("KITE_RECONNECT_MAX_DELAY_SEC", "20");
        System.setProperty("KITE_MAX_INSTRUMENTS", "500");

        FeedConfig config = FeedConfig.fromEnv();

        assertEquals("envkey", config.apiKey());
        assertEquals("envtoken", config.accessToken());
        assertTrue(config.reconnectEnabled());
        assertEquals(7, config.maxReconnectTries());
        assertEquals(Duration.ofSeconds(20), config.maxReconnectDelay());
        assertEquals(500, config.maxInstruments());
    }

    @Test
    void testFromEnvRequiresApiKey() {
        if (System.getenv("KITE_API_KEY") != null) {
            return;
        }
        assertThrows(IllegalStateException.class, FeedConfig::fromEnv);
    }
}
