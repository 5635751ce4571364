package in.kiteticker.infrastructure.feed.connection;

import in.kiteticker.infrastructure.feed.common.ReconnectionPolicy;
import in.kiteticker.infrastructure.feed.connection.FakeFeedTransport.FakeConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConnectionLifecycle against an in-memory transport.
 *
 * Tests:
 * - Open, text, binary and heartbeat frames
 * - Close codes and reconnect decisions
 * - Reconnect budget and give-up
 * - Stop, stale sockets and ping timeout
 */
class ConnectionLifecycleTest {

    private static final URI ENDPOINT = URI.create("wss://ws.example.test/?api_key=key&access_token=token");

    private ScheduledExecutorService eventLoop;
    private FakeFeedTransport transport;
    private RecordingListener events;
    private ConnectionLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        eventLoop = Executors.newSingleThreadScheduledExecutor();
        transport = new FakeFeedTransport();
        events = new RecordingListener();
    }

    @AfterEach
    void tearDown() {
        eventLoop.shutdownNow();
    }

    private ConnectionLifecycle build(boolean reconnect, int maxTries, Duration initialDelay) {
        return ConnectionLifecycle.builder()
            .transport(transport)
            .eventLoop(eventLoop)
            .endpoint(() -> ENDPOINT)
            .listener(events)
            .reconnectEnabled(reconnect)
            .reconnectionPolicy(ReconnectionPolicy.builder()
                .initialDelay(initialDelay)
                .maxDelay(initialDelay.multipliedBy(4))
                .maxAttempts(maxTries)
                .build())
            .build();
    }

    @Test
    void testConnectOpensSocket() throws Exception {
        lifecycle = build(false, 3, Duration.ofMillis(10));

        lifecycle.connect();
        FakeFeedTransport.PendingOpen pending = transport.awaitOpen();
        assertEquals(ENDPOINT, pending.getEndpoint());
        pending.accept();

        events.expect("connected");
        assertTrue(lifecycle.isConnected());
        assertEquals(ConnectionState.CONNECTED, lifecycle.getState());
        assertFalse(lifecycle.isReconnecting());
    }

    @Test
    void testConnectWhileConnectedIsIgnored() throws Exception {
        lifecycle = build(false, 3, Duration.ofMillis(10));
        lifecycle.connect();
        transport.acceptNext();
        events.expect("connected");

        lifecycle.connect();
        Thread.sleep(50);

        assertEquals(1, transport.getOpenCount());
    }

    @Test
    void testFramesAreForwarded() throws Exception {
        lifecycle = build(false, 3, Duration.ofMillis(10));
        lifecycle.connect();
        FakeConnection connection = transport.acceptNext();
        events.expect("connected");

        connection.serverText("{\"type\":\"message\",\"data\":\"hi\"}");
        connection.serverBinary(new byte[10]);

        events.expect("text:{\"type\":\"message\",\"data\":\"hi\"}");
        events.expect("frame:10");
    }

    @Test
    void testHeartbeatFrameUpdatesBeatTime() throws Exception {
        lifecycle = build(false, 3, Duration.ofMillis(10));
        lifecycle.connect();
        FakeConnection connection = transport.acceptNext();
        events.expect("connected");
        assertNull(lifecycle.getLastBeatTime());

        connection.serverBinary(new byte[] {0});
        connection.serverBinary(new byte[4]);

        events.expect("frame:4");
        assertNotNull(lifecycle.getLastBeatTime(), "1-byte frame is a heartbeat");
    }

    @Test
    void testSendRequiresOpenSocket() throws Exception {
        lifecycle = build(false, 3, Duration.ofMillis(10));

        FeedNotConnectedException e = assertThrows(FeedNotConnectedException.class,
            () -> lifecycle.send("{}", "subscribe"));
        assertEquals(ConnectionState.DISCONNECTED, e.getState());

        lifecycle.connect();
        FakeConnection connection = transport.acceptNext();
        events.expect("connected");

        lifecycle.send("{\"a\":\"subscribe\",\"v\":[1]}", "subscribe").get(1, TimeUnit.SECONDS);
        assertEquals(1, connection.getSent().size());
    }

    @Test
    void testNormalCloseDoesNotReconnect() throws Exception {
        lifecycle = build(true, 3, Duration.ofMillis(10));
        lifecycle.connect();
        FakeConnection connection = transport.acceptNext();
        events.expect("connected");

        connection.serverClose(1000, "bye");

        events.expect("close:1000:bye");
        Thread.sleep(100);
        events.expectNothing();
        assertEquals(1, transport.getOpenCount());
        assertEquals(ConnectionState.DISCONNECTED, lifecycle.getState());
    }

    @Test
    void testAbnormalCloseReconnects() throws Exception {
        lifecycle = build(true, 3, Duration.ofMillis(10));
        lifecycle.connect();
        FakeConnection first = transport.acceptNext();
        events.expect("connected");

        first.serverClose(1006, "gone");

        events.expect("error:1006:gone");
        events.expect("close:1006:gone");
        events.expect("try:1");
        transport.acceptNext();
        events.expect("connected");
        assertFalse(lifecycle.isReconnecting());
        assertEquals(0, lifecycle.getReconnectAttempts(), "Success resets the campaign");
    }

    @Test
    void testAbnormalCloseWithoutReconnect() throws Exception {
        lifecycle = build(false, 3, Duration.ofMillis(10));
        lifecycle.connect();
        FakeConnection connection = transport.acceptNext();
        events.expect("connected");

        connection.serverClose(1011, "internal");

        events.expect("error:1011:internal");
        events.expect("close:1011:internal");
        Thread.sleep(50);
        events.expectNothing();
        assertEquals(ConnectionState.DISCONNECTED, lifecycle.getState());
    }

    @Test
    void testGivesUpAfterMaxTries() throws Exception {
        transport.refuseConnections(true);
        lifecycle = build(true, 3, Duration.ofMillis(10));

        lifecycle.connect();

        events.expect("connectError:Connection refused");
        events.expect("try:1");
        events.expect("connectError:Connection refused");
        events.expect("try:2");
        events.expect("connectError:Connection refused");
        events.expect("try:3");
        events.expect("connectError:Connection refused");
        events.expect("reconnectFail");
        Thread.sleep(100);
        events.expectNothing();

        assertEquals(4, transport.getOpenCount(), "Initial attempt plus three retries");
        assertEquals(ConnectionState.CLOSED, lifecycle.getState());
        assertFalse(lifecycle.isReconnecting());
    }

    @Test
    void testConnectErrorWithoutReconnect() throws Exception {
        transport.refuseConnections(true);
        lifecycle = build(false, 3, Duration.ofMillis(10));

        lifecycle.connect();

        events.expect("connectError:Connection refused");
        Thread.sleep(50);
        events.expectNothing();
        assertEquals(ConnectionState.DISCONNECTED, lifecycle.getState());
    }

    @Test
    void testErrorOnLiveSocketAbortsAndReconnects() throws Exception {
        lifecycle = build(true, 3, Duration.ofMillis(10));
        lifecycle.connect();
        FakeConnection connection = transport.acceptNext();
        events.expect("connected");

        connection.serverError(new IOException("reset by peer"));

        events.expect("connectError:reset by peer");
        events.expect("try:1");
        assertTrue(connection.isAborted());
    }

    @Test
    void testConnectAfterGivingUpStartsFreshCampaign() throws Exception {
        transport.refuseConnections(true);
        lifecycle = build(true, 1, Duration.ofMillis(10));
        lifecycle.connect();
        events.expect("connectError:Connection refused");
        events.expect("try:1");
        events.expect("connectError:Connection refused");
        events.expect("reconnectFail");
        transport.awaitOpen();
        transport.awaitOpen();

        transport.refuseConnections(false);
        lifecycle.connect();
        transport.acceptNext();

        events.expect("connected");
    }

    @Test
    void testStopClosesNormally() throws Exception {
        lifecycle = build(true, 3, Duration.ofMillis(10));
        lifecycle.connect();
        FakeConnection connection = transport.acceptNext();
        events.expect("connected");

        lifecycle.stop().get(2, TimeUnit.SECONDS);

        assertEquals(1000, connection.getCloseCode());
        events.expect("close:1000:");
        assertEquals(ConnectionState.CLOSED, lifecycle.getState());
        assertFalse(lifecycle.isConnected());
        assertThrows(FeedNotConnectedException.class, () -> lifecycle.send("{}", "subscribe"));
    }

    @Test
    void testStopCancelsPendingReconnect() throws Exception {
        lifecycle = build(true, 3, Duration.ofMillis(200));
        lifecycle.connect();
        FakeConnection connection = transport.acceptNext();
        events.expect("connected");

        connection.serverClose(1006, "");
        events.expect("error:1006:");
        events.expect("close:1006:");
        Thread.sleep(50);
        assertTrue(lifecycle.isReconnecting());
        assertEquals(ConnectionState.RECONNECTING, lifecycle.getState());

        lifecycle.stop().get(2, TimeUnit.SECONDS);
        Thread.sleep(400);

        events.expectNothing();
        assertEquals(1, transport.getOpenCount());
        assertEquals(ConnectionState.CLOSED, lifecycle.getState());
        assertFalse(lifecycle.isReconnecting());
    }

    @Test
    void testEventsOfReplacedSocketAreIgnored() throws Exception {
        lifecycle = build(true, 3, Duration.ofMillis(10));
        lifecycle.connect();
        FakeConnection first = transport.acceptNext();
        events.expect("connected");
        first.serverClose(1006, "");
        events.expect("error:1006:");
        events.expect("close:1006:");
        events.expect("try:1");
        FakeConnection second = transport.acceptNext();
        events.expect("connected");

        first.serverText("late");
        first.serverClose(1006, "late");
        second.serverText("current");

        events.expect("text:current");
        assertTrue(lifecycle.isConnected());
    }

    @Test
    void testPingTimeoutDropsConnection() throws Exception {
        lifecycle = ConnectionLifecycle.builder()
            .transport(transport)
            .eventLoop(eventLoop)
            .endpoint(() -> ENDPOINT)
            .listener(events)
            .reconnectEnabled(true)
            .pingInterval(Duration.ofMillis(20))
            .pongTimeout(Duration.ofMillis(80))
            .reconnectionPolicy(ReconnectionPolicy.builder()
                .initialDelay(Duration.ofMillis(10))
                .maxDelay(Duration.ofMillis(40))
                .maxAttempts(3)
                .build())
            .build();
        lifecycle.connect();
        FakeConnection connection = transport.acceptNext();
        events.expect("connected");

        events.expect("error:1006:ping timed out");
        events.expect("close:1006:ping timed out");
        events.expect("try:1");
        assertTrue(connection.isAborted());
        assertTrue(connection.getPingCount() > 0);
    }

    @Test
    void testPongsKeepConnectionAlive() throws Exception {
        lifecycle = ConnectionLifecycle.builder()
            .transport(transport)
            .eventLoop(eventLoop)
            .endpoint(() -> ENDPOINT)
            .listener(events)
            .reconnectEnabled(true)
            .pingInterval(Duration.ofMillis(20))
            .pongTimeout(Duration.ofMillis(100))
            .build();
        lifecycle.connect();
        FakeConnection connection = transport.awaitOpen().accept();
        connection.setAutoPong(true);
        events.expect("connected");

        Thread.sleep(300);

        events.expectNothing();
        assertTrue(lifecycle.isConnected());
        assertNotNull(lifecycle.getLastPongTime());
    }

    @Test
    void testPongsAdvanceBeatTime() throws Exception {
        lifecycle = ConnectionLifecycle.builder()
            .transport(transport)
            .eventLoop(eventLoop)
            .endpoint(() -> ENDPOINT)
            .listener(events)
            .reconnectEnabled(false)
            .pingInterval(Duration.ofMillis(20))
            .build();
        lifecycle.connect();
        FakeConnection connection = transport.awaitOpen().accept();
        connection.setAutoPong(true);
        events.expect("connected");

        Thread.sleep(100);
        Instant first = lifecycle.getLastBeatTime();
        assertNotNull(first, "Pongs count as heartbeats without any 1-byte frame");

        Thread.sleep(100);
        assertTrue(lifecycle.getLastBeatTime().isAfter(first), "Every pong moves the heartbeat time");
        assertNotNull(lifecycle.getLastPongTime());
    }

    /**
     * Records lifecycle callbacks as strings in arrival order.
     */
    static final class RecordingListener implements ConnectionLifecycle.Listener {
        private final BlockingQueue<String> received = new LinkedBlockingQueue<>();

        void expect(String event) throws InterruptedException {
            String next = received.poll(2, TimeUnit.SECONDS);
            assertEquals(event, next);
        }

        void expectNothing() {
            assertNull(received.poll(), "Unexpected event");
        }

        @Override
        public void onConnected() {
            received.add("connected");
        }

        @Override
        public void onText(String text) {
            received.add("text:" + text);
        }

        @Override
        public void onTickFrame(byte[] frame) {
            received.add("frame:" + frame.length);
        }

        @Override
        public void onConnectError(Throwable error) {
            received.add("connectError:" + error.getMessage());
        }

        @Override
        public void onError(int code, String reason) {
            received.add("error:" + code + ":" + reason);
        }

        @Override
        public void onClose(int code, String reason) {
            received.add("close:" + code + ":" + reason);
        }

        @Override
        public void onTryReconnect(int attempt) {
            received.add("try:" + attempt);
        }

        @Override
        public void onReconnectFail() {
            received.add("reconnectFail");
        }
    }
}
