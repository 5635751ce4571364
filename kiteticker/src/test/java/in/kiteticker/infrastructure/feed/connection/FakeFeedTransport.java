package in.kiteticker.infrastructure.feed.connection;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory transport. Tests decide when a connection attempt opens or fails and
 * play the server side of each connection.
 */
public class FakeFeedTransport implements FeedTransport {

    private final BlockingQueue<PendingOpen> opens = new LinkedBlockingQueue<>();
    private final AtomicInteger openCount = new AtomicInteger();
    private volatile boolean refuseConnections = false;

    /**
     * Fail every following attempt with a connect exception.
     */
    public void refuseConnections(boolean refuse) {
        this.refuseConnections = refuse;
    }

    @Override
    public CompletableFuture<FeedConnection> open(URI endpoint, Duration connectTimeout, TransportListener listener) {
        openCount.incrementAndGet();
        PendingOpen pending = new PendingOpen(endpoint, listener);
        if (refuseConnections) {
            pending.fail(new ConnectException("Connection refused"));
        }
        opens.add(pending);
        return pending.future;
    }

    public PendingOpen awaitOpen() throws InterruptedException {
        PendingOpen pending = opens.poll(2, TimeUnit.SECONDS);
        if (pending == null) {
            throw new AssertionError("No connection attempt within 2 seconds");
        }
        return pending;
    }

    public FakeConnection acceptNext() throws InterruptedException {
        return awaitOpen().accept();
    }

    public int getOpenCount() {
        return openCount.get();
    }

    /**
     * A connection attempt waiting for the test to accept or fail it.
     */
    public static final class PendingOpen {
        private final URI endpoint;
        private final TransportListener listener;
        private final CompletableFuture<FeedConnection> future = new CompletableFuture<>();

        PendingOpen(URI endpoint, TransportListener listener) {
            this.endpoint = endpoint;
            this.listener = listener;
        }

        public URI getEndpoint() {
            return endpoint;
        }

        public FakeConnection accept() {
            FakeConnection connection = new FakeConnection(listener);
            listener.onOpen(connection);
            future.complete(connection);
            return connection;
        }

        public void fail(Throwable error) {
            future.completeExceptionally(error);
        }
    }

    /**
     * Client side of an open connection plus hooks to act as the server.
     */
    public static final class FakeConnection implements FeedConnection {
        private final TransportListener listener;
        private final List<String> sent = new CopyOnWriteArrayList<>();
        private final AtomicInteger pings = new AtomicInteger();
        private volatile boolean autoPong = false;
        private volatile boolean acknowledgeClose = true;
        private volatile boolean aborted = false;
        private volatile Integer closeCode;

        FakeConnection(TransportListener listener) {
            this.listener = listener;
        }

        @Override
        public CompletableFuture<Void> sendText(String text) {
            sent.add(text);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletableFuture<Void> sendPing() {
            pings.incrementAndGet();
            if (autoPong) {
                listener.onPong();
            }
            return CompletableFuture.completedFuture(null);
        }

        /**
         * Records the close and, unless disabled, answers it the way a server does.
         */
        @Override
        public CompletableFuture<Void> close(int code, String reason) {
            closeCode = code;
            if (acknowledgeClose) {
                listener.onClose(code, reason);
            }
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void abort() {
            aborted = true;
        }

        public void setAutoPong(boolean autoPong) {
            this.autoPong = autoPong;
        }

        public void setAcknowledgeClose(boolean acknowledgeClose) {
            this.acknowledgeClose = acknowledgeClose;
        }

        public void serverText(String text) {
            listener.onText(text);
        }

        public void serverBinary(byte[] frame) {
            listener.onBinary(frame);
        }

        public void serverClose(int code, String reason) {
            listener.onClose(code, reason);
        }

        public void serverError(Throwable error) {
            listener.onError(error);
        }

        public List<String> getSent() {
            return sent;
        }

        /**
         * Wait until at least {@code count} messages were sent.
         */
        public List<String> awaitSent(int count) throws InterruptedException {
            long deadline = System.currentTimeMillis() + 2000;
            while (sent.size() < count && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }
            if (sent.size() < count) {
                throw new AssertionError("Expected " + count + " sent messages but got " + sent);
            }
            return sent;
        }

        public int getPingCount() {
            return pings.get();
        }

        public boolean isAborted() {
            return aborted;
        }

        public Integer getCloseCode() {
            return closeCode;
        }
    }
}
