package in.kiteticker.infrastructure.feed.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * {@link FeedTransport} on top of the JDK {@link HttpClient} WebSocket.
 *
 * Fragmented text and binary messages are reassembled before they reach the
 * listener. Sends are chained so that a new send only starts once the previous
 * one completed, as {@link WebSocket} does not allow overlapping sends.
 */
public class JdkWebSocketTransport implements FeedTransport {
    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketTransport.class);

    private final HttpClient httpClient;

    public JdkWebSocketTransport() {
        this(HttpClient.newHttpClient());
    }

    public JdkWebSocketTransport(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public CompletableFuture<FeedConnection> open(URI endpoint, Duration connectTimeout, TransportListener listener) {
        SocketListener socketListener = new SocketListener(listener);

        return httpClient.newWebSocketBuilder()
            .connectTimeout(connectTimeout)
            .buildAsync(endpoint, socketListener)
            .thenApply(ws -> socketListener.connectionFor(ws));
    }

    private static final class SocketListener implements WebSocket.Listener {
        private final TransportListener listener;
        private final StringBuilder textBuffer = new StringBuilder();
        private final ByteArrayOutputStream binaryBuffer = new ByteArrayOutputStream();
        private volatile JdkConnection connection;

        SocketListener(TransportListener listener) {
            this.listener = listener;
        }

        synchronized JdkConnection connectionFor(WebSocket webSocket) {
            if (connection == null) {
                connection = new JdkConnection(webSocket);
            }
            return connection;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            log.debug("[KITE-WS] Handshake complete");
            listener.onOpen(connectionFor(webSocket));
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            textBuffer.append(data);
            if (last) {
                String message = textBuffer.toString();
                textBuffer.setLength(0);
                listener.onText(message);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            byte[] chunk = new byte[data.remaining()];
            data.get(chunk);
            binaryBuffer.write(chunk, 0, chunk.length);
            if (last) {
                byte[] frame = binaryBuffer.toByteArray();
                binaryBuffer.reset();
                listener.onBinary(frame);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onPong(WebSocket webSocket, ByteBuffer message) {
            listener.onPong();
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            log.debug("[KITE-WS] Close frame received: {} - {}", statusCode, reason);
            listener.onClose(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.debug("[KITE-WS] Socket error: {}", error.getMessage());
            listener.onError(error);
        }
    }

    private static final class JdkConnection implements FeedConnection {
        private static final ByteBuffer EMPTY = ByteBuffer.allocate(0);

        private final WebSocket webSocket;
        private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

        JdkConnection(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        @Override
        public CompletableFuture<Void> sendText(String text) {
            return enqueue(() -> webSocket.sendText(text, true));
        }

        @Override
        public CompletableFuture<Void> sendPing() {
            return enqueue(() -> webSocket.sendPing(EMPTY.duplicate()));
        }

        @Override
        public CompletableFuture<Void> close(int code, String reason) {
            return enqueue(() -> webSocket.sendClose(code, reason));
        }

        @Override
        public void abort() {
            webSocket.abort();
        }

        private synchronized CompletableFuture<Void> enqueue(Supplier<CompletableFuture<WebSocket>> send) {
            CompletableFuture<Void> next = tail
                .handle((ignored, previousError) -> (Void) null)
                .thenCompose(ignored -> send.get())
                .thenApply(ws -> (Void) null);
            tail = next;
            return next;
        }
    }
}
