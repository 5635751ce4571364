package in.kiteticker.infrastructure.feed.connection;

import java.util.concurrent.CompletableFuture;

/**
 * An open socket to the ticker endpoint.
 */
public interface FeedConnection {

    CompletableFuture<Void> sendText(String text);

    CompletableFuture<Void> sendPing();

    /**
     * Start the closing handshake. The close event is reported through
     * {@link TransportListener#onClose(int, String)} once the server answers.
     */
    CompletableFuture<Void> close(int code, String reason);

    /**
     * Drop the socket without a closing handshake. No further events are delivered.
     */
    void abort();
}
