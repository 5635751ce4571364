package in.kiteticker.infrastructure.feed.connection;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Opens sockets to the ticker endpoint.
 *
 * Implementations call {@link TransportListener#onOpen(FeedConnection)} before any
 * message of the new socket is delivered. A failed handshake completes the returned
 * future exceptionally and produces no listener events.
 */
public interface FeedTransport {

    CompletableFuture<FeedConnection> open(URI endpoint, Duration connectTimeout, TransportListener listener);
}
