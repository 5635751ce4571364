package in.kiteticker.infrastructure.feed.connection;

/**
 * Lifecycle state of the ticker connection.
 */
public enum ConnectionState {
    /** No socket and no pending attempt. */
    DISCONNECTED,
    /** First handshake of an explicit connect in progress. */
    CONNECTING,
    /** Socket open, frames flowing. */
    CONNECTED,
    /** Waiting for, or running, an automatic reconnect attempt. */
    RECONNECTING,
    /** Stopped by the application or reconnect attempts exhausted. */
    CLOSED
}
