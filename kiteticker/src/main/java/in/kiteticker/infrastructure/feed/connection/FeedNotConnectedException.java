package in.kiteticker.infrastructure.feed.connection;

import in.kiteticker.infrastructure.feed.common.FeedException;

/**
 * Thrown when a control message is requested while no socket is open.
 * Recoverable: the caller may retry after the next connect callback.
 */
public class FeedNotConnectedException extends FeedException {

    private final ConnectionState state;

    public FeedNotConnectedException(ConnectionState state, String operation) {
        super(String.format("Not connected to websocket server (state=%s, operation=%s)", state, operation));
        this.state = state;
    }

    public ConnectionState getState() {
        return state;
    }
}
