package in.kiteticker.infrastructure.feed.metrics;

import in.kiteticker.domain.data.TickMode;

/**
 * Feed metrics interface for monitoring and alerting.
 *
 * Implementations can publish to Prometheus or any other backend. Calls arrive
 * on the feed's event thread and must not block.
 *
 * Key metrics:
 * - Frames received by kind (ticks, heartbeat, text)
 * - Ticks decoded by mode
 * - Malformed frames dropped
 * - Connection events and reconnect attempts
 * - Subscribed instrument count
 */
public interface FeedMetrics {

    /**
     * Record a frame received from the server.
     *
     * @param frameType Kind of frame, one of {@link #FRAME_TICKS}, {@link #FRAME_HEARTBEAT}, {@link #FRAME_TEXT}
     */
    void recordFrame(String frameType);

    /**
     * Record ticks decoded from one frame.
     *
     * @param mode Mode of the decoded ticks
     * @param count Number of ticks of that mode
     */
    void recordTicks(TickMode mode, int count);

    /**
     * Record a binary frame dropped because it could not be split into packets.
     */
    void recordMalformedFrame();

    /**
     * Record a control message received on the text channel.
     *
     * @param messageType Wire type (order, message, error) or "invalid"
     */
    void recordControlMessage(String messageType);

    /**
     * Record connection event.
     *
     * @param event Connection event type
     */
    void recordConnectionEvent(ConnectionEvent event);

    /**
     * Record an automatic reconnect attempt.
     *
     * @param attemptNumber Attempt number within the current campaign (1, 2, 3...)
     */
    void recordReconnectAttempt(int attemptNumber);

    /**
     * Update the number of instruments currently subscribed.
     */
    void updateSubscribedInstruments(int count);

    String FRAME_TICKS = "ticks";
    String FRAME_HEARTBEAT = "heartbeat";
    String FRAME_TEXT = "text";

    enum ConnectionEvent {
        CONNECTED,
        DISCONNECTED,
        ERROR,
        RECONNECT_FAILED
    }

    /**
     * Metrics sink that discards everything.
     */
    static FeedMetrics noop() {
        return NoopFeedMetrics.INSTANCE;
    }
}
