package in.kiteticker.infrastructure.feed.metrics;

import in.kiteticker.domain.data.TickMode;

final class NoopFeedMetrics implements FeedMetrics {
    static final NoopFeedMetrics INSTANCE = new NoopFeedMetrics();

    private NoopFeedMetrics() {
    }

    @Override
    public void recordFrame(String frameType) {
    }

    @Override
    public void recordTicks(TickMode mode, int count) {
    }

    @Override
    public void recordMalformedFrame() {
    }

    @Override
    public void recordControlMessage(String messageType) {
    }

    @Override
    public void recordConnectionEvent(ConnectionEvent event) {
    }

    @Override
    public void recordReconnectAttempt(int attemptNumber) {
    }

    @Override
    public void updateSubscribedInstruments(int count) {
    }
}
