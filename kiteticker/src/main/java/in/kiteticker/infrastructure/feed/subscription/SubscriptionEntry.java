package in.kiteticker.infrastructure.feed.subscription;

import in.kiteticker.domain.data.TickMode;

/**
 * One subscribed instrument and the mode requested for it.
 *
 * @param requestedMode {@code null} when the instrument was subscribed without
 *                      an explicit mode
 */
public record SubscriptionEntry(long token, TickMode requestedMode) {

    /**
     * Mode to request when the subscription is replayed; instruments without an
     * explicit mode are replayed as QUOTE, the feed's default.
     */
    public TickMode effectiveMode() {
        return requestedMode != null ? requestedMode : TickMode.QUOTE;
    }
}
