package in.kiteticker.infrastructure.feed.subscription;

import in.kiteticker.infrastructure.feed.common.FeedException;

import java.util.List;

/**
 * Exception thrown when instrument tokens cannot be added to the subscription set.
 */
public class FeedSubscriptionException extends FeedException {

    private final List<Long> tokens;

    public FeedSubscriptionException(List<Long> tokens, String message) {
        super(String.format("Failed for %d tokens: %s", tokens.size(), message));
        this.tokens = List.copyOf(tokens);
    }

    public List<Long> getTokens() {
        return tokens;
    }
}
