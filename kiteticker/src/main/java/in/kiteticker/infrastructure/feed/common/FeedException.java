package in.kiteticker.infrastructure.feed.common;

/**
 * Base class for failures raised by the ticker feed client.
 */
public class FeedException extends RuntimeException {

    public FeedException(String message) {
        super(message);
    }

    public FeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
