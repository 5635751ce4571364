package in.kiteticker.infrastructure.feed.codec;

import in.kiteticker.infrastructure.feed.common.FeedException;

/**
 * Thrown when an inbound text message is not a JSON object or carries no
 * recognized {@code type}.
 */
public class ControlMessageException extends FeedException {

    private final String messageType;

    public ControlMessageException(String messageType, String message) {
        super(message);
        this.messageType = messageType;
    }

    public ControlMessageException(String messageType, String message, Throwable cause) {
        super(message, cause);
        this.messageType = messageType;
    }

    /**
     * The {@code type} field as received, or {@code null} when absent.
     */
    public String getMessageType() {
        return messageType;
    }
}
