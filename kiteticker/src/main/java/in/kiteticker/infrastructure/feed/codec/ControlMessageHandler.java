package in.kiteticker.infrastructure.feed.codec;

import in.kiteticker.domain.data.Postback;

/**
 * Receives decoded inbound control messages.
 */
public interface ControlMessageHandler {

    void onOrderUpdate(Postback postback);

    /**
     * @param rawMessage the whole message text as received
     */
    void onMessage(String rawMessage);

    /**
     * @param code always 0, the control channel carries no error code
     */
    void onError(int code, String message);
}
