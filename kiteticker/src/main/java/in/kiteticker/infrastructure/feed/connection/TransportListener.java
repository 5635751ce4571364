package in.kiteticker.infrastructure.feed.connection;

/**
 * Events of a single socket. Called sequentially on a transport thread;
 * messages are delivered whole, never as fragments.
 */
public interface TransportListener {

    void onOpen(FeedConnection connection);

    void onText(String text);

    void onBinary(byte[] data);

    void onPong();

    void onClose(int code, String reason);

    void onError(Throwable error);
}
