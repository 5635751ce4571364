package in.kiteticker.client;

/**
 * Callback receiving a status code and a reason, used for errors and closes.
 */
@FunctionalInterface
public interface StatusHandler {

    void accept(int code, String reason);
}
