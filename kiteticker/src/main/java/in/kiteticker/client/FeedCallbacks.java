package in.kiteticker.client;

import in.kiteticker.domain.data.Postback;
import in.kiteticker.domain.data.Tick;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * Application callback slots of a {@link FeedClient}. Every slot is optional.
 * Callbacks run on the feed's event thread; an exception thrown by one is logged
 * and does not stop the feed.
 */
final class FeedCallbacks {
    private static final Logger log = LoggerFactory.getLogger(FeedCallbacks.class);

    volatile Runnable onConnect;
    volatile Consumer<List<Tick>> onTicks;
    volatile Consumer<Postback> onOrderUpdate;
    volatile Consumer<String> onMessage;
    volatile StatusHandler onError;
    volatile Consumer<Throwable> onConnectError;
    volatile IntConsumer onTryReconnect;
    volatile Runnable onReconnectFail;
    volatile StatusHandler onClose;

    void fireConnect() {
        Runnable callback = onConnect;
        if (callback != null) {
            invoke("onConnect", callback);
        }
    }

    void fireTicks(List<Tick> ticks) {
        Consumer<List<Tick>> callback = onTicks;
        if (callback != null) {
            invoke("onTicks", () -> callback.accept(ticks));
        }
    }

    void fireOrderUpdate(Postback postback) {
        Consumer<Postback> callback = onOrderUpdate;
        if (callback != null) {
            invoke("onOrderUpdate", () -> callback.accept(postback));
        }
    }

    void fireMessage(String message) {
        Consumer<String> callback = onMessage;
        if (callback != null) {
            invoke("onMessage", () -> callback.accept(message));
        }
    }

    void fireError(int code, String reason) {
        StatusHandler callback = onError;
        if (callback != null) {
            invoke("onError", () -> callback.accept(code, reason));
        }
    }

    void fireConnectError(Throwable error) {
        Consumer<Throwable> callback = onConnectError;
        if (callback != null) {
            invoke("onConnectError", () -> callback.accept(error));
        }
    }

    void fireTryReconnect(int attempt) {
        IntConsumer callback = onTryReconnect;
        if (callback != null) {
            invoke("onTryReconnect", () -> callback.accept(attempt));
        }
    }

    void fireReconnectFail() {
        Runnable callback = onReconnectFail;
        if (callback != null) {
            invoke("onReconnectFail", callback);
        }
    }

    void fireClose(int code, String reason) {
        StatusHandler callback = onClose;
        if (callback != null) {
            invoke("onClose", () -> callback.accept(code, reason));
        }
    }

    private static void invoke(String name, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.error("[KITE-WS] {} callback threw exception", name, e);
        }
    }
}
