package in.kiteticker.domain.data;

import java.util.Locale;

/**
 * Tick granularity.
 *
 * Used both as the mode requested for an instrument and as the mode actually
 * observed in a decoded tick (the latter is decided by packet length).
 */
public enum TickMode {
    LTP("ltp"),
    QUOTE("quote"),
    FULL("full");

    private final String wireValue;

    TickMode(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Value used in mode control messages, e.g. {@code {"a":"mode","v":["full",[...]]}}.
     */
    public String wireValue() {
        return wireValue;
    }

    public static TickMode fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Mode must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TickMode mode : values()) {
            if (mode.wireValue.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown tick mode: " + value);
    }
}
