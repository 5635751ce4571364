package in.kiteticker.domain.data;

/**
 * Market segment encoded in the low byte of an instrument token.
 *
 * Only two segments change how a packet is decoded: {@link #CDS} prices are
 * scaled by 10 000 000 instead of 100, and {@link #INDICES} are not tradable.
 */
public enum Segment {
    NSE(1),
    NFO(2),
    CDS(3),
    BSE(4),
    BFO(5),
    BSECDS(6),
    MCX(7),
    MCXSX(8),
    INDICES(9),
    UNKNOWN(-1);

    public static final int DEFAULT_PRICE_SCALE = 2;
    public static final int CURRENCY_DERIVATIVES_PRICE_SCALE = 7;

    private final int code;

    Segment(int code) {
        this.code = code;
    }

    /**
     * Number of decimal places implied by the wire integer: 7 for currency
     * derivatives (divisor 10 000 000), 2 otherwise (divisor 100).
     */
    public int priceScale() {
        return this == CDS ? CURRENCY_DERIVATIVES_PRICE_SCALE : DEFAULT_PRICE_SCALE;
    }

    public long divisor() {
        return this == CDS ? 10_000_000L : 100L;
    }

    public boolean isTradable() {
        return this != INDICES;
    }

    public static Segment ofToken(long instrumentToken) {
        return ofCode((int) (instrumentToken & 0xFF));
    }

    public static Segment ofCode(int code) {
        for (Segment segment : values()) {
            if (segment.code == code) {
                return segment;
            }
        }
        return UNKNOWN;
    }
}
