package in.kiteticker.domain.data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One decoded market update from the ticker feed.
 *
 * The fields that are filled depend on {@link #mode()}, which reflects the
 * packet that was actually received, not the mode that was requested:
 * <ul>
 *   <li>LTP - token, segment, tradability and last price only</li>
 *   <li>QUOTE - adds OHLC and net change; equity quotes also carry traded
 *       quantities, volume and average price</li>
 *   <li>FULL - adds last trade time, open interest, exchange timestamp and
 *       five levels of depth (index packets carry only the timestamp)</li>
 * </ul>
 * Absent prices and instants are {@code null}, absent quantities are {@code 0}
 * and an absent order book is {@link MarketDepth#EMPTY}.
 */
public record Tick(
    long instrumentToken,
    TickMode mode,
    Segment segment,
    boolean tradable,
    BigDecimal lastPrice,
    BigDecimal netChange,
    Ohlc ohlc,
    long lastTradedQuantity,
    BigDecimal averageTradePrice,
    long volumeTraded,
    long totalBuyQuantity,
    long totalSellQuantity,
    Instant lastTradeTime,
    long openInterest,
    long openInterestDayHigh,
    long openInterestDayLow,
    Instant timestamp,
    MarketDepth depth
) {
    public Tick {
        if (mode == null) {
            throw new IllegalArgumentException("Tick mode is required");
        }
        if (depth == null) {
            depth = MarketDepth.EMPTY;
        }
    }

    public static Builder builder(long instrumentToken, TickMode mode) {
        return new Builder(instrumentToken, mode);
    }

    /**
     * Builder used by the decoder so each packet shape only sets its own fields.
     */
    public static final class Builder {
        private final long instrumentToken;
        private final TickMode mode;
        private Segment segment = Segment.UNKNOWN;
        private boolean tradable = true;
        private BigDecimal lastPrice;
        private BigDecimal netChange;
        private Ohlc ohlc;
        private long lastTradedQuantity;
        private BigDecimal averageTradePrice;
        private long volumeTraded;
        private long totalBuyQuantity;
        private long totalSellQuantity;
        private Instant lastTradeTime;
        private long openInterest;
        private long openInterestDayHigh;
        private long openInterestDayLow;
        private Instant timestamp;
        private MarketDepth depth = MarketDepth.EMPTY;

        private Builder(long instrumentToken, TickMode mode) {
            this.instrumentToken = instrumentToken;
            this.mode = mode;
        }

        public Builder segment(Segment segment) {
            this.segment = segment;
            this.tradable = segment.isTradable();
            return this;
        }

        public Builder lastPrice(BigDecimal lastPrice) {
            this.lastPrice = lastPrice;
            return this;
        }

        public Builder netChange(BigDecimal netChange) {
            this.netChange = netChange;
            return this;
        }

        public Builder ohlc(Ohlc ohlc) {
            this.ohlc = ohlc;
            return this;
        }

        public Builder lastTradedQuantity(long lastTradedQuantity) {
            this.lastTradedQuantity = lastTradedQuantity;
            return this;
        }

        public Builder averageTradePrice(BigDecimal averageTradePrice) {
            this.averageTradePrice = averageTradePrice;
            return this;
        }

        public Builder volumeTraded(long volumeTraded) {
            this.volumeTraded = volumeTraded;
            return this;
        }

        public Builder totalBuyQuantity(long totalBuyQuantity) {
            this.totalBuyQuantity = totalBuyQuantity;
            return this;
        }

        public Builder totalSellQuantity(long totalSellQuantity) {
            this.totalSellQuantity = totalSellQuantity;
            return this;
        }

        public Builder lastTradeTime(Instant lastTradeTime) {
            this.lastTradeTime = lastTradeTime;
            return this;
        }

        public Builder openInterest(long openInterest) {
            this.openInterest = openInterest;
            return this;
        }

        public Builder openInterestDayHigh(long openInterestDayHigh) {
            this.openInterestDayHigh = openInterestDayHigh;
            return this;
        }

        public Builder openInterestDayLow(long openInterestDayLow) {
            this.openInterestDayLow = openInterestDayLow;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder depth(MarketDepth depth) {
            this.depth = depth;
            return this;
        }

        public Tick build() {
            return new Tick(
                instrumentToken,
                mode,
                segment,
                tradable,
                lastPrice,
                netChange,
                ohlc,
                lastTradedQuantity,
                averageTradePrice,
                volumeTraded,
                totalBuyQuantity,
                totalSellQuantity,
                lastTradeTime,
                openInterest,
                openInterestDayHigh,
                openInterestDayLow,
                timestamp,
                depth
            );
        }
    }
}
