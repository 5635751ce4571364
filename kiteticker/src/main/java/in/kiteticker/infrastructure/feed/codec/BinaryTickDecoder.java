package in.kiteticker.infrastructure.feed.codec;

import in.kiteticker.domain.data.DepthLevel;
import in.kiteticker.domain.data.MarketDepth;
import in.kiteticker.domain.data.Ohlc;
import in.kiteticker.domain.data.Segment;
import in.kiteticker.domain.data.Tick;
import in.kiteticker.domain.data.TickMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Decodes Kite ticker binary frames into {@link Tick}s.
 *
 * Frame layout (all integers big-endian):
 * <pre>
 * [0,1]   number of packets n
 * then n times:
 *   2 bytes packet length L
 *   L bytes packet
 * </pre>
 *
 * The packet shape is decided by its length alone:
 * <ul>
 *   <li>8 - LTP: token, last price</li>
 *   <li>28 - index quote: token, last price, high, low, open, close, net change</li>
 *   <li>32 - index full: index quote + exchange timestamp</li>
 *   <li>44 - quote: token, last price, last qty, avg price, volume, buy qty,
 *       sell qty, open, high, low, close</li>
 *   <li>184 - full: quote + last trade time, OI, OI day high/low, exchange
 *       timestamp and 10 depth entries of 12 bytes (5 buy then 5 sell)</li>
 * </ul>
 *
 * Price fields are divided by 10 000 000 for currency derivatives and by 100
 * for every other segment.
 */
public class BinaryTickDecoder {
    private static final Logger log = LoggerFactory.getLogger(BinaryTickDecoder.class);

    static final int LTP_PACKET_LENGTH = 8;
    static final int INDEX_QUOTE_PACKET_LENGTH = 28;
    static final int INDEX_FULL_PACKET_LENGTH = 32;
    static final int QUOTE_PACKET_LENGTH = 44;
    static final int FULL_PACKET_LENGTH = 184;

    static final int DEPTH_OFFSET = 64;
    static final int DEPTH_ENTRY_LENGTH = 12;
    static final int DEPTH_ENTRIES = 2 * MarketDepth.LEVELS_PER_SIDE;

    /** Scale of the percentage net change derived for quote and full packets. */
    static final int NET_CHANGE_SCALE = 4;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * Decode a multiplexed frame. Ticks are returned in wire order; packets of an
     * unknown length are skipped.
     *
     * @throws MalformedFrameException if the frame header or a length prefix runs
     *                                 past the end of the frame
     */
    public List<Tick> decode(byte[] frame) {
        List<byte[]> packets = splitPackets(frame);
        if (packets.isEmpty()) {
            return Collections.emptyList();
        }

        List<Tick> ticks = new ArrayList<>(packets.size());
        for (byte[] packet : packets) {
            decodePacket(packet).ifPresent(ticks::add);
        }
        return ticks;
    }

    /**
     * Split a frame into its packets without interpreting them.
     *
     * @throws MalformedFrameException if the declared packets do not fit in the frame
     */
    public List<byte[]> splitPackets(byte[] frame) {
        FieldReader reader = new FieldReader(frame);
        if (reader.length() < 2) {
            throw new MalformedFrameException(frame.length, "missing packet count");
        }

        int packetCount = reader.uint16(0);
        List<byte[]> packets = new ArrayList<>(packetCount);

        int cursor = 2;
        for (int i = 0; i < packetCount; i++) {
            if (cursor + 2 > reader.length()) {
                throw new MalformedFrameException(frame.length,
                    String.format("length prefix of packet %d/%d at offset %d overruns the frame",
                        i + 1, packetCount, cursor));
            }
            int packetLength = reader.uint16(cursor);
            cursor += 2;

            if (cursor + packetLength > reader.length()) {
                throw new MalformedFrameException(frame.length,
                    String.format("packet %d/%d declares %d bytes at offset %d but only %d remain",
                        i + 1, packetCount, packetLength, cursor, reader.length() - cursor));
            }
            packets.add(reader.copy(cursor, packetLength));
            cursor += packetLength;
        }

        if (cursor < reader.length()) {
            log.debug("[KITE-WS] Ignoring {} trailing bytes after {} packets", reader.length() - cursor, packetCount);
        }
        return packets;
    }

    /**
     * Decode a single packet (without its length prefix).
     *
     * @return the tick, or empty when the packet length matches no known shape
     */
    public Optional<Tick> decodePacket(byte[] packet) {
        FieldReader reader = new FieldReader(packet);

        switch (reader.length()) {
            case LTP_PACKET_LENGTH:
                return Optional.of(decodeLtp(reader));
            case INDEX_QUOTE_PACKET_LENGTH:
            case INDEX_FULL_PACKET_LENGTH:
                return Optional.of(decodeIndex(reader));
            case QUOTE_PACKET_LENGTH:
            case FULL_PACKET_LENGTH:
                return Optional.of(decodeQuote(reader));
            default:
                log.debug("[KITE-WS] Skipping packet with unknown length {}", reader.length());
                return Optional.empty();
        }
    }

    private Tick decodeLtp(FieldReader reader) {
        long token = reader.uint32(0);
        Segment segment = Segment.ofToken(token);

        return Tick.builder(token, TickMode.LTP)
            .segment(segment)
            .lastPrice(reader.price(4, segment.priceScale()))
            .build();
    }

    private Tick decodeIndex(FieldReader reader) {
        long token = reader.uint32(0);
        Segment segment = Segment.ofToken(token);
        int scale = segment.priceScale();
        boolean full = reader.length() == INDEX_FULL_PACKET_LENGTH;

        Tick.Builder builder = Tick.builder(token, full ? TickMode.FULL : TickMode.QUOTE)
            .segment(segment)
            .lastPrice(reader.price(4, scale))
            .ohlc(new Ohlc(
                reader.price(16, scale),
                reader.price(8, scale),
                reader.price(12, scale),
                reader.price(20, scale)))
            // index packets carry the change as sent by the exchange
            .netChange(reader.price(24, scale));

        if (full) {
            builder.timestamp(reader.epochSeconds(28));
        }
        return builder.build();
    }

    private Tick decodeQuote(FieldReader reader) {
        long token = reader.uint32(0);
        Segment segment = Segment.ofToken(token);
        int scale = segment.priceScale();
        boolean full = reader.length() == FULL_PACKET_LENGTH;

        BigDecimal lastPrice = reader.price(4, scale);
        Ohlc ohlc = new Ohlc(
            reader.price(28, scale),
            reader.price(32, scale),
            reader.price(36, scale),
            reader.price(40, scale));

        Tick.Builder builder = Tick.builder(token, full ? TickMode.FULL : TickMode.QUOTE)
            .segment(segment)
            .lastPrice(lastPrice)
            .lastTradedQuantity(reader.uint32(8))
            .averageTradePrice(reader.price(12, scale))
            .volumeTraded(reader.uint32(16))
            .totalBuyQuantity(reader.uint32(20))
            .totalSellQuantity(reader.uint32(24))
            .ohlc(ohlc)
            .netChange(percentChange(lastPrice, ohlc.close()));

        if (full) {
            builder.lastTradeTime(reader.epochSeconds(44))
                .openInterest(reader.uint32(48))
                .openInterestDayHigh(reader.uint32(52))
                .openInterestDayLow(reader.uint32(56))
                .timestamp(reader.epochSeconds(60))
                .depth(decodeDepth(reader, scale));
        }
        return builder.build();
    }

    private MarketDepth decodeDepth(FieldReader reader, int scale) {
        List<DepthLevel> buy = new ArrayList<>(MarketDepth.LEVELS_PER_SIDE);
        List<DepthLevel> sell = new ArrayList<>(MarketDepth.LEVELS_PER_SIDE);

        for (int i = 0; i < DEPTH_ENTRIES; i++) {
            FieldReader entry = reader.slice(DEPTH_OFFSET + i * DEPTH_ENTRY_LENGTH, DEPTH_ENTRY_LENGTH);
            DepthLevel level = new DepthLevel(
                entry.uint32(0),
                entry.price(4, scale),
                entry.uint16(8));

            if (i < MarketDepth.LEVELS_PER_SIDE) {
                buy.add(level);
            } else {
                sell.add(level);
            }
        }
        return new MarketDepth(buy, sell);
    }

    /**
     * Percentage change of the last price over the previous close.
     * Undefined (null) when the close is zero, e.g. for instruments that have not traded yet.
     */
    static BigDecimal percentChange(BigDecimal lastPrice, BigDecimal close) {
        if (close.signum() == 0) {
            return null;
        }
        return lastPrice.subtract(close)
            .multiply(HUNDRED)
            .divide(close, NET_CHANGE_SCALE, RoundingMode.HALF_UP);
    }
}
