package in.kiteticker.infrastructure.feed.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.kiteticker.domain.data.DepthLevel;
import in.kiteticker.domain.data.Tick;
import in.kiteticker.domain.data.TickMode;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Renders ticks as compact JSON for logs and downstream consumers.
 * Only the fields present in the tick's mode are written.
 */
public final class TickJsonMapper {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TickJsonMapper() {}

    public static String toJson(Tick t) {
        ObjectNode o = MAPPER.createObjectNode();

        o.put("instrumentToken", t.instrumentToken());
        o.put("mode", t.mode().wireValue());
        o.put("segment", t.segment().name());
        o.put("tradable", t.tradable());
        putDecimal(o, "lastPrice", t.lastPrice());

        if (t.mode() != TickMode.LTP) {
            putDecimal(o, "netChange", t.netChange());
            if (t.ohlc() != null) {
                ObjectNode ohlc = o.putObject("ohlc");
                putDecimal(ohlc, "open", t.ohlc().open());
                putDecimal(ohlc, "high", t.ohlc().high());
                putDecimal(ohlc, "low", t.ohlc().low());
                putDecimal(ohlc, "close", t.ohlc().close());
            }
            if (t.averageTradePrice() != null) {
                o.put("lastTradedQuantity", t.lastTradedQuantity());
                putDecimal(o, "averageTradePrice", t.averageTradePrice());
                o.put("volumeTraded", t.volumeTraded());
                o.put("totalBuyQuantity", t.totalBuyQuantity());
                o.put("totalSellQuantity", t.totalSellQuantity());
            }
        }

        if (t.mode() == TickMode.FULL) {
            putInstant(o, "lastTradeTime", t.lastTradeTime());
            putInstant(o, "timestamp", t.timestamp());
            if (!t.depth().isEmpty()) {
                o.put("openInterest", t.openInterest());
                o.put("openInterestDayHigh", t.openInterestDayHigh());
                o.put("openInterestDayLow", t.openInterestDayLow());
                ObjectNode depth = o.putObject("depth");
                putLevels(depth.putArray("buy"), t.depth().buy());
                putLevels(depth.putArray("sell"), t.depth().sell());
            }
        }

        return o.toString();
    }

    private static void putLevels(ArrayNode array, List<DepthLevel> levels) {
        for (DepthLevel level : levels) {
            ObjectNode node = array.addObject();
            node.put("quantity", level.quantity());
            putDecimal(node, "price", level.price());
            node.put("orders", level.orders());
        }
    }

    private static void putDecimal(ObjectNode o, String key, BigDecimal v) {
        if (v == null) return;
        o.put(key, v.toPlainString());
    }

    private static void putInstant(ObjectNode o, String key, Instant v) {
        if (v == null) return;
        o.put(key, v.toString());
    }
}
