package in.kiteticker.domain.data;

import java.util.List;

/**
 * Five-level order book snapshot, best level first on each side.
 */
public record MarketDepth(
    List<DepthLevel> buy,
    List<DepthLevel> sell
) {
    public static final int LEVELS_PER_SIDE = 5;

    /** Depth of a tick that carries no order book (LTP and QUOTE packets). */
    public static final MarketDepth EMPTY = new MarketDepth(List.of(), List.of());

    public MarketDepth {
        buy = List.copyOf(buy);
        sell = List.copyOf(sell);
    }

    public boolean isEmpty() {
        return buy.isEmpty() && sell.isEmpty();
    }
}
