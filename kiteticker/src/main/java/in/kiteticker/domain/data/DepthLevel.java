package in.kiteticker.domain.data;

import java.math.BigDecimal;

/**
 * One price level of the order book.
 */
public record DepthLevel(
    long quantity,
    BigDecimal price,
    int orders
) {}
