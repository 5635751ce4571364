package in.kiteticker.domain.data;

import java.math.BigDecimal;

/**
 * Session reference prices.
 */
public record Ohlc(
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close
) {}
