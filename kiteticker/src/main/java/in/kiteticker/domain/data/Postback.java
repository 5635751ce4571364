package in.kiteticker.domain.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Order status update pushed on the ticker control channel
 * ({@code {"type":"order","data":{...}}}).
 *
 * Timestamps are kept as the exchange sends them ({@code yyyy-MM-dd HH:mm:ss}, IST).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Postback(
    @JsonProperty("order_id") String orderId,
    @JsonProperty("exchange_order_id") String exchangeOrderId,
    @JsonProperty("parent_order_id") String parentOrderId,
    @JsonProperty("placed_by") String placedBy,
    @JsonProperty("user_id") String userId,
    @JsonProperty("status") String status,
    @JsonProperty("status_message") String statusMessage,
    @JsonProperty("status_message_raw") String statusMessageRaw,
    @JsonProperty("tradingsymbol") String tradingSymbol,
    @JsonProperty("exchange") String exchange,
    @JsonProperty("instrument_token") long instrumentToken,
    @JsonProperty("order_type") String orderType,
    @JsonProperty("transaction_type") String transactionType,
    @JsonProperty("validity") String validity,
    @JsonProperty("variety") String variety,
    @JsonProperty("product") String product,
    @JsonProperty("quantity") long quantity,
    @JsonProperty("disclosed_quantity") long disclosedQuantity,
    @JsonProperty("price") BigDecimal price,
    @JsonProperty("trigger_price") BigDecimal triggerPrice,
    @JsonProperty("average_price") BigDecimal averagePrice,
    @JsonProperty("filled_quantity") long filledQuantity,
    @JsonProperty("pending_quantity") long pendingQuantity,
    @JsonProperty("cancelled_quantity") long cancelledQuantity,
    @JsonProperty("market_protection") BigDecimal marketProtection,
    @JsonProperty("order_timestamp") String orderTimestamp,
    @JsonProperty("exchange_timestamp") String exchangeTimestamp,
    @JsonProperty("exchange_update_timestamp") String exchangeUpdateTimestamp,
    @JsonProperty("guid") String guid,
    @JsonProperty("tag") String tag,
    @JsonProperty("checksum") String checksum
) {}
