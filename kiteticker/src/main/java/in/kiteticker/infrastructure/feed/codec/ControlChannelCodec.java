package in.kiteticker.infrastructure.feed.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.kiteticker.domain.data.Postback;
import in.kiteticker.domain.data.TickMode;

import java.util.Collection;

/**
 * JSON codec for the ticker's text control channel.
 *
 * Outbound requests:
 * <pre>
 * {"a":"subscribe","v":[408065,884737]}
 * {"a":"unsubscribe","v":[408065]}
 * {"a":"mode","v":["full",[408065]]}
 * </pre>
 *
 * Inbound messages carry a {@code type} of {@code order}, {@code message} or
 * {@code error} and a type-specific {@code data} payload.
 */
public class ControlChannelCodec {

    static final String ACTION_FIELD = "a";
    static final String VALUE_FIELD = "v";
    static final String TYPE_FIELD = "type";
    static final String DATA_FIELD = "data";

    /**
     * Recognized inbound message types.
     */
    public enum MessageType {
        ORDER("order"),
        MESSAGE("message"),
        ERROR("error");

        private final String wireValue;

        MessageType(String wireValue) {
            this.wireValue = wireValue;
        }

        public String wireValue() {
            return wireValue;
        }

        static MessageType fromWire(String value) {
            for (MessageType type : values()) {
                if (type.wireValue.equals(value)) {
                    return type;
                }
            }
            return null;
        }
    }

    private final ObjectMapper objectMapper;

    public ControlChannelCodec() {
        this(new ObjectMapper());
    }

    public ControlChannelCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String subscribe(Collection<Long> tokens) {
        return request("subscribe", tokenArray(tokens));
    }

    public String unsubscribe(Collection<Long> tokens) {
        return request("unsubscribe", tokenArray(tokens));
    }

    public String mode(TickMode mode, Collection<Long> tokens) {
        ArrayNode value = objectMapper.createArrayNode();
        value.add(mode.wireValue());
        value.add(tokenArray(tokens));
        return request("mode", value);
    }

    /**
     * Parse an inbound text message and hand it to the matching handler method.
     *
     * @return the type of the dispatched message
     * @throws ControlMessageException if the text is not a JSON object, has no
     *                                 recognized type, or an order update has no payload
     */
    public MessageType dispatch(String text, ControlMessageHandler handler) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ControlMessageException(null, "Control message is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ControlMessageException(null, "Expected a JSON object");
        }

        JsonNode typeNode = root.get(TYPE_FIELD);
        String type = typeNode != null && typeNode.isTextual() ? typeNode.asText() : null;
        MessageType messageType = MessageType.fromWire(type);
        if (messageType == null) {
            throw new ControlMessageException(type, "Cannot recognize websocket message type " + type);
        }

        JsonNode data = root.get(DATA_FIELD);
        switch (messageType) {
            case ORDER:
                handler.onOrderUpdate(parsePostback(data));
                break;
            case MESSAGE:
                handler.onMessage(text);
                break;
            case ERROR:
                handler.onError(0, errorText(data));
                break;
            default:
                throw new IllegalStateException("Unhandled message type " + messageType);
        }
        return messageType;
    }

    private Postback parsePostback(JsonNode data) {
        if (data == null || !data.isObject()) {
            throw new ControlMessageException(MessageType.ORDER.wireValue(), "Order update has no data object");
        }
        try {
            return objectMapper.treeToValue(data, Postback.class);
        } catch (JsonProcessingException e) {
            throw new ControlMessageException(MessageType.ORDER.wireValue(),
                "Cannot read order update: " + e.getOriginalMessage(), e);
        }
    }

    private static String errorText(JsonNode data) {
        if (data == null || data.isNull()) {
            return "";
        }
        return data.isTextual() ? data.asText() : data.toString();
    }

    private ArrayNode tokenArray(Collection<Long> tokens) {
        ArrayNode array = objectMapper.createArrayNode();
        for (Long token : tokens) {
            array.add(token);
        }
        return array;
    }

    private String request(String action, JsonNode value) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put(ACTION_FIELD, action);
        message.set(VALUE_FIELD, value);
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + action + " request", e);
        }
    }
}
