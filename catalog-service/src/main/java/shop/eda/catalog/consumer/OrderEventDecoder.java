package shop.eda.catalog.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.springframework.stereotype.Component;
import shop.eda.catalog.exception.ConsumerException;
import shop.eda.eventbus.EventRecord;
import shop.eda.eventbus.codec.EventCodec;
import shop.eda.eventbus.event.OrderPlacedEvent;

/**
 * Turns raw records into OrderPlacedEvents, rejecting anything that cannot be applied.
 */
@Component
public class OrderEventDecoder {

    private final EventCodec codec;

    public OrderEventDecoder(EventCodec codec) {
        this.codec = codec;
    }

    /**
     * @throws ConsumerException if the payload is not JSON or misses a required field
     */
    public OrderPlacedEvent decode(EventRecord record) {
        if (record.payload() == null || record.payload().isBlank()) {
            throw malformed(record, "empty payload", null);
        }

        OrderPlacedEvent event;
        try {
            event = codec.decode(record.payload(), OrderPlacedEvent.class);
        } catch (JsonProcessingException e) {
            throw malformed(record, "invalid JSON: " + e.getOriginalMessage(), e);
        }

        if (event == null) {
            throw malformed(record, "payload is JSON null", null);
        }
        if (event.orderId() == null || event.orderId().isBlank()) {
            throw malformed(record, "order_id is missing", null);
        }
        if (event.itemId() == null) {
            throw malformed(record, "item_id is missing", null);
        }
        if (event.quantity() == null || event.quantity() < 1) {
            throw malformed(record, "quantity must be >= 1, got " + event.quantity(), null);
        }
        if (event.timestamp() == null) {
            throw malformed(record, "timestamp is missing", null);
        }
        return event;
    }

    private static ConsumerException malformed(EventRecord record, String reason, Throwable cause) {
        return new ConsumerException(record.topic(), record.partition(), record.offset(), reason, cause);
    }
}
