package shop.eda.eventbus.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * OrderPlacedEvent
 * Published once per accepted order on the {@code orders} topic, keyed by item id.
 * Fields are boxed so that a payload with missing fields decodes to nulls and
 * can be rejected by the consumer instead of silently becoming zeros.
 */
public record OrderPlacedEvent(

        @JsonProperty("order_id")
        String orderId,

        @JsonProperty("item_id")
        Integer itemId,

        @JsonProperty("quantity")
        Integer quantity,

        @JsonProperty("timestamp")
        Instant timestamp,

        @JsonProperty("source")
        String source
) {

    public static final String EVENT_TYPE = "order_placed";

    /**
     * @return partition key: events of one product stay in one partition
     */
    public String partitionKey() {
        return String.valueOf(itemId);
    }
}
