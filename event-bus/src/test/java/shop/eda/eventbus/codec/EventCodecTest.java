package shop.eda.eventbus.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;
import shop.eda.eventbus.event.OrderPlacedEvent;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class EventCodecTest {

    private final EventCodec codec = new EventCodec();

    @Test
    void encode_OrderPlacedEvent_ShouldUseSnakeCaseAndIsoTimestamp() {
        OrderPlacedEvent event = new OrderPlacedEvent("ORD-1", 4, 2,
                Instant.parse("2024-05-01T10:15:30Z"), "order-service");

        String json = codec.encode("orders", event);

        assertTrue(json.contains("\"order_id\":\"ORD-1\""));
        assertTrue(json.contains("\"item_id\":4"));
        assertTrue(json.contains("\"timestamp\":\"2024-05-01T10:15:30Z\""));
    }

    @Test
    void decode_UnknownFields_ShouldBeIgnored() throws JsonProcessingException {
        String json = "{\"order_id\":\"ORD-2\",\"item_id\":1,\"quantity\":3,\"extra\":true}";

        OrderPlacedEvent event = codec.decode(json, OrderPlacedEvent.class);

        assertEquals("ORD-2", event.orderId());
        assertEquals(3, event.quantity());
        assertNull(event.timestamp());
    }

    @Test
    void decode_MissingFields_ShouldDecodeToNulls() throws JsonProcessingException {
        OrderPlacedEvent event = codec.decode("{\"order_id\":\"ORD-3\"}", OrderPlacedEvent.class);

        assertNull(event.itemId());
        assertNull(event.quantity());
    }

    @Test
    void decode_NotJson_ShouldThrow() {
        assertThrows(JsonProcessingException.class, () -> codec.decode("not-json", OrderPlacedEvent.class));
    }
}
