package shop.eda.catalog.consumer;

import org.junit.jupiter.api.Test;
import shop.eda.catalog.exception.ConsumerException;
import shop.eda.eventbus.EventRecord;
import shop.eda.eventbus.codec.EventCodec;
import shop.eda.eventbus.event.OrderPlacedEvent;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class OrderEventDecoderTest {

    private final OrderEventDecoder decoder = new OrderEventDecoder(new EventCodec());

    private static EventRecord record(String payload) {
        return new EventRecord("orders", 0, 42L, "1", payload);
    }

    @Test
    void decode_ValidPayload_ShouldReturnEvent() {
        String payload = "{\"order_id\":\"ORD-1\",\"item_id\":1,\"quantity\":3,"
                + "\"timestamp\":\"2024-05-01T10:00:00Z\",\"source\":\"order-service\",\"extra\":true}";

        OrderPlacedEvent event = decoder.decode(record(payload));

        assertEquals("ORD-1", event.orderId());
        assertEquals(1, event.itemId());
        assertEquals(3, event.quantity());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), event.timestamp());
    }

    @Test
    void decode_InvalidJson_ShouldThrowWithPosition() {
        ConsumerException ex = assertThrows(ConsumerException.class, () -> decoder.decode(record("{not json")));

        assertEquals(0, ex.getPartition());
        assertEquals(42L, ex.getOffset());
        assertTrue(ex.getMessage().contains("invalid JSON"));
    }

    @Test
    void decode_EmptyOrNullPayload_ShouldThrow() {
        assertThrows(ConsumerException.class, () -> decoder.decode(record("")));
        assertThrows(ConsumerException.class, () -> decoder.decode(record(null)));
        assertThrows(ConsumerException.class, () -> decoder.decode(record("null")));
    }

    @Test
    void decode_MissingFields_ShouldThrow() {
        assertThrows(ConsumerException.class,
                () -> decoder.decode(record("{\"item_id\":1,\"quantity\":1}")));
        assertThrows(ConsumerException.class,
                () -> decoder.decode(record("{\"order_id\":\"ORD-1\",\"quantity\":1}")));
        assertThrows(ConsumerException.class,
                () -> decoder.decode(record("{\"order_id\":\"ORD-1\",\"item_id\":1}")));
    }

    @Test
    void decode_NonPositiveQuantity_ShouldThrow() {
        ConsumerException ex = assertThrows(ConsumerException.class,
                () -> decoder.decode(record("{\"order_id\":\"ORD-1\",\"item_id\":1,\"quantity\":-1}")));

        assertTrue(ex.getMessage().contains("quantity"));
    }

    @Test
    void decode_FractionalNumbers_ShouldThrowInsteadOfTruncating() {
        ConsumerException ex = assertThrows(ConsumerException.class, () -> decoder.decode(record(
                "{\"order_id\":\"ORD-1\",\"item_id\":1.7,\"quantity\":2.9,\"timestamp\":\"2024-05-01T10:00:00Z\"}")));

        assertTrue(ex.getMessage().contains("invalid JSON"));
        assertThrows(ConsumerException.class, () -> decoder.decode(record(
                "{\"order_id\":\"ORD-1\",\"item_id\":1,\"quantity\":2.5,\"timestamp\":\"2024-05-01T10:00:00Z\"}")));
    }

    @Test
    void decode_MissingTimestamp_ShouldThrow() {
        ConsumerException ex = assertThrows(ConsumerException.class,
                () -> decoder.decode(record("{\"order_id\":\"ORD-1\",\"item_id\":1,\"quantity\":1}")));

        assertTrue(ex.getMessage().contains("timestamp"));
    }
}
