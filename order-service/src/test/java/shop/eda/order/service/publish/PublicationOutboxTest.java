package shop.eda.order.service.publish;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import shop.eda.eventbus.PublishReceipt;
import shop.eda.eventbus.exception.PublishException;
import shop.eda.order.model.Order;
import shop.eda.order.model.OrderRequest;
import shop.eda.order.model.OrderStatus;
import shop.eda.order.service.order.InMemoryOrderStore;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PublicationOutboxTest {

    @Mock
    private OrderEventPublisher orderEventPublisher;

    private InMemoryOrderStore orderStore;
    private PublicationOutbox outbox;

    @BeforeEach
    void setUp() {
        orderStore = new InMemoryOrderStore();
        outbox = new PublicationOutbox(orderStore, orderEventPublisher, 2);
    }

    @Test
    void relayPending_PublishSucceeds_ShouldRemoveFromOutbox() {
        Order order = storeOrder("ORD-1");
        outbox.enqueue(order.orderId());
        when(orderEventPublisher.publish(any(Order.class))).thenReturn(new PublishReceipt("orders", 0, 7L));

        outbox.relayPending();

        assertTrue(outbox.pendingOrderIds().isEmpty());
        Order stored = orderStore.find("ORD-1").orElseThrow();
        assertEquals(OrderStatus.CREATED, stored.status());
        assertEquals(1, stored.publishAttempts());
    }

    @Test
    void relayPending_PublishFailsWithinBudget_ShouldKeepPending() {
        storeOrder("ORD-2");
        outbox.enqueue("ORD-2");
        when(orderEventPublisher.publish(any(Order.class))).thenThrow(unavailable());

        outbox.relayPending();

        assertEquals(1, outbox.pendingOrderIds().size());
        assertEquals(OrderStatus.CREATED, orderStore.find("ORD-2").orElseThrow().status());
        verify(orderEventPublisher, never()).logFailedOrder(any(), any(), any());
    }

    @Test
    void relayPending_BudgetExhausted_ShouldMarkFailedAndLog() {
        storeOrder("ORD-3");
        outbox.enqueue("ORD-3");
        when(orderEventPublisher.publish(any(Order.class))).thenThrow(unavailable());

        outbox.relayPending();
        outbox.relayPending();

        assertTrue(outbox.pendingOrderIds().isEmpty());
        Order failed = orderStore.find("ORD-3").orElseThrow();
        assertEquals(OrderStatus.FAILED, failed.status());
        assertEquals(2, failed.publishAttempts());
        verify(orderEventPublisher, times(1)).logFailedOrder(eq("UNAVAILABLE"), eq(failed), any());
    }

    @Test
    void relayPending_UnknownOrder_ShouldBeDropped() {
        outbox.enqueue("ORD-gone");

        outbox.relayPending();

        assertTrue(outbox.pendingOrderIds().isEmpty());
        verifyNoInteractions(orderEventPublisher);
    }

    @Test
    void enqueue_SameOrderTwice_ShouldKeepOneEntry() {
        outbox.enqueue("ORD-4");
        outbox.enqueue("ORD-4");

        assertEquals(1, outbox.pendingOrderIds().size());
    }

    private Order storeOrder(String orderId) {
        Order order = Order.created(orderId, new OrderRequest(1, "James", "Street 1", 2), Instant.now());
        orderStore.insert(order);
        return order;
    }

    private static PublishException unavailable() {
        return new PublishException("UNAVAILABLE", "orders", "1", "Event bus is unavailable", false, null);
    }
}
