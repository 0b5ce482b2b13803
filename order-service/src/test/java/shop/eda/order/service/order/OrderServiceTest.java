package shop.eda.order.service.order;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import shop.eda.eventbus.PublishReceipt;
import shop.eda.eventbus.exception.PublishException;
import shop.eda.order.exception.InsufficientStockException;
import shop.eda.order.exception.OrderNotFoundException;
import shop.eda.order.exception.OrderPersistenceException;
import shop.eda.order.exception.OrderPublicationPendingException;
import shop.eda.order.exception.OrderValidationException;
import shop.eda.order.model.Order;
import shop.eda.order.model.OrderRequest;
import shop.eda.order.model.OrderStatus;
import shop.eda.order.service.catalog.ItemCatalog;
import shop.eda.order.service.publish.OrderEventPublisher;
import shop.eda.order.service.publish.PublicationOutbox;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrderServiceTest {

    private static final PublishReceipt RECEIPT = new PublishReceipt("orders", 0, 42L);

    @Mock
    private ItemCatalog itemCatalog;

    @Mock
    private OrderEventPublisher orderEventPublisher;

    @Mock
    private PublicationOutbox publicationOutbox;

    private InMemoryOrderStore orderStore;
    private OrderService orderService;

    @BeforeEach
    void setUp() {
        orderStore = new InMemoryOrderStore();
        orderService = newService(orderStore, true);
    }

    @Test
    void placeOrder_ValidRequest_ShouldStoreAndPublishOnce() {
        when(orderEventPublisher.publish(any(Order.class))).thenReturn(RECEIPT);

        Order order = orderService.placeOrder(request(3));

        assertTrue(order.orderId().startsWith("ORD-"));
        assertEquals(OrderStatus.CREATED, order.status());
        assertEquals(1, order.publishAttempts());
        assertEquals(order, orderStore.find(order.orderId()).orElseThrow());
        verify(itemCatalog, times(1)).checkAvailability(1, 3);
        verify(orderEventPublisher, times(1)).publish(any(Order.class));
        verifyNoInteractions(publicationOutbox);
    }

    @Test
    void placeOrder_TwoRequests_ShouldGetDistinctIds() {
        when(orderEventPublisher.publish(any(Order.class))).thenReturn(RECEIPT);

        Order first = orderService.placeOrder(request(1));
        Order second = orderService.placeOrder(request(1));

        assertNotEquals(first.orderId(), second.orderId());
    }

    @Test
    void placeOrder_UnknownItem_ShouldNotStoreOrPublish() {
        doThrow(new OrderValidationException("item_id", "Unknown item_id: 1"))
                .when(itemCatalog).checkAvailability(1, 2);

        assertThrows(OrderValidationException.class, () -> orderService.placeOrder(request(2)));

        verifyNoInteractions(orderEventPublisher, publicationOutbox);
    }

    @Test
    void placeOrder_InsufficientStock_ShouldNotStoreOrPublish() {
        doThrow(new InsufficientStockException(1, 20, 10)).when(itemCatalog).checkAvailability(1, 20);

        assertThrows(InsufficientStockException.class, () -> orderService.placeOrder(request(20)));

        verifyNoInteractions(orderEventPublisher);
    }

    @Test
    void placeOrder_CatalogValidationDisabled_ShouldSkipLookup() {
        orderService = newService(orderStore, false);
        when(orderEventPublisher.publish(any(Order.class))).thenReturn(RECEIPT);

        orderService.placeOrder(request(500));

        verifyNoInteractions(itemCatalog);
    }

    @Test
    void placeOrder_PublishFailsThenSucceeds_ShouldRetryInline() {
        PublishException timeout = new PublishException("TIMEOUT", "orders", "1", "no ack", true, null);
        when(orderEventPublisher.publish(any(Order.class)))
                .thenThrow(timeout)
                .thenThrow(timeout)
                .thenReturn(RECEIPT);

        Order order = orderService.placeOrder(request(1));

        assertEquals(3, order.publishAttempts());
        verify(orderEventPublisher, times(3)).publish(any(Order.class));
        verifyNoInteractions(publicationOutbox);
    }

    @Test
    void placeOrder_PublishBudgetExhausted_ShouldRetainOrderAndEnqueue() {
        when(orderEventPublisher.publish(any(Order.class)))
                .thenThrow(new PublishException("KAFKA_ERROR", "orders", "1", "broker down", false, null));

        OrderPublicationPendingException ex = assertThrows(OrderPublicationPendingException.class,
                () -> orderService.placeOrder(request(1)));

        Order retained = orderStore.find(ex.getOrderId()).orElseThrow();
        assertEquals(OrderStatus.CREATED, retained.status());
        assertEquals(3, retained.publishAttempts());
        assertEquals("KAFKA_ERROR", ex.getType());
        verify(publicationOutbox, times(1)).enqueue(ex.getOrderId());
    }

    @Test
    void placeOrder_PersistenceFailsOnce_ShouldRetryAndPublish() {
        OrderStore flakyStore = mock(OrderStore.class);
        doThrow(new OrderPersistenceException("ORD-?", "disk busy"))
                .doNothing()
                .when(flakyStore).insert(any(Order.class));
        when(flakyStore.update(any(), any())).thenReturn(Optional.empty());
        when(orderEventPublisher.publish(any(Order.class))).thenReturn(RECEIPT);
        orderService = newService(flakyStore, true);

        orderService.placeOrder(request(1));

        verify(flakyStore, times(2)).insert(any(Order.class));
        verify(orderEventPublisher, times(1)).publish(any(Order.class));
    }

    @Test
    void placeOrder_PersistenceExhausted_ShouldThrowAndNotPublish() {
        OrderStore brokenStore = mock(OrderStore.class);
        doThrow(new OrderPersistenceException("ORD-?", "disk full")).when(brokenStore).insert(any(Order.class));
        orderService = newService(brokenStore, true);

        assertThrows(OrderPersistenceException.class, () -> orderService.placeOrder(request(1)));

        verify(brokenStore, times(3)).insert(any(Order.class));
        verifyNoInteractions(orderEventPublisher, publicationOutbox);
    }

    @Test
    void getOrder_Unknown_ShouldThrowNotFound() {
        assertThrows(OrderNotFoundException.class, () -> orderService.getOrder("ORD-missing"));
    }

    private OrderService newService(OrderStore store, boolean catalogValidation) {
        return new OrderService(store, itemCatalog, orderEventPublisher, publicationOutbox,
                fastRetry("persistence", OrderPersistenceException.class),
                fastRetry("publish", PublishException.class),
                catalogValidation);
    }

    @SuppressWarnings("unchecked")
    private static Retry fastRetry(String name, Class<? extends Throwable> retryOn) {
        return Retry.of(name, RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(retryOn)
                .build());
    }

    private static OrderRequest request(int quantity) {
        return new OrderRequest(1, "James", "22 Bugs Bunny Street, London", quantity);
    }
}
