package shop.eda.order.service.order;

import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import shop.eda.eventbus.PublishReceipt;
import shop.eda.eventbus.exception.PublishException;
import shop.eda.order.exception.OrderNotFoundException;
import shop.eda.order.exception.OrderPersistenceException;
import shop.eda.order.exception.OrderPublicationPendingException;
import shop.eda.order.model.Order;
import shop.eda.order.model.OrderRequest;
import shop.eda.order.service.catalog.ItemCatalog;
import shop.eda.order.service.publish.OrderEventPublisher;
import shop.eda.order.service.publish.PublicationOutbox;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * OrderService
 * Business logic for order intake: vet the request against the catalog, assign an id,
 * store the order, then publish exactly one OrderPlacedEvent for it.
 */
@Service
public class OrderService {

    private static final Logger logger = LoggerFactory.getLogger(OrderService.class);

    private final OrderStore orderStore;
    private final ItemCatalog itemCatalog;
    private final OrderEventPublisher orderEventPublisher;
    private final PublicationOutbox publicationOutbox;
    private final Retry persistenceRetry;
    private final Retry publishRetry;
    private final boolean catalogValidationEnabled;

    public OrderService(OrderStore orderStore,
                        ItemCatalog itemCatalog,
                        OrderEventPublisher orderEventPublisher,
                        PublicationOutbox publicationOutbox,
                        @Qualifier("persistenceRetry") Retry persistenceRetry,
                        @Qualifier("publishRetry") Retry publishRetry,
                        @Value("${order.catalog.validation-enabled:true}") boolean catalogValidationEnabled) {
        this.orderStore = orderStore;
        this.itemCatalog = itemCatalog;
        this.orderEventPublisher = orderEventPublisher;
        this.publicationOutbox = publicationOutbox;
        this.persistenceRetry = persistenceRetry;
        this.publishRetry = publishRetry;
        this.catalogValidationEnabled = catalogValidationEnabled;
    }

    /**
     * Accepts an order.
     *
     * @param request a request that passed bean validation
     * @return the stored order, with its event acknowledged by the event bus
     * @throws OrderPersistenceException        if the order could not be stored
     * @throws OrderPublicationPendingException if the order was stored but its event is still unpublished
     */
    public Order placeOrder(OrderRequest request) {
        logger.info("Placing order itemId={}, quantity={}", request.itemId(), request.quantity());

        if (catalogValidationEnabled) {
            itemCatalog.checkAvailability(request.itemId(), request.quantity());
        }

        Order order = Order.created(newOrderId(), request, Instant.now());
        persistenceRetry.executeRunnable(() -> orderStore.insert(order));
        logger.info("Stored orderId={} status={}", order.orderId(), order.status());

        AtomicInteger attempts = new AtomicInteger();
        try {
            PublishReceipt receipt = publishRetry.executeSupplier(() -> {
                attempts.incrementAndGet();
                return orderEventPublisher.publish(order);
            });
            logger.debug("orderId={} acknowledged at {}-{}@{}",
                    order.orderId(), receipt.topic(), receipt.partition(), receipt.offset());
            return recordAttempts(order, attempts.get());

        } catch (PublishException e) {
            recordAttempts(order, attempts.get());
            publicationOutbox.enqueue(order.orderId());
            throw new OrderPublicationPendingException(order.orderId(), e);
        }
    }

    public Order getOrder(String orderId) {
        return orderStore.find(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    private Order recordAttempts(Order order, int attempts) {
        return orderStore.update(order.orderId(), o -> o.withPublishAttempts(attempts)).orElse(order);
    }

    private static String newOrderId() {
        return "ORD-" + UUID.randomUUID();
    }
}
