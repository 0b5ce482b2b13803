package shop.eda.order.service.publish;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import shop.eda.eventbus.EventBusClient;
import shop.eda.eventbus.PublishReceipt;
import shop.eda.eventbus.event.OrderPlacedEvent;
import shop.eda.eventbus.exception.EventBusException;
import shop.eda.eventbus.exception.PublishException;
import shop.eda.order.model.Order;

/**
 * OrderEventPublisher
 * Publishes the OrderPlacedEvent of an order, keyed by item id so that all
 * events of one product land in the same partition.
 * One call is one attempt; retries are driven by the caller.
 */
@Service
public class OrderEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(OrderEventPublisher.class);

    // Dedicated logger for orders that could not be published (logs to failed-orders.log)
    private static final Logger failedOrdersLogger = LoggerFactory.getLogger("FAILED_ORDERS_LOGGER");

    private final EventBusClient eventBusClient;
    private final String topicName;
    private final String source;

    public OrderEventPublisher(EventBusClient eventBusClient,
                               @Value("${kafka.topic.name:orders}") String topicName,
                               @Value("${spring.application.name:order-service}") String source) {
        this.eventBusClient = eventBusClient;
        this.topicName = topicName;
        this.source = source;
    }

    /**
     * @throws PublishException if the event was not acknowledged
     */
    public PublishReceipt publish(Order order) {
        OrderPlacedEvent event = new OrderPlacedEvent(
                order.orderId(), order.itemId(), order.quantity(), order.createdAt(), source);
        try {
            PublishReceipt receipt = eventBusClient.publish(topicName, event.partitionKey(), event);
            logger.info("Successfully sent orderId={} partition={} offset={}",
                    order.orderId(), receipt.partition(), receipt.offset());
            return receipt;

        } catch (PublishException e) {
            logger.warn("Publish attempt failed orderId={} type={} ambiguous={}: {}",
                    order.orderId(), e.getType(), e.isAmbiguous(), e.getMessage());
            throw e;

        } catch (EventBusException e) {
            logger.warn("Publish attempt failed orderId={}: {}", order.orderId(), e.getMessage());
            throw new PublishException("EVENT_BUS_ERROR", topicName, event.partitionKey(),
                    e.getMessage(), false, e);
        }
    }

    /**
     * Writes the full order to the failed-orders log for manual reconciliation.
     */
    public void logFailedOrder(String type, Order order, String reason) {
        logger.error("Giving up on orderId={} after {} publish attempts, logging to failed-orders.log [Type: {}, Reason: {}]",
                order.orderId(), order.publishAttempts(), type, reason);

        failedOrdersLogger.info("FAILED_ORDER | Type: {} | OrderId: {} | Reason: {} | Payload: {}",
                type, order.orderId(), reason, order);
    }
}
