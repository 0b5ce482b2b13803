package shop.eda.order.service.publish;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import shop.eda.eventbus.PublishReceipt;
import shop.eda.eventbus.exception.PublishException;
import shop.eda.order.model.Order;
import shop.eda.order.model.OrderStatus;
import shop.eda.order.service.order.OrderStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PublicationOutbox
 * Holds CREATED orders whose event has not been acknowledged yet and re-publishes
 * them on a fixed schedule, oldest first. An order leaves the outbox when its event
 * is acknowledged, or when the background budget is used up, in which case it is
 * marked FAILED and written to the failed-orders log.
 */
@Component
public class PublicationOutbox {

    private static final Logger logger = LoggerFactory.getLogger(PublicationOutbox.class);

    private final OrderStore orderStore;
    private final OrderEventPublisher orderEventPublisher;
    private final int maxBackgroundAttempts;

    // orderId -> background attempts so far, in enqueue order
    private final Map<String, Integer> pending = new LinkedHashMap<>();

    public PublicationOutbox(OrderStore orderStore,
                             OrderEventPublisher orderEventPublisher,
                             @Value("${order.publish.max-background-attempts:12}") int maxBackgroundAttempts) {
        this.orderStore = orderStore;
        this.orderEventPublisher = orderEventPublisher;
        this.maxBackgroundAttempts = maxBackgroundAttempts;
    }

    public void enqueue(String orderId) {
        synchronized (pending) {
            pending.putIfAbsent(orderId, 0);
        }
        logger.info("Order {} added to publication outbox", orderId);
    }

    public List<String> pendingOrderIds() {
        synchronized (pending) {
            return new ArrayList<>(pending.keySet());
        }
    }

    /**
     * One relay pass over every pending order.
     */
    @Scheduled(fixedDelayString = "${order.publish.retry-interval-ms:5000}",
            initialDelayString = "${order.publish.retry-interval-ms:5000}")
    public void relayPending() {
        List<String> orderIds = pendingOrderIds();
        if (orderIds.isEmpty()) {
            return;
        }
        logger.info("Outbox relay: {} pending order(s)", orderIds.size());

        for (String orderId : orderIds) {
            Optional<Order> current = orderStore.find(orderId);
            if (current.isEmpty() || current.get().status() != OrderStatus.CREATED) {
                remove(orderId);
                continue;
            }
            relay(current.get());
        }
    }

    private void relay(Order order) {
        String orderId = order.orderId();
        Order attempted = orderStore.update(orderId, o -> o.withPublishAttempts(o.publishAttempts() + 1))
                .orElse(order);
        try {
            PublishReceipt receipt = orderEventPublisher.publish(attempted);
            remove(orderId);
            logger.info("Outbox published orderId={} partition={} offset={} after {} attempts",
                    orderId, receipt.partition(), receipt.offset(), attempted.publishAttempts());

        } catch (PublishException e) {
            int attempts;
            synchronized (pending) {
                attempts = pending.merge(orderId, 1, Integer::sum);
            }
            if (attempts < maxBackgroundAttempts) {
                logger.warn("Outbox attempt {}/{} failed for orderId={}: {}",
                        attempts, maxBackgroundAttempts, orderId, e.getMessage());
                return;
            }

            remove(orderId);
            Order failed = orderStore.update(orderId, o -> o.withStatus(OrderStatus.FAILED)).orElse(attempted);
            orderEventPublisher.logFailedOrder(e.getType(), failed, e.getMessage());
        }
    }

    private void remove(String orderId) {
        synchronized (pending) {
            pending.remove(orderId);
        }
    }
}
