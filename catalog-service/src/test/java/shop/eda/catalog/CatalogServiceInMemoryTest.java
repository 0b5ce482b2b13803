package shop.eda.catalog;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import shop.eda.catalog.consumer.ConsumerLoopManager;
import shop.eda.catalog.model.response.PartitionStatus;
import shop.eda.catalog.store.CatalogStore;
import shop.eda.eventbus.EventBusClient;
import shop.eda.eventbus.event.OrderPlacedEvent;
import shop.eda.eventbus.event.Topics;
import shop.eda.eventbus.memory.InMemoryEventBus;

import java.time.Instant;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "event-bus.transport=in-memory",
        "event-bus.in-memory.partitions=2"
})
@ActiveProfiles("test")
@DirtiesContext
class CatalogServiceInMemoryTest {

    @Autowired
    private EventBusClient eventBusClient;

    @Autowired
    private CatalogStore catalogStore;

    @Autowired
    private ConsumerLoopManager consumerLoopManager;

    private int stock(int productId) {
        return catalogStore.find(productId).orElseThrow().quantity();
    }

    private void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertTrue(condition.getAsBoolean(), "condition not met within 10s");
    }

    @Test
    void orderEvents_ShouldDecrementSeededStockOnce() throws InterruptedException {
        assertInstanceOf(InMemoryEventBus.class, eventBusClient);
        waitUntil(consumerLoopManager::isConsuming);
        assertEquals(2, consumerLoopManager.statuses().size());

        OrderPlacedEvent event = new OrderPlacedEvent("ORD-A", 2, 5, Instant.now(), "order-service");
        eventBusClient.publish(Topics.ORDERS, event.partitionKey(), event);
        eventBusClient.publish(Topics.ORDERS, event.partitionKey(), event);
        OrderPlacedEvent other = new OrderPlacedEvent("ORD-B", 3, 1, Instant.now(), "order-service");
        eventBusClient.publish(Topics.ORDERS, other.partitionKey(), other);

        waitUntil(() -> stock(3) == 29 && consumerLoopManager.statuses().stream()
                .mapToLong(PartitionStatus::duplicates).sum() == 1);
        assertEquals(45, stock(2));
    }
}
