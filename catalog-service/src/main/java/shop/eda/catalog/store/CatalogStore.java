package shop.eda.catalog.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shop.eda.catalog.model.Product;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * CatalogStore
 * Product id -> product, seeded at startup and mutated only by applied order events.
 *
 * Readers get copied snapshots under the read lock, so a query never observes a
 * half-applied event. The dedup check, the stock change and the dedup record of
 * one event happen under a single write lock.
 */
public class CatalogStore {

    private static final Logger logger = LoggerFactory.getLogger(CatalogStore.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final TreeMap<Integer, Product> products = new TreeMap<>();
    private final AppliedOrderWindow appliedOrders;

    public CatalogStore(List<Product> seed, AppliedOrderWindow appliedOrders) {
        for (Product product : seed) {
            if (product.quantity() < 0) {
                throw new IllegalArgumentException("Negative stock for product " + product.id());
            }
            if (products.putIfAbsent(product.id(), product) != null) {
                throw new IllegalArgumentException("Duplicate product id " + product.id());
            }
        }
        this.appliedOrders = appliedOrders;
        logger.info("Catalog seeded with {} products", products.size());
    }

    /**
     * @return every product, ordered by id ascending
     */
    public List<Product> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(products.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Product> find(int productId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(products.get(productId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Applies an order-placed event at most once per order id.
     *
     * @param orderId   id of the order the event belongs to
     * @param productId product to decrement
     * @param quantity  units ordered, >= 1
     */
    public ApplyOutcome applyOrderPlaced(String orderId, int productId, int quantity) {
        lock.writeLock().lock();
        try {
            if (appliedOrders.contains(orderId)) {
                logger.info("Order {} already applied, skipping", orderId);
                return ApplyOutcome.DUPLICATE;
            }

            Product product = products.get(productId);
            if (product == null) {
                appliedOrders.record(orderId);
                logger.warn("Order {} refers to unknown product {}, ignoring", orderId, productId);
                return ApplyOutcome.UNKNOWN_PRODUCT;
            }

            int remaining = product.quantity() - quantity;
            ApplyOutcome outcome = ApplyOutcome.APPLIED;
            if (remaining < 0) {
                logger.warn("Stock inconsistency: order {} takes {} of product {} but only {} left, flooring at 0",
                        orderId, quantity, productId, product.quantity());
                remaining = 0;
                outcome = ApplyOutcome.CLAMPED;
            }

            products.put(productId, product.withQuantity(remaining));
            appliedOrders.record(orderId);
            logger.info("Applied order {}: product {} stock {} -> {}",
                    orderId, productId, product.quantity(), remaining);
            return outcome;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
