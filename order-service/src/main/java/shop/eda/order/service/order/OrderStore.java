package shop.eda.order.service.order;

import shop.eda.order.exception.DuplicateOrderException;
import shop.eda.order.exception.OrderPersistenceException;
import shop.eda.order.model.Order;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable record of accepted orders, keyed by order id.
 */
public interface OrderStore {

    /**
     * Atomically inserts a new order.
     *
     * @throws DuplicateOrderException   if an order with the same id exists
     * @throws OrderPersistenceException if the write could not be completed (retryable)
     */
    void insert(Order order);

    Optional<Order> find(String orderId);

    /**
     * Atomically replaces an existing order with {@code change.apply(current)}.
     *
     * @return the updated order, empty if the id is unknown
     */
    Optional<Order> update(String orderId, UnaryOperator<Order> change);
}
