package shop.eda.order.service.order;

import org.springframework.stereotype.Repository;
import shop.eda.order.exception.DuplicateOrderException;
import shop.eda.order.model.Order;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Repository
public class InMemoryOrderStore implements OrderStore {

    private final Map<String, Order> orders = new ConcurrentHashMap<>();

    @Override
    public void insert(Order order) {
        Order prev = orders.putIfAbsent(order.orderId(), order);
        if (prev != null) {
            throw new DuplicateOrderException(order.orderId());
        }
    }

    @Override
    public Optional<Order> find(String orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public Optional<Order> update(String orderId, UnaryOperator<Order> change) {
        return Optional.ofNullable(orders.computeIfPresent(orderId, (id, existing) -> change.apply(existing)));
    }
}
