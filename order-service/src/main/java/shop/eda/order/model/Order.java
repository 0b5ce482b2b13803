package shop.eda.order.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Order - an accepted order as stored by the order service.
 * Immutable; status and publish attempts change by creating a copy.
 */
public record Order(
    @JsonProperty("order_id") String orderId,
    @JsonProperty("item_id") int itemId,
    @JsonProperty("name") String name,
    @JsonProperty("address") String address,
    @JsonProperty("quantity") int quantity,
    @JsonProperty("status") OrderStatus status,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("publish_attempts") int publishAttempts
) {

    public static Order created(String orderId, OrderRequest request, Instant createdAt) {
        return new Order(orderId, request.itemId(), request.name().trim(), request.address().trim(),
                request.quantity(), OrderStatus.CREATED, createdAt, 0);
    }

    public Order withStatus(OrderStatus newStatus) {
        return new Order(orderId, itemId, name, address, quantity, newStatus, createdAt, publishAttempts);
    }

    public Order withPublishAttempts(int attempts) {
        return new Order(orderId, itemId, name, address, quantity, status, createdAt, attempts);
    }
}
