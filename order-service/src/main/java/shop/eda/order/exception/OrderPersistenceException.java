package shop.eda.order.exception;

import lombok.Getter;

/**
 * OrderPersistenceException
 * Raised by an order store when a write could not be completed. Retryable.
 */
@Getter
public class OrderPersistenceException extends RuntimeException {

    private final String orderId;

    public OrderPersistenceException(String orderId, String message, Throwable cause) {
        super(message, cause);
        this.orderId = orderId;
    }

    public OrderPersistenceException(String orderId, String message) {
        this(orderId, message, null);
    }
}
