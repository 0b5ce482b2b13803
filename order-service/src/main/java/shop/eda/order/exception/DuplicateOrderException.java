package shop.eda.order.exception;

import lombok.Getter;

@Getter
public class DuplicateOrderException extends RuntimeException {

    private final String orderId;

    public DuplicateOrderException(String orderId) {
        super("Order already exists: " + orderId);
        this.orderId = orderId;
    }
}
