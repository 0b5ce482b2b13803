package shop.eda.order.exception;

import lombok.Getter;

/**
 * OrderValidationException
 * Raised when a well-formed request refers to something the shop does not know,
 * e.g. an item id missing from the catalog.
 */
@Getter
public class OrderValidationException extends RuntimeException {

    private final String field;

    public OrderValidationException(String field, String message) {
        super(message);
        this.field = field;
    }
}
