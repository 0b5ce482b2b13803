package shop.eda.order.exception;

import lombok.Getter;
import shop.eda.eventbus.exception.PublishException;

/**
 * OrderPublicationPendingException
 * The order was stored but its event could not be published inline.
 * The order stays CREATED and the outbox keeps retrying in the background.
 */
@Getter
public class OrderPublicationPendingException extends RuntimeException {

    private final String orderId;
    private final String type;
    private final boolean ambiguous;

    public OrderPublicationPendingException(String orderId, PublishException cause) {
        super("Order " + orderId + " retained, publication will be retried", cause);
        this.orderId = orderId;
        this.type = cause.getType();
        this.ambiguous = cause.isAmbiguous();
    }
}
