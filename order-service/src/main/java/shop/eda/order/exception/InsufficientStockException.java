package shop.eda.order.exception;

import lombok.Getter;

@Getter
public class InsufficientStockException extends RuntimeException {

    private final int itemId;
    private final int requested;
    private final int available;

    public InsufficientStockException(int itemId, int requested, int available) {
        super("Item " + itemId + " has " + available + " in stock, " + requested + " requested");
        this.itemId = itemId;
        this.requested = requested;
        this.available = available;
    }
}
