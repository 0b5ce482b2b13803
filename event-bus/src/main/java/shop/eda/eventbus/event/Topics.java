package shop.eda.eventbus.event;

/**
 * Topic names shared by producers and consumers.
 */
public final class Topics {

    public static final String ORDERS = "orders";
    public static final String ORDERS_DLT = "orders-dlt";

    private Topics() {}
}
