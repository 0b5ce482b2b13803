package shop.eda.order.model;

/**
 * Lifecycle of an accepted order. CREATED is the only state an order enters with;
 * FAILED is set when its event could not be published within the retry budget.
 */
public enum OrderStatus {
    CREATED,
    FAILED
}
