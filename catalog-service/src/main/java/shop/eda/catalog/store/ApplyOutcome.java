package shop.eda.catalog.store;

/**
 * Result of applying one order event to the catalog.
 */
public enum ApplyOutcome {
    /** Stock decremented. */
    APPLIED,
    /** Stock would have gone negative and was floored at 0. */
    CLAMPED,
    /** Order id already applied; nothing changed. */
    DUPLICATE,
    /** No product with that id; recorded as applied so it is not reported again. */
    UNKNOWN_PRODUCT
}
