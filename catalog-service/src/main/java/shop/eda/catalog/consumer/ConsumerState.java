package shop.eda.catalog.consumer;

/**
 * IDLE -> FETCHING -> APPLYING -> IDLE; STOPPED only after an explicit stop.
 */
public enum ConsumerState {
    IDLE,
    FETCHING,
    APPLYING,
    STOPPED
}
