package shop.eda.catalog.model.response;

import shop.eda.catalog.consumer.ConsumerState;

/**
 * Snapshot of one consumer loop, reported by GET /catalog/consumer/status.
 * {@code committedOffset} is -1 until the loop has subscribed.
 */
public record PartitionStatus(
    String topic,
    int partition,
    ConsumerState state,
    long committedOffset,
    long applied,
    long duplicates,
    long malformed,
    long unknownProducts,
    long clamped,
    String lastError
) {}
