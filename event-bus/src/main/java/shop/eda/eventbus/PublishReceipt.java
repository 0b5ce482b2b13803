package shop.eda.eventbus;

/**
 * PublishReceipt - broker acknowledgment of a durable write.
 */
public record PublishReceipt(
        String topic,
        int partition,
        long offset
) {}
