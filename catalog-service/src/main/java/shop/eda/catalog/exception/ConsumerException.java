package shop.eda.catalog.exception;

import lombok.Getter;

/**
 * ConsumerException
 * Raised when a consumed record cannot be turned into a valid event.
 * The record is skipped; the loop keeps running.
 */
@Getter
public class ConsumerException extends RuntimeException {

    private final String topic;
    private final int partition;
    private final long offset;

    public ConsumerException(String topic, int partition, long offset, String message, Throwable cause) {
        super(message, cause);
        this.topic = topic;
        this.partition = partition;
        this.offset = offset;
    }
}
