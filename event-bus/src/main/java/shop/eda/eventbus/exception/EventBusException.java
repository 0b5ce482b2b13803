package shop.eda.eventbus.exception;

import lombok.Getter;

/**
 * EventBusException
 * Raised when the broker cannot be reached or a transport operation fails.
 */
@Getter
public class EventBusException extends RuntimeException {

    private final String topic;

    public EventBusException(String topic, String message, Throwable cause) {
        super(message, cause);
        this.topic = topic;
    }

    public EventBusException(String topic, String message) {
        this(topic, message, null);
    }
}
