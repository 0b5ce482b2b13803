package shop.eda.eventbus.exception;

import lombok.Getter;

/**
 * PublishException
 * Raised when a publish was not acknowledged.
 * When {@code ambiguous} is set the record may still have been written
 * (e.g. a timeout after the request left the client).
 */
@Getter
public class PublishException extends EventBusException {

    private final String type;
    private final String key;
    private final boolean ambiguous;

    public PublishException(String type, String topic, String key, String message,
                            boolean ambiguous, Throwable cause) {
        super(topic, message, cause);
        this.type = type;
        this.key = key;
        this.ambiguous = ambiguous;
    }
}
