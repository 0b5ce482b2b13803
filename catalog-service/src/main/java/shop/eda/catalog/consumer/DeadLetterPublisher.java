package shop.eda.catalog.consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import shop.eda.eventbus.EventBusClient;
import shop.eda.eventbus.EventRecord;
import shop.eda.eventbus.PublishReceipt;
import shop.eda.eventbus.exception.EventBusException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * DeadLetterPublisher
 * Forwards records that could not be decoded to the dead-letter topic, keeping
 * the original key and payload and adding where the record came from and why it failed.
 * Failure to dead-letter is logged and never stops the consumer loop.
 */
@Component
public class DeadLetterPublisher {

    private static final Logger logger = LoggerFactory.getLogger(DeadLetterPublisher.class);

    private final EventBusClient eventBusClient;
    private final String dltTopicName;

    public DeadLetterPublisher(EventBusClient eventBusClient,
                               @Value("${kafka.dlt.topic.name:orders-dlt}") String dltTopicName) {
        this.eventBusClient = eventBusClient;
        this.dltTopicName = dltTopicName;
    }

    /**
     * @return true if the broker acknowledged the dead-letter record
     */
    public boolean publish(EventRecord record, String errorReason) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("original-topic", record.topic());
        headers.put("original-partition", String.valueOf(record.partition()));
        headers.put("original-offset", String.valueOf(record.offset()));
        headers.put("error-reason", errorReason);
        headers.put("failed-at", String.valueOf(System.currentTimeMillis()));

        String payload = record.payload() != null ? record.payload() : "";
        try {
            PublishReceipt receipt = eventBusClient.publishRaw(dltTopicName, record.key(), payload, headers);
            logger.warn("Malformed record sent to DLT. Topic={}, Key={}, DLTPartition={}, DLTOffset={}, " +
                            "OriginalPartition={}, OriginalOffset={}, Reason={}",
                    dltTopicName, record.key(), receipt.partition(), receipt.offset(),
                    record.partition(), record.offset(), errorReason);
            return true;
        } catch (EventBusException e) {
            logger.error("CRITICAL: Failed to send record to DLT. Topic={}, Key={}, OriginalPartition={}, " +
                            "OriginalOffset={}, Error={}",
                    dltTopicName, record.key(), record.partition(), record.offset(), e.getMessage());
            return false;
        }
    }
}
