package shop.eda.eventbus.kafka;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shop.eda.eventbus.EventRecord;
import shop.eda.eventbus.EventStream;
import shop.eda.eventbus.exception.EventBusException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Stream over one manually assigned partition. Assignment and seek happen up
 * front; nothing is fetched before the first poll.
 */
class KafkaEventStream implements EventStream {

    private static final Logger logger = LoggerFactory.getLogger(KafkaEventStream.class);

    private final Consumer<String, String> consumer;
    private final TopicPartition topicPartition;
    private long position;

    KafkaEventStream(Consumer<String, String> consumer, TopicPartition topicPartition, long fromOffset) {
        this.consumer = consumer;
        this.topicPartition = topicPartition;
        this.position = fromOffset;
        try {
            consumer.assign(List.of(topicPartition));
            consumer.seek(topicPartition, fromOffset);
        } catch (KafkaException e) {
            consumer.close(KafkaEventBusClient.closeTimeout());
            throw new EventBusException(topicPartition.topic(), "Failed to assign " + topicPartition, e);
        }
    }

    @Override
    public List<EventRecord> poll(Duration timeout) {
        ConsumerRecords<String, String> records;
        try {
            records = consumer.poll(timeout);
        } catch (KafkaException e) {
            throw new EventBusException(topicPartition.topic(), "Poll failed on " + topicPartition, e);
        }

        List<EventRecord> batch = new ArrayList<>(records.count());
        for (ConsumerRecord<String, String> record : records.records(topicPartition)) {
            batch.add(new EventRecord(record.topic(), record.partition(), record.offset(), record.key(), record.value()));
            position = record.offset() + 1;
        }
        return batch;
    }

    @Override
    public void commit(long nextOffset) {
        try {
            consumer.commitSync(Map.of(topicPartition, new OffsetAndMetadata(nextOffset)));
            logger.debug("Committed {} at offset={}", topicPartition, nextOffset);
        } catch (KafkaException e) {
            throw new EventBusException(topicPartition.topic(), "Commit failed on " + topicPartition, e);
        }
    }

    @Override
    public long position() {
        return position;
    }

    @Override
    public void close() {
        try {
            consumer.close(KafkaEventBusClient.closeTimeout());
        } catch (KafkaException e) {
            logger.warn("Error while closing consumer for {}: {}", topicPartition, e.getMessage());
        }
    }
}
