package shop.eda.eventbus.kafka;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import shop.eda.eventbus.EventBusClient;
import shop.eda.eventbus.EventStream;
import shop.eda.eventbus.PublishReceipt;
import shop.eda.eventbus.codec.EventCodec;
import shop.eda.eventbus.exception.EventBusException;
import shop.eda.eventbus.exception.PublishException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * KafkaEventBusClient
 * Kafka transport: publishes through a {@link KafkaTemplate} and blocks until the
 * broker acknowledges the write; reads through one manually assigned consumer per stream.
 */
public class KafkaEventBusClient implements EventBusClient {

    private static final Logger logger = LoggerFactory.getLogger(KafkaEventBusClient.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ConsumerFactory<String, String> consumerFactory;
    private final EventCodec codec;
    private final long sendTimeoutMs;

    public KafkaEventBusClient(KafkaTemplate<String, String> kafkaTemplate,
                               ConsumerFactory<String, String> consumerFactory,
                               EventCodec codec,
                               long sendTimeoutMs) {
        this.kafkaTemplate = kafkaTemplate;
        this.consumerFactory = consumerFactory;
        this.codec = codec;
        this.sendTimeoutMs = sendTimeoutMs;
    }

    @Override
    public PublishReceipt publish(String topic, String key, Object event) {
        return publishRaw(topic, key, codec.encode(topic, event), Map.of());
    }

    @Override
    public PublishReceipt publishRaw(String topic, String key, String payload, Map<String, String> headers) {
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, key, payload);
        headers.forEach((name, value) -> record.headers().add(name, value.getBytes(StandardCharsets.UTF_8)));

        try {
            SendResult<String, String> result = kafkaTemplate.send(record).get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            RecordMetadata metadata = result.getRecordMetadata();

            logger.debug("Published to topic={} partition={} offset={} key={}",
                    metadata.topic(), metadata.partition(), metadata.offset(), key);
            return new PublishReceipt(metadata.topic(), metadata.partition(), metadata.offset());

        } catch (TimeoutException e) {
            throw new PublishException("TIMEOUT", topic, key,
                    "No acknowledgment within " + sendTimeoutMs + "ms", true, e);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishException("INTERRUPTED", topic, key,
                    "Interrupted while waiting for acknowledgment", true, e);

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            boolean ambiguous = hasCause(cause, org.apache.kafka.common.errors.TimeoutException.class);
            throw new PublishException("KAFKA_ERROR", topic, key,
                    "Broker rejected or failed the write: " + cause.getMessage(), ambiguous, cause);

        } catch (KafkaException e) {
            // Raised synchronously by send(), e.g. metadata not available within max.block.ms
            throw new PublishException("KAFKA_ERROR", topic, key,
                    "Failed to hand record to producer: " + e.getMessage(), false, e);
        }
    }

    @Override
    public int partitionCount(String topic) {
        try {
            List<PartitionInfo> partitions = kafkaTemplate.partitionsFor(topic);
            if (partitions == null || partitions.isEmpty()) {
                throw new EventBusException(topic, "Topic has no partitions or does not exist");
            }
            return partitions.size();
        } catch (KafkaException e) {
            throw new EventBusException(topic, "Failed to read partition metadata", e);
        }
    }

    @Override
    public long committedOffset(String topic, int partition, String group) {
        TopicPartition tp = new TopicPartition(topic, partition);
        try (Consumer<String, String> consumer = consumerFactory.createConsumer(group, null, "-offsets")) {
            Map<TopicPartition, OffsetAndMetadata> committed = consumer.committed(Set.of(tp));
            OffsetAndMetadata offset = committed.get(tp);
            if (offset != null) {
                return offset.offset();
            }
            return consumer.beginningOffsets(List.of(tp)).get(tp);
        } catch (KafkaException e) {
            throw new EventBusException(topic, "Failed to read committed offset for partition " + partition, e);
        }
    }

    @Override
    public long earliestOffset(String topic, int partition) {
        TopicPartition tp = new TopicPartition(topic, partition);
        try (Consumer<String, String> consumer = consumerFactory.createConsumer(null, null, "-earliest")) {
            return consumer.beginningOffsets(List.of(tp)).get(tp);
        } catch (KafkaException e) {
            throw new EventBusException(topic, "Failed to read earliest offset for partition " + partition, e);
        }
    }

    @Override
    public EventStream subscribe(String topic, int partition, long fromOffset, String group) {
        try {
            Consumer<String, String> consumer = consumerFactory.createConsumer(group, null, "-p" + partition);
            return new KafkaEventStream(consumer, new TopicPartition(topic, partition), fromOffset);
        } catch (KafkaException e) {
            throw new EventBusException(topic, "Failed to open stream for partition " + partition, e);
        }
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        Throwable current = error;
        while (current != null) {
            if (type.isInstance(current)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    static Duration closeTimeout() {
        return Duration.ofSeconds(5);
    }
}
