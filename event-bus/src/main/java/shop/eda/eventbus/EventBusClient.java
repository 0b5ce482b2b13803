package shop.eda.eventbus;

import shop.eda.eventbus.exception.EventBusException;
import shop.eda.eventbus.exception.PublishException;

import java.util.Map;

/**
 * EventBusClient
 * Publish/subscribe access to a durable, partitioned, append-only log.
 *
 * Delivery is at-least-once: a publish that times out may still have been
 * written, so consumers must deduplicate. Implementations own connection
 * lifecycle and serialization.
 */
public interface EventBusClient {

    /**
     * Serializes the event as JSON and publishes it.
     * Returns only after the broker acknowledged the durable write.
     *
     * @param topic destination topic
     * @param key   partition key (records with the same key keep their relative order)
     * @param event payload object
     * @return where the record landed
     * @throws PublishException if the write failed or its outcome is unknown
     */
    PublishReceipt publish(String topic, String key, Object event);

    /**
     * Publishes an already serialized payload with extra headers.
     */
    PublishReceipt publishRaw(String topic, String key, String payload, Map<String, String> headers);

    /**
     * @return number of partitions of the topic
     * @throws EventBusException if the broker cannot be reached
     */
    int partitionCount(String topic);

    /**
     * Position a consumer group should resume from: the committed offset, or the
     * earliest retained offset when the group never committed on this partition.
     */
    long committedOffset(String topic, int partition, String group);

    /**
     * @return offset of the oldest record still retained on the partition
     * @throws EventBusException if the broker cannot be reached
     */
    long earliestOffset(String topic, int partition);

    /**
     * Opens a lazy stream over one partition starting at {@code fromOffset}.
     * Nothing is fetched until {@link EventStream#poll} is called; a closed stream
     * can be replaced by subscribing again from the committed offset.
     */
    EventStream subscribe(String topic, int partition, long fromOffset, String group);
}
