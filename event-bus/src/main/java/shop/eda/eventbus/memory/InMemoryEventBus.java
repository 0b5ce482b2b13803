package shop.eda.eventbus.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shop.eda.eventbus.EventBusClient;
import shop.eda.eventbus.EventRecord;
import shop.eda.eventbus.EventStream;
import shop.eda.eventbus.PublishReceipt;
import shop.eda.eventbus.codec.EventCodec;
import shop.eda.eventbus.exception.EventBusException;
import shop.eda.eventbus.exception.PublishException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * InMemoryEventBus
 * In-process partitioned log with per-group committed offsets.
 * Records are never deleted; the partition of a record is chosen from the hash
 * of its key, so records sharing a key keep their publish order.
 *
 * {@link #setAvailable(boolean)} simulates a broker outage: publishing, subscribing
 * and polling fail while the bus is unavailable.
 */
public class InMemoryEventBus implements EventBusClient {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventBus.class);

    private static final int MAX_BATCH = 100;

    private final int partitionsPerTopic;
    private final EventCodec codec;
    private final Map<String, PartitionLog[]> topics = new ConcurrentHashMap<>();
    private final Map<String, Long> committedOffsets = new ConcurrentHashMap<>();
    private volatile boolean available = true;

    public InMemoryEventBus(int partitionsPerTopic, EventCodec codec) {
        if (partitionsPerTopic < 1) {
            throw new IllegalArgumentException("partitionsPerTopic must be >= 1");
        }
        this.partitionsPerTopic = partitionsPerTopic;
        this.codec = codec;
    }

    public InMemoryEventBus() {
        this(1, new EventCodec());
    }

    public void setAvailable(boolean available) {
        this.available = available;
        logger.info("In-memory event bus available={}", available);
    }

    public boolean isAvailable() {
        return available;
    }

    @Override
    public PublishReceipt publish(String topic, String key, Object event) {
        return publishRaw(topic, key, codec.encode(topic, event), Map.of());
    }

    @Override
    public PublishReceipt publishRaw(String topic, String key, String payload, Map<String, String> headers) {
        if (!available) {
            throw new PublishException("UNAVAILABLE", topic, key, "Event bus is unavailable", false, null);
        }
        PartitionLog[] logs = logs(topic);
        int partition = key == null ? 0 : Math.floorMod(key.hashCode(), logs.length);
        long offset = logs[partition].append(topic, partition, key, payload);
        return new PublishReceipt(topic, partition, offset);
    }

    @Override
    public int partitionCount(String topic) {
        ensureAvailable(topic);
        return logs(topic).length;
    }

    @Override
    public long committedOffset(String topic, int partition, String group) {
        ensureAvailable(topic);
        return committedOffsets.getOrDefault(offsetKey(topic, partition, group), 0L);
    }

    @Override
    public long earliestOffset(String topic, int partition) {
        ensureAvailable(topic);
        return 0L;
    }

    @Override
    public EventStream subscribe(String topic, int partition, long fromOffset, String group) {
        ensureAvailable(topic);
        PartitionLog[] logs = logs(topic);
        if (partition < 0 || partition >= logs.length) {
            throw new EventBusException(topic, "Unknown partition " + partition);
        }
        return new InMemoryEventStream(topic, logs[partition], offsetKey(topic, partition, group), fromOffset);
    }

    /**
     * @return every record of the topic, partition by partition
     */
    public List<EventRecord> records(String topic) {
        List<EventRecord> all = new ArrayList<>();
        for (PartitionLog log : logs(topic)) {
            all.addAll(log.read(0, Integer.MAX_VALUE));
        }
        return all;
    }

    private PartitionLog[] logs(String topic) {
        return topics.computeIfAbsent(topic, t -> {
            PartitionLog[] logs = new PartitionLog[partitionsPerTopic];
            for (int i = 0; i < logs.length; i++) {
                logs[i] = new PartitionLog();
            }
            return logs;
        });
    }

    private void ensureAvailable(String topic) {
        if (!available) {
            throw new EventBusException(topic, "Event bus is unavailable");
        }
    }

    private static String offsetKey(String topic, int partition, String group) {
        return group + "|" + topic + "|" + partition;
    }

    private static final class PartitionLog {

        private final List<EventRecord> records = new ArrayList<>();

        synchronized long append(String topic, int partition, String key, String payload) {
            long offset = records.size();
            records.add(new EventRecord(topic, partition, offset, key, payload));
            notifyAll();
            return offset;
        }

        synchronized List<EventRecord> read(long fromOffset, int max) {
            int from = (int) Math.min(fromOffset, records.size());
            int to = (int) Math.min((long) from + max, records.size());
            return new ArrayList<>(records.subList(from, to));
        }

        synchronized List<EventRecord> await(long fromOffset, int max, Duration timeout) throws InterruptedException {
            long deadline = System.nanoTime() + timeout.toNanos();
            while (records.size() <= fromOffset) {
                long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
                if (remainingMs <= 0) {
                    return List.of();
                }
                wait(remainingMs);
            }
            return read(fromOffset, max);
        }
    }

    private final class InMemoryEventStream implements EventStream {

        private final String topic;
        private final PartitionLog log;
        private final String offsetKey;
        private long position;
        private boolean closed;

        private InMemoryEventStream(String topic, PartitionLog log, String offsetKey, long fromOffset) {
            this.topic = topic;
            this.log = log;
            this.offsetKey = offsetKey;
            this.position = fromOffset;
        }

        @Override
        public List<EventRecord> poll(Duration timeout) {
            if (closed) {
                throw new IllegalStateException("Stream is closed");
            }
            ensureAvailable(topic);
            try {
                List<EventRecord> batch = log.await(position, MAX_BATCH, timeout);
                if (!batch.isEmpty()) {
                    position = batch.get(batch.size() - 1).offset() + 1;
                }
                return batch;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return List.of();
            }
        }

        @Override
        public void commit(long nextOffset) {
            ensureAvailable(topic);
            committedOffsets.put(offsetKey, nextOffset);
        }

        @Override
        public long position() {
            return position;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
