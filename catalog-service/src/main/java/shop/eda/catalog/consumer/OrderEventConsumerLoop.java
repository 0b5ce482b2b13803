package shop.eda.catalog.consumer;

import io.github.resilience4j.core.IntervalFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shop.eda.catalog.exception.ConsumerException;
import shop.eda.catalog.model.response.PartitionStatus;
import shop.eda.catalog.store.ApplyOutcome;
import shop.eda.catalog.store.CatalogStore;
import shop.eda.eventbus.EventBusClient;
import shop.eda.eventbus.EventRecord;
import shop.eda.eventbus.EventStream;
import shop.eda.eventbus.event.OrderPlacedEvent;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * OrderEventConsumerLoop
 * Sequentially applies the order events of one partition to the catalog.
 *
 * Each cycle polls a batch, decodes and applies every record, then commits the
 * offset after the last record. A crash between applying and committing re-delivers
 * the batch, which the catalog's dedup window absorbs. Malformed records are skipped
 * (and dead-lettered) without stopping the loop. When the event bus fails, the stream
 * is dropped and re-opened from the committed offset after an exponential backoff.
 *
 * The catalog lives in memory only, so the first subscription of a loop replays the
 * partition from its earliest retained offset to rebuild the store. Offsets below the
 * group's committed offset are never committed again.
 */
public class OrderEventConsumerLoop implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(OrderEventConsumerLoop.class);

    private final EventBusClient eventBusClient;
    private final OrderEventDecoder decoder;
    private final CatalogStore catalogStore;
    private final DeadLetterPublisher deadLetterPublisher;
    private final String topic;
    private final int partition;
    private final String group;
    private final Duration pollTimeout;
    private final IntervalFunction reconnectBackoff;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch stopped = new CountDownLatch(1);

    private volatile ConsumerState state = ConsumerState.IDLE;
    private volatile long committedOffset = -1;
    private volatile String lastError;

    // loop thread only
    private boolean replayed;

    private final AtomicLong applied = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong malformed = new AtomicLong();
    private final AtomicLong unknownProducts = new AtomicLong();
    private final AtomicLong clamped = new AtomicLong();

    /**
     * @param deadLetterPublisher may be null to only log malformed records
     */
    public OrderEventConsumerLoop(EventBusClient eventBusClient,
                                  OrderEventDecoder decoder,
                                  CatalogStore catalogStore,
                                  DeadLetterPublisher deadLetterPublisher,
                                  String topic,
                                  int partition,
                                  String group,
                                  Duration pollTimeout,
                                  IntervalFunction reconnectBackoff) {
        this.eventBusClient = eventBusClient;
        this.decoder = decoder;
        this.catalogStore = catalogStore;
        this.deadLetterPublisher = deadLetterPublisher;
        this.topic = topic;
        this.partition = partition;
        this.group = group;
        this.pollTimeout = pollTimeout;
        this.reconnectBackoff = reconnectBackoff;
    }

    @Override
    public void run() {
        logger.info("Consumer loop started topic={} partition={} group={}", topic, partition, group);
        EventStream stream = null;
        int failures = 0;
        try {
            while (!isStopRequested() && !Thread.currentThread().isInterrupted()) {
                try {
                    if (stream == null) {
                        stream = open();
                    }
                    runCycle(stream);
                    failures = 0;
                } catch (RuntimeException e) {
                    // Bus errors and anything unexpected: drop the stream, resume from the committed offset
                    failures++;
                    lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
                    closeQuietly(stream);
                    stream = null;
                    state = ConsumerState.IDLE;

                    long waitMs = reconnectBackoff.apply(failures);
                    logger.warn("Consumer loop partition={} failed (attempt {}): {} - reconnecting in {}ms",
                            partition, failures, lastError, waitMs);
                    awaitStop(waitMs);
                }
            }
        } finally {
            closeQuietly(stream);
            state = ConsumerState.STOPPED;
            stopped.countDown();
            logger.info("Consumer loop stopped topic={} partition={} committedOffset={}",
                    topic, partition, committedOffset);
        }
    }

    /**
     * One FETCHING -> APPLYING -> IDLE cycle.
     *
     * @return number of records handled
     */
    int runCycle(EventStream stream) {
        state = ConsumerState.FETCHING;
        List<EventRecord> batch = stream.poll(pollTimeout);
        if (batch.isEmpty()) {
            state = ConsumerState.IDLE;
            return 0;
        }

        state = ConsumerState.APPLYING;
        for (EventRecord record : batch) {
            handle(record);
        }

        long nextOffset = batch.get(batch.size() - 1).offset() + 1;
        if (nextOffset > committedOffset) {
            stream.commit(nextOffset);
            committedOffset = nextOffset;
            logger.debug("partition={} committed offset={} after {} records", partition, nextOffset, batch.size());
        } else {
            logger.debug("partition={} replayed {} records up to offset={}", partition, batch.size(), nextOffset);
        }
        lastError = null;

        state = ConsumerState.IDLE;
        return batch.size();
    }

    private EventStream open() {
        long committed = eventBusClient.committedOffset(topic, partition, group);
        long from = replayed ? committed : eventBusClient.earliestOffset(topic, partition);
        EventStream stream = eventBusClient.subscribe(topic, partition, from, group);
        if (!replayed) {
            logger.info("Rebuilding catalog from topic={} partition={}: replaying offsets {}..{}",
                    topic, partition, from, committed);
        }
        replayed = true;
        committedOffset = committed;
        logger.info("Subscribed to topic={} partition={} from offset={}", topic, partition, from);
        return stream;
    }

    private void handle(EventRecord record) {
        OrderPlacedEvent event;
        try {
            event = decoder.decode(record);
        } catch (ConsumerException e) {
            malformed.incrementAndGet();
            logger.error("Skipping malformed record topic={} partition={} offset={}: {}",
                    record.topic(), record.partition(), record.offset(), e.getMessage());
            if (deadLetterPublisher != null) {
                deadLetterPublisher.publish(record, e.getMessage());
            }
            return;
        }

        ApplyOutcome outcome = catalogStore.applyOrderPlaced(event.orderId(), event.itemId(), event.quantity());
        switch (outcome) {
            case APPLIED -> applied.incrementAndGet();
            case CLAMPED -> {
                applied.incrementAndGet();
                clamped.incrementAndGet();
            }
            case DUPLICATE -> duplicates.incrementAndGet();
            case UNKNOWN_PRODUCT -> unknownProducts.incrementAndGet();
        }
        logger.debug("orderId={} partition={} offset={} -> {}",
                event.orderId(), record.partition(), record.offset(), outcome);
    }

    /**
     * Asks the loop to finish its current batch and exit.
     */
    public void requestStop() {
        stopSignal.countDown();
    }

    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isStopRequested() {
        return stopSignal.getCount() == 0;
    }

    public ConsumerState getState() {
        return state;
    }

    public int getPartition() {
        return partition;
    }

    public PartitionStatus status() {
        return new PartitionStatus(topic, partition, state, committedOffset,
                applied.get(), duplicates.get(), malformed.get(), unknownProducts.get(), clamped.get(),
                lastError);
    }

    private void awaitStop(long waitMs) {
        try {
            stopSignal.await(waitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopSignal.countDown();
        }
    }

    private void closeQuietly(EventStream stream) {
        if (stream == null) {
            return;
        }
        try {
            stream.close();
        } catch (RuntimeException e) {
            logger.warn("Error closing stream for partition {}: {}", partition, e.getMessage());
        }
    }
}
