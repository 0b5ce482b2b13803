package shop.eda.catalog.consumer;

import io.github.resilience4j.core.IntervalFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import shop.eda.catalog.config.CatalogProperties;
import shop.eda.catalog.model.response.PartitionStatus;
import shop.eda.catalog.store.CatalogStore;
import shop.eda.eventbus.EventBusClient;
import shop.eda.eventbus.exception.EventBusException;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ConsumerLoopManager
 * Starts one {@link OrderEventConsumerLoop} per partition of the orders topic, each on
 * its own thread, and stops them cooperatively on shutdown.
 *
 * Partition discovery runs in the background and keeps retrying with exponential
 * backoff, so the service starts (and serves the catalog) while the broker is down.
 */
@Component
public class ConsumerLoopManager implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(ConsumerLoopManager.class);

    private final EventBusClient eventBusClient;
    private final OrderEventDecoder decoder;
    private final CatalogStore catalogStore;
    private final DeadLetterPublisher deadLetterPublisher;
    private final CatalogProperties.Consumer settings;
    private final String topic;
    private final String group;
    private final IntervalFunction backoff;

    private final List<OrderEventConsumerLoop> loops = new CopyOnWriteArrayList<>();
    private volatile ExecutorService executor;
    private volatile CountDownLatch stopSignal;
    private volatile boolean running;

    public ConsumerLoopManager(EventBusClient eventBusClient,
                               OrderEventDecoder decoder,
                               CatalogStore catalogStore,
                               DeadLetterPublisher deadLetterPublisher,
                               CatalogProperties properties,
                               @Value("${kafka.topic.name:orders}") String topic,
                               @Value("${spring.kafka.consumer.group-id:catalog-service}") String group) {
        this.eventBusClient = eventBusClient;
        this.decoder = decoder;
        this.catalogStore = catalogStore;
        this.deadLetterPublisher = deadLetterPublisher;
        this.settings = properties.getConsumer();
        this.topic = topic;
        this.group = group;
        this.backoff = IntervalFunction.ofExponentialBackoff(
                settings.getInitialBackoff().toMillis(), 2.0, settings.getMaxBackoff().toMillis());
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        AtomicInteger threadCount = new AtomicInteger();
        executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "order-consumer-" + threadCount.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        stopSignal = new CountDownLatch(1);
        running = true;
        executor.submit(this::discoverAndLaunch);
        logger.info("Consumer loop manager started for topic={} group={}", topic, group);
    }

    private void discoverAndLaunch() {
        int attempt = 0;
        while (running) {
            try {
                int partitions = eventBusClient.partitionCount(topic);
                if (running) {
                    launch(partitions);
                }
                return;
            } catch (EventBusException e) {
                attempt++;
                long waitMs = backoff.apply(attempt);
                logger.warn("Partition discovery for topic={} failed (attempt {}): {} - retrying in {}ms",
                        topic, attempt, e.getMessage(), waitMs);
                try {
                    stopSignal.await(waitMs, TimeUnit.MILLISECONDS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    private synchronized void launch(int partitions) {
        if (!running) {
            return;
        }
        DeadLetterPublisher dlt = settings.isDeadLetterEnabled() ? deadLetterPublisher : null;
        for (int partition = 0; partition < partitions; partition++) {
            OrderEventConsumerLoop loop = new OrderEventConsumerLoop(eventBusClient, decoder, catalogStore, dlt,
                    topic, partition, group, settings.getPollTimeout(), backoff);
            loops.add(loop);
            executor.submit(loop);
        }
        logger.info("Launched {} consumer loop(s) for topic={}", partitions, topic);
    }

    /**
     * Lets every loop finish and commit its current batch, then waits for them to exit.
     * Waiting happens outside the monitor.
     */
    @Override
    public void stop() {
        List<OrderEventConsumerLoop> stopping;
        ExecutorService stoppingExecutor;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            stopSignal.countDown();
            stopping = List.copyOf(loops);
            stoppingExecutor = executor;
        }
        stopping.forEach(OrderEventConsumerLoop::requestStop);

        Duration timeout = settings.getShutdownTimeout();
        try {
            for (OrderEventConsumerLoop loop : stopping) {
                if (!loop.awaitStopped(timeout)) {
                    logger.warn("Consumer loop partition={} did not stop within {}", loop.getPartition(), timeout);
                }
            }
            stoppingExecutor.shutdown();
            if (!stoppingExecutor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                stoppingExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            stoppingExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        loops.removeAll(stopping);
        logger.info("Consumer loop manager stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return settings.isAutoStartup();
    }

    public List<PartitionStatus> statuses() {
        return loops.stream()
                .map(OrderEventConsumerLoop::status)
                .sorted(Comparator.comparingInt(PartitionStatus::partition))
                .toList();
    }

    /**
     * @return true once loops are launched and none has stopped
     */
    public boolean isConsuming() {
        return running && !loops.isEmpty()
                && loops.stream().noneMatch(loop -> loop.getState() == ConsumerState.STOPPED);
    }
}
