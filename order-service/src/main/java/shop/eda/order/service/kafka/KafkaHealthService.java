package shop.eda.order.service.kafka;

import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.TopicDescription;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import shop.eda.order.model.response.HealthCheck;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * KafkaHealthService
 * Readiness of the orders topic: broker reachable and topic present.
 * Checked with short AdminClient timeouts; the result is cached so probes
 * do not hit the broker on every call.
 */
@Service
public class KafkaHealthService {

    private static final Logger logger = LoggerFactory.getLogger(KafkaHealthService.class);

    private final String bootstrapServers;
    private final String transport;
    private final String topicName;
    private final long timeoutMs;
    private final long cacheTtlMs;

    private volatile long lastCheckedAtMs = 0;
    private volatile HealthCheck lastStatus = new HealthCheck("DOWN", "Not checked yet");

    public KafkaHealthService(@Value("${spring.kafka.bootstrap-servers:localhost:9092}") String bootstrapServers,
                              @Value("${event-bus.transport:kafka}") String transport,
                              @Value("${kafka.topic.name:orders}") String topicName,
                              @Value("${producer.health.timeout.ms:1000}") long timeoutMs,
                              @Value("${producer.health.cache.ttl.ms:2000}") long cacheTtlMs) {
        this.bootstrapServers = bootstrapServers;
        this.transport = transport;
        this.topicName = topicName;
        this.timeoutMs = timeoutMs;
        this.cacheTtlMs = cacheTtlMs;
    }

    public HealthCheck getServiceStatus() {
        return new HealthCheck("UP", "Order Service is accepting requests");
    }

    public synchronized HealthCheck getKafkaStatus() {
        if (!"kafka".equals(transport)) {
            return new HealthCheck("UP", "in-memory transport");
        }
        long now = System.currentTimeMillis();
        if (now - lastCheckedAtMs > cacheTtlMs) {
            HealthCheck status = checkTopic();
            if ("DOWN".equals(status.status())) {
                logger.warn("Kafka readiness DOWN for topic={}: {}", topicName, status.details());
            }
            lastStatus = status;
            lastCheckedAtMs = now;
        }
        return lastStatus;
    }

    private HealthCheck checkTopic() {
        Map<String, Object> props = new HashMap<>();
        props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, (int) timeoutMs);
        props.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, (int) timeoutMs);

        try (AdminClient admin = AdminClient.create(props)) {
            admin.describeCluster().nodes().get(timeoutMs, TimeUnit.MILLISECONDS);
            TopicDescription topic = admin.describeTopics(List.of(topicName))
                    .allTopicNames()
                    .get(timeoutMs, TimeUnit.MILLISECONDS)
                    .get(topicName);
            return new HealthCheck("UP", "topic '" + topicName + "' has " + topic.partitions().size() + " partition(s)");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new HealthCheck("DOWN", "Interrupted during health check");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof UnknownTopicOrPartitionException) {
                return new HealthCheck("DOWN", "topic '" + topicName + "' does not exist");
            }
            return new HealthCheck("DOWN", "Kafka error: " + e.getCause().getMessage());
        } catch (TimeoutException e) {
            return new HealthCheck("DOWN", "Kafka unreachable at " + bootstrapServers);
        } catch (RuntimeException e) {
            return new HealthCheck("DOWN", e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
