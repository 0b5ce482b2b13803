package shop.eda.catalog.service;

import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import shop.eda.catalog.consumer.ConsumerLoopManager;
import shop.eda.catalog.model.response.HealthCheck;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HealthService - status of the service, the Kafka broker and the consumer loops.
 */
@Service
public class HealthService {

    private static final Logger logger = LoggerFactory.getLogger(HealthService.class);

    private final String bootstrapServers;
    private final String transport;
    private final long timeoutMs;
    private final long cacheTtlMs;
    private final ConsumerLoopManager consumerLoopManager;

    private volatile long lastCheckedAtMs = 0;
    private volatile HealthCheck lastKafkaStatus = new HealthCheck("DOWN", "Not checked yet");

    public HealthService(@Value("${spring.kafka.bootstrap-servers:localhost:9092}") String bootstrapServers,
                         @Value("${event-bus.transport:kafka}") String transport,
                         @Value("${catalog.health.timeout-ms:3000}") long timeoutMs,
                         @Value("${catalog.health.cache-ttl-ms:2000}") long cacheTtlMs,
                         ConsumerLoopManager consumerLoopManager) {
        this.bootstrapServers = bootstrapServers;
        this.transport = transport;
        this.timeoutMs = timeoutMs;
        this.cacheTtlMs = cacheTtlMs;
        this.consumerLoopManager = consumerLoopManager;
    }

    public HealthCheck getServiceStatus() {
        return new HealthCheck("UP", "Catalog Service is running and responsive");
    }

    /**
     * Broker reachability, re-checked at most once per cache TTL.
     */
    public synchronized HealthCheck getKafkaStatus() {
        if (!"kafka".equals(transport)) {
            return new HealthCheck("UP", "in-memory transport");
        }
        long now = System.currentTimeMillis();
        if (now - lastCheckedAtMs > cacheTtlMs) {
            lastKafkaStatus = checkKafka();
            lastCheckedAtMs = now;
        }
        return lastKafkaStatus;
    }

    private HealthCheck checkKafka() {
        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        adminProps.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, (int) timeoutMs);
        adminProps.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, (int) timeoutMs);
        adminProps.put(AdminClientConfig.CONNECTIONS_MAX_IDLE_MS_CONFIG, 1000);

        try (AdminClient admin = AdminClient.create(adminProps)) {
            admin.describeCluster().nodes().get(timeoutMs, TimeUnit.MILLISECONDS);
            logger.debug("Kafka broker is reachable at {}", bootstrapServers);
            return new HealthCheck("UP", "Kafka broker is accessible at " + bootstrapServers);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new HealthCheck("DOWN", "Interrupted while checking Kafka at " + bootstrapServers);
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("Kafka broker is unreachable at {}: {}", bootstrapServers, e.getMessage());
            return new HealthCheck("DOWN", "Kafka broker is unavailable at " + bootstrapServers);
        } catch (RuntimeException e) {
            logger.error("Error checking Kafka status", e);
            return new HealthCheck("DOWN", "Kafka broker is unavailable: " + e.getMessage());
        }
    }

    public HealthCheck getConsumerStatus() {
        if (consumerLoopManager.isConsuming()) {
            return new HealthCheck("UP", consumerLoopManager.statuses().size() + " consumer loop(s) running");
        }
        if (consumerLoopManager.isRunning()) {
            return new HealthCheck("DOWN", "waiting for partition assignment");
        }
        return new HealthCheck("DOWN", "consumer loops not running");
    }
}
