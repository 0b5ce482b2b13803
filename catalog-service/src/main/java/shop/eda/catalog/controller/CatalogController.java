package shop.eda.catalog.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import shop.eda.catalog.consumer.ConsumerLoopManager;
import shop.eda.catalog.exception.ProductNotFoundException;
import shop.eda.catalog.model.Product;
import shop.eda.catalog.model.response.HealthCheck;
import shop.eda.catalog.model.response.HealthResponse;
import shop.eda.catalog.service.HealthService;
import shop.eda.catalog.store.CatalogStore;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CatalogController
 * Read-only catalog API. Queries are served from the in-memory store and never
 * wait on the event bus.
 */
@RestController
public class CatalogController {

    private static final Logger logger = LoggerFactory.getLogger(CatalogController.class);

    private static final String SERVICE_NAME = "Catalog Service";

    private final CatalogStore catalogStore;
    private final ConsumerLoopManager consumerLoopManager;
    private final HealthService healthService;

    public CatalogController(CatalogStore catalogStore,
                             ConsumerLoopManager consumerLoopManager,
                             HealthService healthService) {
        this.catalogStore = catalogStore;
        this.consumerLoopManager = consumerLoopManager;
        this.healthService = healthService;
    }

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("service", SERVICE_NAME);
        response.put("version", "0.0.1-SNAPSHOT");
        response.put("timestamp", Instant.now().toString());
        response.put("endpoints", List.of(
                "GET /catalog",
                "GET /catalog/stock/{itemId}",
                "GET /catalog/consumer/status",
                "GET /health/live",
                "GET /health/ready"
        ));
        return ResponseEntity.ok(response);
    }

    /**
     * Full catalog, sorted by product id.
     * GET /catalog
     */
    @GetMapping("/catalog")
    public ResponseEntity<List<Product>> getCatalog() {
        List<Product> products = catalogStore.snapshot();
        logger.debug("Serving catalog with {} products", products.size());
        return ResponseEntity.ok(products);
    }

    /**
     * Current stock of one product.
     * GET /catalog/stock/{itemId}
     */
    @GetMapping("/catalog/stock/{itemId}")
    public ResponseEntity<Integer> getStock(@PathVariable int itemId) {
        Product product = catalogStore.find(itemId).orElseThrow(() -> new ProductNotFoundException(itemId));
        return ResponseEntity.ok(product.quantity());
    }

    /**
     * GET /catalog/consumer/status
     */
    @GetMapping("/catalog/consumer/status")
    public ResponseEntity<Map<String, Object>> consumerStatus() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("running", consumerLoopManager.isRunning());
        response.put("consuming", consumerLoopManager.isConsuming());
        response.put("partitions", consumerLoopManager.statuses());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/health/live")
    public ResponseEntity<HealthResponse> live() {
        HealthResponse response = new HealthResponse(
                SERVICE_NAME,
                "liveness",
                "UP",
                Instant.now().toString(),
                Map.of("service", healthService.getServiceStatus())
        );
        return ResponseEntity.ok(response);
    }

    /**
     * Ready when the broker is reachable and the consumer loops are running.
     */
    @GetMapping("/health/ready")
    public ResponseEntity<HealthResponse> ready() {
        HealthCheck serviceStatus = healthService.getServiceStatus();
        HealthCheck kafkaStatus = healthService.getKafkaStatus();
        HealthCheck consumerStatus = healthService.getConsumerStatus();

        boolean ready = "UP".equals(kafkaStatus.status()) && "UP".equals(consumerStatus.status());

        HealthResponse response = new HealthResponse(
                SERVICE_NAME,
                "readiness",
                ready ? "UP" : "DOWN",
                Instant.now().toString(),
                Map.of("service", serviceStatus, "kafka", kafkaStatus, "consumer", consumerStatus)
        );
        return ResponseEntity.status(ready ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }
}
