package shop.eda.order.controller;

import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import shop.eda.order.model.Order;
import shop.eda.order.model.OrderRequest;
import shop.eda.order.model.response.HealthCheck;
import shop.eda.order.model.response.HealthResponse;
import shop.eda.order.service.kafka.KafkaHealthService;
import shop.eda.order.service.order.OrderService;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OrderController
 * REST API endpoints for order intake.
 */
@RestController
public class OrderController {

    private static final Logger logger = LoggerFactory.getLogger(OrderController.class);

    private static final String SERVICE_NAME = "Order Service";

    private final OrderService orderService;
    private final KafkaHealthService kafkaHealthService;

    public OrderController(OrderService orderService, KafkaHealthService kafkaHealthService) {
        this.orderService = orderService;
        this.kafkaHealthService = kafkaHealthService;
    }

    /**
     * Service metadata and the list of available endpoints.
     * GET /
     */
    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("service", SERVICE_NAME);
        response.put("version", "0.0.1-SNAPSHOT");
        response.put("timestamp", Instant.now().toString());
        response.put("endpoints", List.of(
                endpoint("POST", "/order", "Place an order; publishes one order-placed event"),
                endpoint("GET", "/order/{orderId}", "Look up an accepted order and its status"),
                endpoint("GET", "/health/live", "Liveness probe"),
                endpoint("GET", "/health/ready", "Readiness probe - Kafka reachable and topic exists")
        ));
        return ResponseEntity.ok(response);
    }

    /**
     * Liveness - app is running (does not depend on Kafka).
     * GET /health/live
     */
    @GetMapping("/health/live")
    public ResponseEntity<HealthResponse> live() {
        HealthResponse response = new HealthResponse(
                SERVICE_NAME,
                "liveness",
                "UP",
                Instant.now().toString(),
                Map.of("service", kafkaHealthService.getServiceStatus())
        );
        return ResponseEntity.ok(response);
    }

    /**
     * Readiness - 200 when the event bus can take orders, otherwise 503.
     * GET /health/ready
     */
    @GetMapping("/health/ready")
    public ResponseEntity<HealthResponse> ready() {
        HealthCheck serviceStatus = kafkaHealthService.getServiceStatus();
        HealthCheck kafkaStatus = kafkaHealthService.getKafkaStatus();

        boolean isKafkaUp = "UP".equals(kafkaStatus.status());

        HealthResponse response = new HealthResponse(
                SERVICE_NAME,
                "readiness",
                isKafkaUp ? "UP" : "DOWN",
                Instant.now().toString(),
                Map.of("service", serviceStatus, "kafka", kafkaStatus)
        );

        HttpStatus httpStatus = isKafkaUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(httpStatus).body(response);
    }

    /**
     * Place a new order.
     * POST /order
     * Body: { "item_id": number, "name": "string", "address": "string", "quantity": number }
     */
    @PostMapping("/order")
    public ResponseEntity<Map<String, Object>> placeOrder(@Valid @RequestBody OrderRequest request) {
        logger.info("Received order request: itemId={}, quantity={}", request.itemId(), request.quantity());

        Order order = orderService.placeOrder(request);

        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "message", "Order placed successfully",
                "order_id", order.orderId(),
                "order", order
        ));
    }

    /**
     * GET /order/{orderId}
     */
    @GetMapping("/order/{orderId}")
    public ResponseEntity<Order> getOrder(@PathVariable String orderId) {
        return ResponseEntity.ok(orderService.getOrder(orderId));
    }

    private static Map<String, String> endpoint(String method, String path, String description) {
        Map<String, String> endpoint = new LinkedHashMap<>();
        endpoint.put("method", method);
        endpoint.put("path", path);
        endpoint.put("description", description);
        return endpoint;
    }
}
