package shop.eda.catalog.model.response;

import java.util.Map;

/**
 * HealthResponse - Structured response for liveness and readiness probes.
 */
public record HealthResponse(
    String serviceName,
    String type,           // "liveness" or "readiness"
    String status,         // "UP" or "DOWN"
    String timestamp,      // ISO-8601
    Map<String, HealthCheck> checks
) {}
