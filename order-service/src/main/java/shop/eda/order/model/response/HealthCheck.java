package shop.eda.order.model.response;

/**
 * HealthCheck - Individual health check result.
 * Used within HealthResponse to report status of a specific component.
 */
public record HealthCheck(
    String status,    // "UP" or "DOWN"
    String details
) {}
