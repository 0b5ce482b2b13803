package shop.eda.catalog.model.response;

/**
 * HealthCheck - Individual health check result.
 */
public record HealthCheck(
    String status,    // "UP" or "DOWN"
    String details
) {}
