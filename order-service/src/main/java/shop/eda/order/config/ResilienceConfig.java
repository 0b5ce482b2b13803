package shop.eda.order.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import shop.eda.eventbus.exception.PublishException;
import shop.eda.order.exception.OrderPersistenceException;

/**
 * Retry budgets of the order intake path, with exponential backoff.
 */
@Configuration
public class ResilienceConfig {

    private static final Logger logger = LoggerFactory.getLogger(ResilienceConfig.class);

    @Bean
    public Retry persistenceRetry(@Value("${order.persistence.max-attempts:3}") int maxAttempts,
                                  @Value("${order.persistence.initial-backoff-ms:50}") long initialBackoffMs,
                                  @Value("${order.persistence.max-backoff-ms:500}") long maxBackoffMs) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoffMs, 2.0, maxBackoffMs))
                .retryExceptions(OrderPersistenceException.class)
                .build();
        return withLogging(Retry.of("order-persistence", config));
    }

    @Bean
    public Retry publishRetry(@Value("${order.publish.inline-attempts:3}") int maxAttempts,
                              @Value("${order.publish.initial-backoff-ms:200}") long initialBackoffMs,
                              @Value("${order.publish.max-backoff-ms:2000}") long maxBackoffMs) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoffMs, 2.0, maxBackoffMs))
                .retryExceptions(PublishException.class)
                .build();
        return withLogging(Retry.of("order-publish", config));
    }

    private static Retry withLogging(Retry retry) {
        retry.getEventPublisher()
                .onRetry(event -> logger.warn("{}: attempt {} failed, retrying in {}ms - {}",
                        event.getName(), event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "n/a"))
                .onError(event -> logger.error("{}: giving up after {} attempts",
                        event.getName(), event.getNumberOfRetryAttempts()));
        return retry;
    }
}
