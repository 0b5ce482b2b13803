package shop.eda.catalog.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import shop.eda.eventbus.EventBusClient;
import shop.eda.eventbus.codec.EventCodec;
import shop.eda.eventbus.kafka.KafkaEventBusClient;
import shop.eda.eventbus.memory.InMemoryEventBus;

/**
 * Selects the event bus transport ({@code event-bus.transport=kafka|in-memory}).
 */
@Configuration
public class EventBusConfig {

    @Bean
    public EventCodec eventCodec() {
        return new EventCodec();
    }

    @Bean
    @ConditionalOnProperty(name = "event-bus.transport", havingValue = "kafka", matchIfMissing = true)
    public EventBusClient kafkaEventBusClient(KafkaTemplate<String, String> dltKafkaTemplate,
                                              ConsumerFactory<String, String> consumerFactory,
                                              EventCodec eventCodec,
                                              @Value("${event-bus.publish.timeout-ms:10000}") long publishTimeoutMs) {
        return new KafkaEventBusClient(dltKafkaTemplate, consumerFactory, eventCodec, publishTimeoutMs);
    }

    @Bean
    @ConditionalOnProperty(name = "event-bus.transport", havingValue = "in-memory")
    public EventBusClient inMemoryEventBus(@Value("${event-bus.in-memory.partitions:3}") int partitions,
                                           EventCodec eventCodec) {
        return new InMemoryEventBus(partitions, eventCodec);
    }
}
