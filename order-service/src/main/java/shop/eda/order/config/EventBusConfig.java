package shop.eda.order.config;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import shop.eda.eventbus.EventBusClient;
import shop.eda.eventbus.codec.EventCodec;
import shop.eda.eventbus.kafka.KafkaEventBusClient;
import shop.eda.eventbus.memory.InMemoryEventBus;

import java.util.HashMap;
import java.util.Map;

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
    public ConsumerFactory<String, String> offsetLookupConsumerFactory(
            @Value("${spring.kafka.bootstrap-servers}") String bootstrapServers) {
        // Never subscribed by this service; only backs committed-offset lookups
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        return new DefaultKafkaConsumerFactory<>(props);
    }

    @Bean
    @ConditionalOnProperty(name = "event-bus.transport", havingValue = "kafka", matchIfMissing = true)
    public EventBusClient kafkaEventBusClient(KafkaTemplate<String, String> kafkaTemplate,
                                              ConsumerFactory<String, String> offsetLookupConsumerFactory,
                                              EventCodec eventCodec,
                                              @Value("${event-bus.publish.timeout-ms:10000}") long publishTimeoutMs) {
        return new KafkaEventBusClient(kafkaTemplate, offsetLookupConsumerFactory, eventCodec, publishTimeoutMs);
    }

    @Bean
    @ConditionalOnProperty(name = "event-bus.transport", havingValue = "in-memory")
    public EventBusClient inMemoryEventBus(@Value("${event-bus.in-memory.partitions:3}") int partitions,
                                           EventCodec eventCodec) {
        return new InMemoryEventBus(partitions, eventCodec);
    }
}
