package shop.eda.eventbus.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import shop.eda.eventbus.exception.EventBusException;

/**
 * EventCodec
 * JSON (de)serialization of event payloads. Timestamps are written as ISO-8601
 * strings; unknown fields are ignored so newer producers do not break older consumers.
 * Fractional numbers are rejected for integer fields instead of being truncated.
 */
public class EventCodec {

    private final ObjectMapper objectMapper;

    public EventCodec() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT));
    }

    public EventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws EventBusException if the event cannot be serialized
     */
    public String encode(String topic, Object event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventBusException(topic, "Failed to serialize " + event.getClass().getSimpleName(), e);
        }
    }

    public <T> T decode(String payload, Class<T> type) throws JsonProcessingException {
        if (payload == null) {
            throw new IllegalArgumentException("payload is null");
        }
        return objectMapper.readValue(payload, type);
    }
}
