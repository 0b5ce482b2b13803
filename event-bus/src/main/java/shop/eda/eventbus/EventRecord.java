package shop.eda.eventbus;

/**
 * EventRecord - one raw record read from the log.
 * The payload is left undecoded so that malformed records can be reported
 * (and dead-lettered) without losing their content.
 */
public record EventRecord(
        String topic,
        int partition,
        long offset,
        String key,
        String payload
) {}
