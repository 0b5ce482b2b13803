package shop.eda.catalog.store;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * AppliedOrderWindow
 * Remembers which order ids have been applied, bounded by entry count and age.
 * Oldest entries are evicted first. Not thread-safe: guarded by the owning store's lock.
 */
public class AppliedOrderWindow {

    private final int maxEntries;
    private final long maxAgeMs;
    private final Clock clock;

    // orderId -> applied-at epoch millis, in insertion order
    private final LinkedHashMap<String, Long> applied = new LinkedHashMap<>();

    public AppliedOrderWindow(int maxEntries, Duration maxAge, Clock clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1");
        }
        if (maxAge.isNegative() || maxAge.isZero()) {
            throw new IllegalArgumentException("maxAge must be positive");
        }
        this.maxEntries = maxEntries;
        this.maxAgeMs = maxAge.toMillis();
        this.clock = clock;
    }

    public AppliedOrderWindow(int maxEntries, Duration maxAge) {
        this(maxEntries, maxAge, Clock.systemUTC());
    }

    public boolean contains(String orderId) {
        evictExpired(clock.millis());
        return applied.containsKey(orderId);
    }

    public void record(String orderId) {
        long now = clock.millis();
        evictExpired(now);
        applied.putIfAbsent(orderId, now);
        while (applied.size() > maxEntries) {
            Iterator<String> eldest = applied.keySet().iterator();
            eldest.next();
            eldest.remove();
        }
    }

    public int size() {
        return applied.size();
    }

    private void evictExpired(long now) {
        Iterator<Map.Entry<String, Long>> it = applied.entrySet().iterator();
        while (it.hasNext()) {
            if (now - it.next().getValue() <= maxAgeMs) {
                // insertion order == time order, the rest is younger
                return;
            }
            it.remove();
        }
    }
}
