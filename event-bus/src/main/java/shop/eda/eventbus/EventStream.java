package shop.eda.eventbus;

import java.time.Duration;
import java.util.List;

/**
 * EventStream
 * Restartable cursor over a single topic partition. Not thread-safe: one
 * consumer loop owns a stream for its whole life.
 */
public interface EventStream extends AutoCloseable {

    /**
     * Fetches the next batch, waiting at most {@code timeout} for records.
     *
     * @return records in offset order, empty when nothing arrived in time
     */
    List<EventRecord> poll(Duration timeout);

    /**
     * Stores the position to resume from after a restart.
     *
     * @param nextOffset offset of the first record not yet handled
     */
    void commit(long nextOffset);

    /**
     * @return offset of the next record this stream will return
     */
    long position();

    @Override
    void close();
}
