package adm.core.window;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.OptionalLong;

/**
 * Exact sliding window log: one timestamp per admitted request, oldest first.
 *
 * <p>Entries are kept in non-decreasing order, so trimming the front is
 * always enough to drop expired entries and windowed counts can stop at
 * the first entry that falls outside the window.
 *
 * <p>Not thread-safe; callers hold the owning client's lock.
 */
public final class WindowLog {

    private final ArrayDeque<Long> events = new ArrayDeque<>();

    /**
     * Appends a timestamp. A timestamp older than the newest entry is stored
     * as the newest entry's value to keep the log ordered.
     */
    public void append(long nowNanos) {
        Long last = events.peekLast();
        events.addLast(last != null && last > nowNanos ? last : nowNanos);
    }

    /**
     * Drops entries at or before {@code cutoffNanos} from the front.
     *
     * @return number of entries removed
     */
    public int prune(long cutoffNanos) {
        int removed = 0;
        while (!events.isEmpty() && events.peekFirst() <= cutoffNanos) {
            events.removeFirst();
            removed++;
        }
        return removed;
    }

    /**
     * Counts entries strictly after {@code cutoffNanos} without mutating the log.
     * Walks from the newest entry so the cost is bounded by the result.
     */
    public int countAfter(long cutoffNanos) {
        int count = 0;
        Iterator<Long> it = events.descendingIterator();
        while (it.hasNext() && it.next() > cutoffNanos) {
            count++;
        }
        return count;
    }

    /**
     * Oldest entry strictly after {@code cutoffNanos}. Timestamps may be
     * negative (nanoTime has an arbitrary origin), so absence is never encoded
     * as a value.
     */
    public OptionalLong oldestAfter(long cutoffNanos) {
        for (long ts : events) {
            if (ts > cutoffNanos) {
                return OptionalLong.of(ts);
            }
        }
        return OptionalLong.empty();
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
