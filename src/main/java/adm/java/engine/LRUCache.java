package adm.java.engine;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Bounded LRU (Least Recently Used) map with eviction callback.
 *
 * This implementation provides:
 * - O(1) lookup and insert
 * - Access-order based eviction (least recently accessed entries evicted first)
 * - Thread-safe operations via synchronized methods
 * - Bulk removal by predicate for idle sweeps
 *
 * Design:
 * - Uses LinkedHashMap with accessOrder=true for LRU ordering
 * - Eviction happens automatically when size exceeds maxSize
 * - The eviction callback runs while the cache monitor is held; it must not
 *   call back into the cache
 *
 * @param <K> Key type
 * @param <V> Value type
 */
final class LRUCache<K, V> {

    private final int maxSize;
    private final LinkedHashMap<K, V> map;

    /**
     * Creates an LRU cache with specified max size and eviction callback.
     *
     * @param maxSize Maximum number of entries (must be > 0)
     * @param evictionCallback Callback invoked when an entry is evicted for capacity (can be null)
     * @throws IllegalArgumentException if maxSize <= 0
     */
    LRUCache(int maxSize, BiConsumer<K, V> evictionCallback) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }

        this.maxSize = maxSize;

        // accessOrder=true: iteration goes from least to most recently used
        this.map = new LinkedHashMap<>(Math.min(maxSize, 1024), 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                boolean shouldRemove = size() > LRUCache.this.maxSize;
                if (shouldRemove && evictionCallback != null) {
                    evictionCallback.accept(eldest.getKey(), eldest.getValue());
                }
                return shouldRemove;
            }
        };
    }

    /**
     * Retrieves a value and marks it as recently used.
     *
     * @return The value, or null if not present
     */
    synchronized V get(K key) {
        return map.get(key);
    }

    /**
     * Returns the value for the key, creating it atomically if absent.
     * May trigger eviction of the least recently used entry.
     */
    synchronized V computeIfAbsent(K key, Function<? super K, ? extends V> factory) {
        return map.computeIfAbsent(key, factory);
    }

    /**
     * Removes every entry whose value matches the predicate.
     * Does NOT invoke the eviction callback.
     *
     * @return Number of entries removed
     */
    synchronized int removeIf(Predicate<? super V> predicate) {
        int removed = 0;
        Iterator<V> it = map.values().iterator();
        while (it.hasNext()) {
            if (predicate.test(it.next())) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    synchronized int size() {
        return map.size();
    }

    /**
     * Clears all entries from the cache.
     * Note: Does NOT invoke eviction callbacks.
     */
    synchronized void clear() {
        map.clear();
    }
}
