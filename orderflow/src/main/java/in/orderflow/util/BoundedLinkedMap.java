package in.orderflow.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Insertion-ordered map with a fixed capacity.
 *
 * When a put grows the map beyond capacity, the oldest entries are evicted
 * first. Entries whose key is pinned (still referenced elsewhere) are skipped;
 * if every candidate is pinned the map is allowed to stay over capacity.
 */
public final class BoundedLinkedMap<K, V> {

    private final int capacity;
    private final LinkedHashMap<K, V> entries = new LinkedHashMap<>();

    public BoundedLinkedMap(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Insert or replace. Replacing keeps the original insertion position.
     */
    public void put(K key, V value) {
        entries.put(key, value);
    }

    /**
     * Evict oldest-first until the map fits its capacity, skipping pinned keys.
     *
     * @return number of evicted entries
     */
    public int evictOverflow(Predicate<? super K> pinned) {
        int overflow = entries.size() - capacity;
        int evicted = 0;
        Iterator<Map.Entry<K, V>> it = entries.entrySet().iterator();
        while (overflow > 0 && it.hasNext()) {
            K key = it.next().getKey();
            if (pinned.test(key)) {
                continue;
            }
            it.remove();
            overflow--;
            evicted++;
        }
        return evicted;
    }

    public Optional<V> get(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Values in insertion order (oldest first).
     */
    public List<V> values() {
        return List.copyOf(new ArrayList<>(entries.values()));
    }

    public void clear() {
        entries.clear();
    }
}
