package in.orderflow.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Fixed-capacity FIFO buffer. Appending beyond capacity drops the oldest element.
 *
 * Not thread-safe; owned by a single engine.
 */
public final class BoundedRing<T> implements Iterable<T> {

    private final int capacity;
    private final Deque<T> items;

    public BoundedRing(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.items = new ArrayDeque<>(Math.min(capacity, 256));
    }

    public void add(T item) {
        items.addLast(item);
        while (items.size() > capacity) {
            items.removeFirst();
        }
    }

    /**
     * Replace the contents with the newest {@code capacity} elements of the source.
     */
    public void resetTo(Collection<? extends T> source) {
        items.clear();
        for (T item : source) {
            add(item);
        }
    }

    /**
     * @return true when at least one element was removed
     */
    public boolean removeIf(Predicate<? super T> filter) {
        return items.removeIf(filter);
    }

    public void clear() {
        items.clear();
    }

    public int size() {
        return items.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * Immutable copy, oldest first.
     */
    public List<T> toList() {
        return List.copyOf(new ArrayList<>(items));
    }

    @Override
    public Iterator<T> iterator() {
        return items.iterator();
    }
}
