package in.orderflow.service.signal;

import in.orderflow.domain.data.FootprintBar;
import in.orderflow.domain.signal.Signal;
import in.orderflow.util.BoundedLinkedMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Recent signals keyed by id plus a sliding window of closed footprint bars.
 *
 * Signals are evicted oldest-first once the cache exceeds its capacity, except
 * ids still referenced by a pending order or an open position.
 */
public final class SignalBarCache {
    private static final Logger log = LoggerFactory.getLogger(SignalBarCache.class);

    public static final int MAX_SIGNALS = 400;
    public static final int MAX_BARS = 360;

    private final BoundedLinkedMap<String, Signal> signals = new BoundedLinkedMap<>(MAX_SIGNALS);
    private List<FootprintBar> bars = List.of();

    /**
     * Cache the signals not seen before.
     *
     * @return the newly cached signals, in input order
     */
    public List<Signal> addNew(List<Signal> incoming) {
        List<Signal> fresh = new ArrayList<>();
        for (Signal signal : incoming) {
            if (signal == null || signals.containsKey(signal.id())) {
                continue;
            }
            signals.put(signal.id(), signal);
            fresh.add(signal);
        }
        return fresh;
    }

    /**
     * Trim the cache back to capacity, keeping pinned ids.
     */
    public void evict(Predicate<String> pinned) {
        int evicted = signals.evictOverflow(pinned);
        if (evicted > 0) {
            log.debug("Evicted {} cached signals ({} remain)", evicted, signals.size());
        }
    }

    public Optional<Signal> signal(String id) {
        return signals.get(id);
    }

    public int signalCount() {
        return signals.size();
    }

    /**
     * Replace the bar window with the newest bars of the batch.
     *
     * @return true if the window changed; an empty batch only counts when bars were held
     */
    public boolean updateBars(List<FootprintBar> batch) {
        if (batch == null || batch.isEmpty()) {
            boolean hadBars = !bars.isEmpty();
            bars = List.of();
            return hadBars;
        }
        int from = Math.max(0, batch.size() - MAX_BARS);
        bars = List.copyOf(batch.subList(from, batch.size()));
        return true;
    }

    public List<FootprintBar> bars() {
        return bars;
    }

    public Optional<FootprintBar> latestBar() {
        return bars.isEmpty() ? Optional.empty() : Optional.of(bars.get(bars.size() - 1));
    }

    /**
     * The newest {@code count} bars, oldest first.
     */
    public List<FootprintBar> lastBars(int count) {
        if (count <= 0 || bars.isEmpty()) {
            return List.of();
        }
        return bars.subList(Math.max(0, bars.size() - count), bars.size());
    }

    public BarLookup findBarForTime(long timestamp) {
        return findBarForTime(bars, timestamp);
    }

    /**
     * Bar containing the timestamp, scanning newest-first.
     * Falls back to the latest bar when none contains it; index is -1 with no bars.
     */
    public static BarLookup findBarForTime(List<FootprintBar> bars, long timestamp) {
        for (int index = bars.size() - 1; index >= 0; index--) {
            FootprintBar bar = bars.get(index);
            if (bar.contains(timestamp)) {
                return new BarLookup(bar, index);
            }
        }
        return bars.isEmpty()
            ? BarLookup.NONE
            : new BarLookup(bars.get(bars.size() - 1), bars.size() - 1);
    }

    public record BarLookup(FootprintBar bar, int index) {
        public static final BarLookup NONE = new BarLookup(null, -1);

        public boolean found() {
            return bar != null;
        }
    }
}
