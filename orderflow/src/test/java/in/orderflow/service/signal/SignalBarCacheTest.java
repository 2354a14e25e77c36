package in.orderflow.service.signal;

import in.orderflow.domain.data.FootprintBar;
import in.orderflow.domain.signal.Signal;
import in.orderflow.domain.signal.TradeSide;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static in.orderflow.Fixtures.BASE_TIMESTAMP;
import static in.orderflow.Fixtures.MINUTE;
import static in.orderflow.Fixtures.bar;
import static in.orderflow.Fixtures.signal;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SignalBarCache.
 *
 * Tests:
 * - Only unseen signals are returned as fresh
 * - Eviction keeps pinned ids
 * - Bar window trimming and lookup by time
 */
class SignalBarCacheTest {

    @Test
    void testAddNewSkipsKnownIds() {
        SignalBarCache cache = new SignalBarCache();
        Signal s1 = signal("s1", TradeSide.LONG, 100, 95, BASE_TIMESTAMP, 1);
        Signal s2 = signal("s2", TradeSide.SHORT, 100, 105, BASE_TIMESTAMP, 1);

        assertEquals(List.of(s1), cache.addNew(List.of(s1)));
        assertEquals(List.of(s2), cache.addNew(List.of(s1, s2)));
        assertEquals(2, cache.signalCount());
        assertTrue(cache.signal("s2").isPresent());
    }

    @Test
    void testEvictionKeepsPinnedIds() {
        SignalBarCache cache = new SignalBarCache();
        List<Signal> batch = new ArrayList<>();
        for (int i = 0; i <= SignalBarCache.MAX_SIGNALS; i++) {
            batch.add(signal("s" + i, TradeSide.LONG, 100, 95, BASE_TIMESTAMP + i, i));
        }
        cache.addNew(batch);

        cache.evict("s0"::equals);

        assertEquals(SignalBarCache.MAX_SIGNALS, cache.signalCount());
        assertTrue(cache.signal("s0").isPresent(), "Pinned id survives");
        assertTrue(cache.signal("s1").isEmpty(), "Oldest unpinned id evicted");
    }

    @Test
    void testBarWindow() {
        SignalBarCache cache = new SignalBarCache();
        List<FootprintBar> bars = new ArrayList<>();
        for (int i = 0; i < SignalBarCache.MAX_BARS + 10; i++) {
            long start = BASE_TIMESTAMP + i * MINUTE;
            bars.add(bar(start, 100, 101, 99, 100, 0, 0, 10, 100));
        }

        assertTrue(cache.updateBars(bars));
        assertEquals(SignalBarCache.MAX_BARS, cache.bars().size());
        assertEquals(BASE_TIMESTAMP + 10 * MINUTE, cache.bars().get(0).startTime());
        assertEquals(3, cache.lastBars(3).size());

        SignalBarCache.BarLookup lookup = cache.findBarForTime(BASE_TIMESTAMP + 20 * MINUTE + 5);
        assertTrue(lookup.found());
        assertEquals(10, lookup.index());

        SignalBarCache.BarLookup beyond = cache.findBarForTime(BASE_TIMESTAMP + 1000 * MINUTE);
        assertEquals(SignalBarCache.MAX_BARS - 1, beyond.index(), "Falls back to the latest bar");

        assertTrue(cache.updateBars(List.of()), "Clearing held bars is a change");
        assertFalse(cache.updateBars(List.of()));
        assertEquals(SignalBarCache.BarLookup.NONE, cache.findBarForTime(BASE_TIMESTAMP));
    }
}
