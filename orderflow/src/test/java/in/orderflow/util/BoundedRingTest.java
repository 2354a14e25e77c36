package in.orderflow.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoundedRingTest {

    @Test
    void testDropsOldestBeyondCapacity() {
        BoundedRing<Integer> ring = new BoundedRing<>(3);
        for (int i = 1; i <= 5; i++) {
            ring.add(i);
        }

        assertEquals(3, ring.size());
        assertEquals(List.of(3, 4, 5), ring.toList(), "Oldest elements should be dropped first");
    }

    @Test
    void testResetKeepsNewestElements() {
        BoundedRing<String> ring = new BoundedRing<>(2);
        ring.add("stale");

        ring.resetTo(List.of("a", "b", "c"));

        assertEquals(List.of("b", "c"), ring.toList());
    }

    @Test
    void testRemoveIfReportsRemoval() {
        BoundedRing<Integer> ring = new BoundedRing<>(10);
        ring.resetTo(List.of(1, 2, 3, 4));

        assertTrue(ring.removeIf(i -> i % 2 == 0));
        assertFalse(ring.removeIf(i -> i > 100), "Nothing matched, nothing removed");
        assertEquals(List.of(1, 3), ring.toList());
    }

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedRing<>(0));
    }
}
