package in.orderflow.infrastructure.replay;

import in.orderflow.domain.data.FootprintBar;
import in.orderflow.domain.signal.Signal;
import in.orderflow.domain.signal.SignalStrategy;
import in.orderflow.domain.signal.TradeSide;
import in.orderflow.domain.signal.TradingSession;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ReplayEventReader.
 *
 * Tests:
 * - Every event type parses from the bundled feed
 * - Comments and blank lines are skipped
 * - A bad line fails the read with its line number
 */
class ReplayEventReaderTest {

    private static final Path SOURCE = Paths.get("inline.ndjson");

    static Path feed() throws Exception {
        return Paths.get(ReplayEventReaderTest.class.getResource("/replay/session.ndjson").toURI());
    }

    private static List<ReplayEvent> read(String text) throws Exception {
        return ReplayEventReader.read(SOURCE, new StringReader(text));
    }

    @Test
    void testReadBundledFeed() throws Exception {
        List<ReplayEvent> events = ReplayEventReader.readAll(feed());

        assertEquals(5, events.size(), "Comment and blank line skipped");
        assertEquals(ReplayEvent.Type.SIGNALS, events.get(0).type());
        assertEquals(ReplayEvent.Type.TRADES, events.get(1).type());
        assertEquals(ReplayEvent.Type.TRADES, events.get(2).type());
        assertEquals(ReplayEvent.Type.BARS, events.get(3).type());
        assertEquals(ReplayEvent.Type.CLOCK_OFFSET, events.get(4).type());

        Signal signal = events.get(0).signals().get(0);
        assertEquals("s1", signal.id());
        assertEquals(TradeSide.LONG, signal.side());
        assertEquals(SignalStrategy.ABSORPTION_FAILURE, signal.strategy());
        assertEquals(List.of(SignalStrategy.ABSORPTION_FAILURE), signal.strategies());
        assertEquals(TradingSession.US, signal.session());
        assertEquals(110.0, signal.target1(), 1e-12);
        assertNull(signal.target2());
        assertNull(events.get(0).bars(), "Signals without bars leave the bar cache alone");

        assertTrue(events.get(2).trades().get(0).buyerMaker());

        FootprintBar bar = events.get(3).bars().get(0);
        assertEquals(100.0, bar.pocPrice(), 1e-12);
        assertEquals(1, bar.levels().size());
        assertNull(bar.depth());

        assertEquals(-250L, events.get(4).offsetMs());
    }

    @Test
    void testTradeBatchDefaultsToLatestPrint() throws Exception {
        List<ReplayEvent> events = read("{\"type\":\"trades\",\"trades\":["
            + "{\"tradeId\":1,\"price\":10,\"quantity\":1,\"timestamp\":500,\"isBuyerMaker\":false},"
            + "{\"tradeId\":2,\"price\":11,\"quantity\":1,\"timestamp\":900,\"isBuyerMaker\":false}]}");

        assertEquals(900L, events.get(0).timestamp());
        assertEquals(2, events.get(0).trades().size());
    }

    @Test
    void testMalformedLineReportsLineNumber() {
        ReplayException e = assertThrows(ReplayException.class,
            () -> read("# header\n{\"type\":\"bars\",\"bars\":[]}\n{\"type\":\"bars\",\n"));

        assertEquals(3, e.getLineNumber());
        assertEquals(SOURCE, e.getSource());
        assertTrue(e.getMessage().startsWith("[inline.ndjson:3]"), e.getMessage());
    }

    @Test
    void testUnknownOrMissingType() {
        ReplayException unknown = assertThrows(ReplayException.class, () -> read("{\"type\":\"quotes\"}"));
        assertEquals(1, unknown.getLineNumber());

        ReplayException missing = assertThrows(ReplayException.class, () -> read("{\"ts\":1}"));
        assertTrue(missing.getMessage().contains("Event has no type"));
    }

    @Test
    void testClockOffsetRequiresOffset() {
        ReplayException e = assertThrows(ReplayException.class,
            () -> read("{\"type\":\"clock-offset\",\"ts\":1}"));

        assertTrue(e.getMessage().contains("without offsetMs"));
    }

    @Test
    void testMissingFile(@TempDir Path dir) {
        ReplayException e = assertThrows(ReplayException.class,
            () -> ReplayEventReader.readAll(dir.resolve("absent.ndjson")));

        assertEquals(0, e.getLineNumber());
    }

    @Test
    void testClockNeverMovesBack() {
        ReplayClock clock = new ReplayClock(1_000L);

        clock.advanceTo(5_000L);
        clock.advanceTo(2_000L);

        assertEquals(5_000L, clock.millis());
        assertEquals(5_000L, clock.instant().toEpochMilli());
    }
}
