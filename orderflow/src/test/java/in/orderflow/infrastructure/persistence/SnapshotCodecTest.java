package in.orderflow.infrastructure.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.orderflow.application.service.TradingPersistenceSnapshot;
import in.orderflow.config.TradingSettings;
import in.orderflow.domain.signal.TradingSession;
import in.orderflow.domain.trade.ClosedTrade;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static in.orderflow.Fixtures.BASE_TIMESTAMP;
import static in.orderflow.Fixtures.MINUTE;
import static in.orderflow.Fixtures.closedTrade;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SnapshotCodec.
 *
 * Tests:
 * - Encode then decode keeps settings and history
 * - Malformed documents fall back to defaults
 * - Bad history rows are skipped, good ones kept
 * - File read and write
 */
class SnapshotCodecTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static TradingPersistenceSnapshot sample() {
        TradingSettings settings = TradingSettings.builder().autoTake(true).riskPerTradePercent(0.5).build();
        return new TradingPersistenceSnapshot(settings, List.of(
            closedTrade("t1", 2, BASE_TIMESTAMP, TradingSession.US),
            closedTrade("t2", -1, BASE_TIMESTAMP + MINUTE, TradingSession.EU)));
    }

    @Test
    void testEncodeDecode() {
        TradingPersistenceSnapshot snapshot = sample();

        TradingPersistenceSnapshot decoded = SnapshotCodec.decode(SnapshotCodec.encode(snapshot));

        assertEquals(snapshot, decoded);
    }

    @Test
    void testMalformedDocumentsYieldDefaults() {
        assertEquals(TradingPersistenceSnapshot.empty(), SnapshotCodec.decode("{not json"));
        assertEquals(TradingPersistenceSnapshot.empty(), SnapshotCodec.decode("[1, 2]"));
        assertEquals(TradingPersistenceSnapshot.empty(), SnapshotCodec.decode(""));
        assertEquals(TradingPersistenceSnapshot.empty(), SnapshotCodec.decode(null));
    }

    @Test
    void testWrongTypedSectionsFallBackSeparately() {
        String json = "{\"settings\": \"oops\", \"history\": {\"id\": \"t1\"}}";

        TradingPersistenceSnapshot decoded = SnapshotCodec.decode(json);

        assertEquals(TradingSettings.defaults(), decoded.settings());
        assertTrue(decoded.history().isEmpty());
    }

    @Test
    void testPartialSettingsMergeOverDefaults() {
        TradingPersistenceSnapshot decoded = SnapshotCodec.decode("{\"settings\": {\"autoTake\": true}}");

        assertEquals(TradingSettings.defaults().toBuilder().autoTake(true).build(), decoded.settings());
        assertTrue(decoded.history().isEmpty());
    }

    @Test
    void testBadHistoryRowsAreSkipped() throws Exception {
        ObjectNode root = (ObjectNode) MAPPER.readTree(SnapshotCodec.encode(sample()));
        ArrayNode history = (ArrayNode) root.get("history");

        ObjectNode missingSide = history.get(0).deepCopy();
        missingSide.put("id", "no-side");
        missingSide.remove("side");
        ObjectNode badTime = history.get(0).deepCopy();
        badTime.put("id", "bad-time");
        badTime.put("exitTime", "yesterday");
        history.add(missingSide);
        history.add(badTime);
        history.add("not an object");
        history.addObject().put("id", "no-exit-time");

        TradingPersistenceSnapshot decoded = SnapshotCodec.decode(MAPPER.writeValueAsString(root));

        List<ClosedTrade> trades = decoded.history();
        assertEquals(2, trades.size());
        assertEquals("t1", trades.get(0).id());
        assertEquals("t2", trades.get(1).id());
        assertTrue(decoded.settings().autoTake(), "Settings survive bad history rows");
    }

    @Test
    void testEncodedHistoryUsesCodes() throws Exception {
        JsonNode root = MAPPER.readTree(SnapshotCodec.encode(sample()));

        JsonNode first = root.get("history").get(0);
        assertEquals("long", first.get("side").asText());
        assertEquals("us", first.get("session").asText());
        assertEquals("win", first.get("result").asText());
    }

    @Test
    void testReadMissingFile(@TempDir Path dir) {
        assertEquals(TradingPersistenceSnapshot.empty(), SnapshotCodec.read(dir.resolve("state.json")));
    }

    @Test
    void testWriteCreatesParentDirectories(@TempDir Path dir) {
        Path file = dir.resolve("nested").resolve("deeper").resolve("state.json");

        SnapshotCodec.write(file, sample());

        assertTrue(Files.exists(file));
        assertEquals(sample(), SnapshotCodec.read(file));
    }
}
