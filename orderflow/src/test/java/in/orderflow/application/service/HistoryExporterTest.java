package in.orderflow.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.orderflow.domain.signal.TradingSession;
import in.orderflow.domain.trade.ClosedTrade;
import org.junit.jupiter.api.Test;

import java.util.List;

import static in.orderflow.Fixtures.BASE_TIMESTAMP;
import static in.orderflow.Fixtures.MINUTE;
import static in.orderflow.Fixtures.closedTrade;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for HistoryExporter.
 *
 * Tests:
 * - CSV header, column order and decimal formatting
 * - CSV quoting of ids
 * - JSON uses wire codes for enums
 */
class HistoryExporterTest {

    @Test
    void testCsvHeaderAndRow() {
        ClosedTrade trade = closedTrade("t1", 2, BASE_TIMESTAMP, TradingSession.US);

        String[] lines = HistoryExporter.export(List.of(trade), ExportFormat.CSV).split("\n");

        assertEquals(2, lines.length);
        assertEquals(String.join(",", HistoryExporter.CSV_COLUMNS), lines[0]);
        assertEquals("t1,t1,absorption-failure,long,us,100.00,100.00,102.00,"
                + (BASE_TIMESTAMP - MINUTE) + "," + BASE_TIMESTAMP + ",1.00,tp1,tp2,win,"
                + "0.020000,2.0000,0.000000,2.0000,0.0000,2023-11-14",
            lines[1]);
    }

    @Test
    void testCsvQuotesIdsWithCommas() {
        ClosedTrade trade = closedTrade("a,b", -1, BASE_TIMESTAMP, TradingSession.EU);

        String csv = HistoryExporter.toCsv(List.of(trade));

        assertTrue(csv.contains("\"a,b\",\"a,b\",absorption-failure"), csv);
        assertTrue(csv.contains(",stop,stop,loss,-0.010000,-1.0000,"), csv);
    }

    @Test
    void testEmptyCsvHasHeaderOnly() {
        assertEquals(String.join(",", HistoryExporter.CSV_COLUMNS) + "\n", HistoryExporter.toCsv(List.of()));
    }

    @Test
    void testJsonUsesCodes() throws Exception {
        ClosedTrade trade = closedTrade("t1", 2, BASE_TIMESTAMP, TradingSession.US);

        JsonNode root = new ObjectMapper().readTree(HistoryExporter.export(List.of(trade), ExportFormat.JSON));

        assertTrue(root.isArray());
        assertEquals(1, root.size());
        JsonNode node = root.get(0);
        assertEquals("t1", node.get("id").asText());
        assertEquals("tp2", node.get("exitReason").asText());
        assertEquals("absorption-failure", node.get("strategy").asText());
        assertEquals(2.0, node.get("realizedR").asDouble(), 1e-12);
    }
}
