package in.orderflow.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import in.orderflow.domain.signal.TradingSession;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SettingsLoader and the clamping settings records.
 *
 * Tests:
 * - Partial documents merge over defaults, nested objects field by field
 * - Per-session caps replace as a whole
 * - Out-of-range values are clamped, not rejected
 * - File loading: missing file, valid file, broken file
 */
class SettingsLoaderTest {

    @Test
    void testPartialDocumentKeepsDefaults() throws JsonProcessingException {
        TradingSettings settings = SettingsLoader.merge(TradingSettings.defaults(),
            "{\"autoTake\": true, \"invalidations\": {\"lookbackBars\": 9}}");

        assertTrue(settings.autoTake());
        assertEquals(1.0, settings.riskPerTradePercent(), 1e-12);
        assertEquals(9, settings.invalidations().lookbackBars());
        assertEquals(85, settings.invalidations().autoCloseThreshold(), 1e-12, "Sibling field kept");
        assertEquals(TradingSettings.defaults().guardrails(), settings.guardrails());
    }

    @Test
    void testEmptyDocumentYieldsDefaults() throws JsonProcessingException {
        assertEquals(TradingSettings.defaults(), SettingsLoader.merge(TradingSettings.defaults(), "{}"));
    }

    @Test
    void testSessionCapsReplaceAsAWhole() throws JsonProcessingException {
        TradingSettings base = TradingSettings.builder()
            .guardrails(RiskGuardrailSettings.builder()
                .sessionMaxTrades(TradingSession.EU, 2)
                .sessionMaxTrades(TradingSession.US, 3)
                .build())
            .build();

        TradingSettings merged = SettingsLoader.merge(base,
            "{\"guardrails\": {\"perSessionMaxTrades\": {\"us\": 5}}}");

        assertNull(merged.guardrails().maxTradesFor(TradingSession.EU), "EU cap removed");
        assertEquals(5, merged.guardrails().maxTradesFor(TradingSession.US));
        assertEquals(base.guardrails().allowedSessions(), merged.guardrails().allowedSessions());
    }

    @Test
    void testOutOfRangeValuesAreClamped() throws JsonProcessingException {
        TradingSettings settings = SettingsLoader.merge(TradingSettings.defaults(),
            "{\"riskPerTradePercent\": -2, \"partialTakePercent\": 1.7, \"timeStopMinutes\": 0,"
                + " \"invalidationBars\": -3, \"invalidations\": {\"autoCloseThreshold\": 140,"
                + " \"aggressiveness\": \"bogus\"},"
                + " \"guardrails\": {\"maxTradesPerDay\": 0, \"maxDailyLossR\": -1,"
                + " \"perSessionMaxLossR\": {\"eu\": -1, \"us\": 2.5, \"mars\": 1}}}");

        assertEquals(0.0, settings.riskPerTradePercent(), 1e-12);
        assertEquals(1.0, settings.partialTakePercent(), 1e-12);
        assertNull(settings.timeStopMinutes(), "Non-positive time stop disables it");
        assertEquals(0, settings.invalidationBars());
        assertEquals(100.0, settings.invalidations().autoCloseThreshold(), 1e-12);
        assertEquals(InvalidationAggressiveness.MODERATE, settings.invalidations().aggressiveness());
        assertNull(settings.guardrails().maxTradesPerDay());
        assertNull(settings.guardrails().maxDailyLossR());
        assertNull(settings.guardrails().maxLossRFor(TradingSession.EU));
        assertEquals(2.5, settings.guardrails().maxLossRFor(TradingSession.US), 1e-12);
        assertEquals(1, settings.guardrails().perSessionMaxLossR().size());
    }

    @Test
    void testEqualityAfterClamping() {
        TradingSettings a = TradingSettings.builder().partialTakePercent(3).build();
        TradingSettings b = TradingSettings.builder().partialTakePercent(1).build();

        assertEquals(a, b);
    }

    @Test
    void testEmptyAllowedSessionsAllowsAll() {
        RiskGuardrailSettings guardrails = RiskGuardrailSettings.builder().allowedSessions(List.of()).build();

        for (TradingSession session : TradingSession.values()) {
            assertTrue(guardrails.isSessionAllowed(session), session.code());
        }
        assertFalse(RiskGuardrailSettings.defaults().isSessionAllowed(TradingSession.ASIA));
    }

    @Test
    void testLoadMissingFileYieldsDefaults(@TempDir Path dir) {
        assertEquals(TradingSettings.defaults(), SettingsLoader.load(dir.resolve("absent.json")));
    }

    @Test
    void testLoadFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("settings.json");
        Files.writeString(file, "{\"feesPercent\": 0.05, \"guardrails\": {\"enabled\": true}}");

        TradingSettings settings = SettingsLoader.load(file);

        assertEquals(0.05, settings.feesPercent(), 1e-12);
        assertTrue(settings.guardrails().enabled());
        assertEquals(15, settings.guardrails().lossCooldownMinutes());
    }

    @Test
    void testLoadBrokenFileFailsLoudly(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("settings.json");
        Files.writeString(file, "{\"feesPercent\": ");

        EngineConfigurationException e = assertThrows(EngineConfigurationException.class,
            () -> SettingsLoader.load(file));

        assertEquals(file, e.getSource());
        assertTrue(e.getMessage().contains("Settings could not be loaded"));
    }
}
