package in.orderflow.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.orderflow.application.service.TradingPersistenceSnapshot;
import in.orderflow.config.SettingsLoader;
import in.orderflow.config.TradingSettings;
import in.orderflow.domain.trade.ClosedTrade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON codec for {@link TradingPersistenceSnapshot}.
 *
 * Decoding never fails on content: a malformed document yields defaults,
 * a partial settings object is merged over the defaults, and history rows
 * that do not map to a closed trade are skipped. Each fallback is logged.
 */
public final class SnapshotCodec {
    private static final Logger log = LoggerFactory.getLogger(SnapshotCodec.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static String encode(TradingPersistenceSnapshot snapshot) {
        try {
            return MAPPER.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to encode persistence snapshot", e);
        }
    }

    public static TradingPersistenceSnapshot decode(String json) {
        if (json == null || json.isBlank()) {
            return TradingPersistenceSnapshot.empty();
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Persisted snapshot is not valid JSON, starting from defaults: {}", e.getOriginalMessage());
            return TradingPersistenceSnapshot.empty();
        }
        if (root == null || !root.isObject()) {
            log.warn("Persisted snapshot is not a JSON object, starting from defaults");
            return TradingPersistenceSnapshot.empty();
        }
        return new TradingPersistenceSnapshot(decodeSettings(root.get("settings")), decodeHistory(root.get("history")));
    }

    /**
     * Read a snapshot file. A missing file yields an empty snapshot.
     */
    public static TradingPersistenceSnapshot read(Path file) {
        if (!Files.exists(file)) {
            return TradingPersistenceSnapshot.empty();
        }
        try {
            return decode(Files.readString(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read snapshot " + file, e);
        }
    }

    public static void write(Path file, TradingPersistenceSnapshot snapshot) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, encode(snapshot));
            log.debug("Snapshot written to {} ({} trades)", file, snapshot.history().size());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write snapshot " + file, e);
        }
    }

    private static TradingSettings decodeSettings(JsonNode node) {
        if (node == null || node.isNull()) {
            return TradingSettings.defaults();
        }
        if (!node.isObject()) {
            log.warn("Persisted settings are not an object, using defaults");
            return TradingSettings.defaults();
        }
        try {
            return SettingsLoader.merge(TradingSettings.defaults(), node);
        } catch (JsonProcessingException e) {
            log.warn("Persisted settings could not be read, using defaults: {}", e.getOriginalMessage());
            return TradingSettings.defaults();
        }
    }

    private static List<ClosedTrade> decodeHistory(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            log.warn("Persisted history is not an array, starting with empty history");
            return List.of();
        }
        List<ClosedTrade> trades = new ArrayList<>();
        int skipped = 0;
        for (JsonNode row : node) {
            ClosedTrade trade = decodeTrade(row);
            if (trade == null) {
                skipped++;
            } else {
                trades.add(trade);
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} malformed history rows", skipped);
        }
        return trades;
    }

    private static ClosedTrade decodeTrade(JsonNode row) {
        if (row == null || !row.isObject() || !row.hasNonNull("id") || !row.hasNonNull("exitTime")) {
            return null;
        }
        try {
            ClosedTrade trade = MAPPER.treeToValue(row, ClosedTrade.class);
            return isComplete(trade) ? trade : null;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("History row {} rejected: {}", row.get("id"), e.getMessage());
            return null;
        }
    }

    private static boolean isComplete(ClosedTrade trade) {
        return trade.side() != null && trade.strategy() != null && trade.session() != null
            && trade.firstHit() != null && trade.exitReason() != null && trade.result() != null
            && trade.day() != null;
    }

    private SnapshotCodec() {}
}
