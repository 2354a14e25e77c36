package in.orderflow.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.orderflow.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Iterator;
import java.util.Map;

/**
 * Loads {@link TradingSettings} from JSON.
 *
 * A settings document may be partial: it is deep-merged over the defaults
 * (objects merge field by field, everything else replaces), then the record
 * constructors clamp the result.
 */
public final class SettingsLoader {
    private static final Logger log = LoggerFactory.getLogger(SettingsLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String SETTINGS_PATH_ENV = "ORDERFLOW_SETTINGS";

    /**
     * Settings from the file named by {@code ORDERFLOW_SETTINGS}, or defaults when unset.
     */
    public static TradingSettings fromEnvironment() {
        String path = Env.get(SETTINGS_PATH_ENV, null);
        if (path == null) {
            log.info("No {} configured, using default settings", SETTINGS_PATH_ENV);
            return TradingSettings.defaults();
        }
        return load(Paths.get(path));
    }

    /**
     * Load settings from a file. A missing file yields defaults; an unreadable one fails loudly.
     */
    public static TradingSettings load(Path file) {
        if (!Files.exists(file)) {
            log.info("No settings file found, using defaults: {}", file);
            return TradingSettings.defaults();
        }
        try {
            TradingSettings settings = merge(TradingSettings.defaults(), Files.readString(file));
            log.info("✅ Loaded settings from {}: risk={}%, fees={}%, autoTake={}",
                file, settings.riskPerTradePercent(), settings.feesPercent(), settings.autoTake());
            return settings;
        } catch (IOException e) {
            throw new EngineConfigurationException(file, e.getMessage(), e);
        }
    }

    /**
     * Overlay a partial JSON document on a base settings value.
     *
     * @throws JsonProcessingException if the document is not valid JSON or has wrongly typed fields
     */
    public static TradingSettings merge(TradingSettings base, String partialJson) throws JsonProcessingException {
        JsonNode overlay = MAPPER.readTree(partialJson);
        return merge(base, overlay);
    }

    public static TradingSettings merge(TradingSettings base, JsonNode overlay) throws JsonProcessingException {
        ObjectNode merged = MAPPER.valueToTree(base);
        if (overlay != null && overlay.isObject()) {
            deepMerge(merged, (ObjectNode) overlay);
        }
        return MAPPER.treeToValue(merged, TradingSettings.class);
    }

    private static void deepMerge(ObjectNode target, ObjectNode overlay) {
        Iterator<Map.Entry<String, JsonNode>> fields = overlay.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            JsonNode incoming = field.getValue();
            if (existing != null && existing.isObject() && incoming.isObject()
                && !isSessionMap(field.getKey())) {
                deepMerge((ObjectNode) existing, (ObjectNode) incoming);
            } else {
                target.set(field.getKey(), incoming);
            }
        }
    }

    // Per-session caps replace as a whole so a session can be removed.
    private static boolean isSessionMap(String fieldName) {
        return "perSessionMaxTrades".equals(fieldName) || "perSessionMaxLossR".equals(fieldName);
    }

    private SettingsLoader() {}
}
