package in.orderflow.application.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.orderflow.domain.trade.ClosedTrade;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;

/**
 * Renders closed trades as pretty-printed JSON or as CSV with a fixed column order.
 */
public final class HistoryExporter {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final List<String> CSV_COLUMNS = List.of(
        "id", "signalId", "strategy", "side", "session",
        "entryPrice", "entryFillPrice", "exitPrice", "entryTime", "exitTime", "holdMinutes",
        "firstHit", "exitReason", "result",
        "realizedPnl", "realizedR", "feesPaid", "mfe", "mae", "day"
    );

    public static String export(List<ClosedTrade> trades, ExportFormat format) {
        return switch (format) {
            case JSON -> toJson(trades);
            case CSV -> toCsv(trades);
        };
    }

    public static String toJson(List<ClosedTrade> trades) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(trades);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to export trade history as JSON", e);
        }
    }

    /**
     * CSV with a header row. Prices and hold time use 2 decimals, money 6, R values 4.
     */
    public static String toCsv(List<ClosedTrade> trades) {
        StringBuilder out = new StringBuilder(String.join(",", CSV_COLUMNS)).append('\n');
        for (ClosedTrade trade : trades) {
            List<String> row = List.of(
                escape(trade.id()),
                escape(trade.signalId()),
                trade.strategy().code(),
                trade.side().code(),
                trade.session().code(),
                fixed(trade.entryPrice(), 2),
                fixed(trade.entryFillPrice(), 2),
                fixed(trade.exitPrice(), 2),
                Long.toString(trade.entryTime()),
                Long.toString(trade.exitTime()),
                fixed(trade.holdMinutes(), 2),
                trade.firstHit().code(),
                trade.exitReason().code(),
                trade.result().code(),
                fixed(trade.realizedPnl(), 6),
                fixed(trade.realizedR(), 4),
                fixed(trade.feesPaid(), 6),
                fixed(trade.mfe(), 4),
                fixed(trade.mae(), 4),
                escape(trade.day())
            );
            out.append(String.join(",", row)).append('\n');
        }
        return out.toString();
    }

    private static String fixed(double value, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f", value);
    }

    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private HistoryExporter() {}
}
