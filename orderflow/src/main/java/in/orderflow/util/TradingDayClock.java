package in.orderflow.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Trading day boundaries.
 *
 * The simulator books days in UTC: a day key is the ISO date (yyyy-MM-dd) of a
 * timestamp and the day resets at the next UTC midnight.
 */
public final class TradingDayClock {

    public static final long MINUTE_MS = 60_000L;
    public static final long DAY_MS = 24L * 60L * MINUTE_MS;

    /**
     * Day key (yyyy-MM-dd, UTC) of an epoch-millisecond timestamp.
     */
    public static String dayKey(long epochMillis) {
        return LocalDate.ofInstant(Instant.ofEpochMilli(epochMillis), ZoneOffset.UTC).toString();
    }

    /**
     * Epoch milliseconds of the first UTC midnight strictly after the timestamp.
     */
    public static long nextDayStart(long epochMillis) {
        LocalDate day = LocalDate.ofInstant(Instant.ofEpochMilli(epochMillis), ZoneOffset.UTC);
        return day.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }

    private TradingDayClock() {}
}
