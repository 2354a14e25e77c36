package in.orderflow.infrastructure.replay;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock that follows recorded feed time instead of the wall clock.
 *
 * The replay driver advances it before handing each event to the engine, so
 * a replay is deterministic regardless of playback speed. Time never moves back.
 */
public final class ReplayClock extends Clock {

    private long millis;

    public ReplayClock(long startMillis) {
        this.millis = startMillis;
    }

    public void advanceTo(long feedMillis) {
        if (feedMillis > millis) {
            millis = feedMillis;
        }
    }

    @Override
    public long millis() {
        return millis;
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(millis);
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return Clock.fixed(instant(), zone);
    }
}
