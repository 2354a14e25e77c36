package in.orderflow.bootstrap;

import in.orderflow.application.service.TradingEngine;
import in.orderflow.application.service.TradingStateSnapshot;
import in.orderflow.infrastructure.replay.ReplayClock;
import in.orderflow.infrastructure.replay.ReplayEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Drives one engine through a recorded feed.
 *
 * The replay clock is advanced to each event's feed time before the event is
 * applied. With a speed multiplier above zero the session also sleeps for the
 * recorded gap divided by the speed; zero plays as fast as possible.
 */
public final class ReplaySession {
    private static final Logger log = LoggerFactory.getLogger(ReplaySession.class);

    private static final long MAX_SLEEP_MS = 5_000L;

    private final String name;
    private final TradingEngine engine;
    private final ReplayClock clock;
    private final double speed;

    private long applied;
    private long changed;

    public ReplaySession(String name, TradingEngine engine, ReplayClock clock, double speed) {
        this.name = name;
        this.engine = engine;
        this.clock = clock;
        this.speed = Math.max(0, speed);
    }

    /**
     * Play every event in order.
     *
     * @return the engine state after the last event
     * @throws InterruptedException if interrupted while pacing
     */
    public TradingStateSnapshot run(List<ReplayEvent> events) throws InterruptedException {
        long previous = -1;
        for (ReplayEvent event : events) {
            if (speed > 0 && previous >= 0 && event.timestamp() > previous) {
                Thread.sleep(Math.min(MAX_SLEEP_MS, Math.round((event.timestamp() - previous) / speed)));
            }
            if (event.timestamp() > 0) {
                clock.advanceTo(event.timestamp());
                previous = event.timestamp();
            }
            if (apply(event)) {
                changed++;
            }
            applied++;
        }
        log.info("[{}] Replayed {} events ({} changed state), version {}", name, applied, changed,
            engine.getVersion());
        return engine.getState();
    }

    boolean apply(ReplayEvent event) {
        return switch (event.type()) {
            case SIGNALS -> engine.syncSignals(event.signals(), event.bars());
            case BARS -> event.bars() != null && engine.onBars(event.bars());
            case TRADES -> engine.onTicks(event.trades());
            case CLOCK_OFFSET -> engine.updateClockOffset(event.offsetMs());
        };
    }

    public String getName() {
        return name;
    }

    public long getApplied() {
        return applied;
    }

    public long getChanged() {
        return changed;
    }
}
