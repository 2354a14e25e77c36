package in.orderflow.application.service;

import in.orderflow.config.RiskGuardrailSettings;
import in.orderflow.config.TradingSettings;
import in.orderflow.domain.data.Tick;
import in.orderflow.domain.risk.GuardrailSource;
import in.orderflow.domain.risk.GuardrailStatus;
import in.orderflow.domain.signal.TradeSide;
import in.orderflow.domain.trade.ClosedTrade;
import in.orderflow.domain.trade.ExitReason;
import in.orderflow.infrastructure.metrics.EngineMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static in.orderflow.Fixtures.BASE_TIMESTAMP;
import static in.orderflow.Fixtures.SECOND;
import static in.orderflow.Fixtures.signal;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TradingEngineMetricsTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(BASE_TIMESTAMP), ZoneOffset.UTC);

    @Mock
    private EngineMetrics metrics;

    private TradingEngine engine;

    @BeforeEach
    void setUp() {
        TradingSettings settings = TradingSettings.builder().feesPercent(0).slippageTicks(0).build();
        engine = TradingEngine.builder()
            .settings(settings)
            .priceStep(1.0)
            .clock(CLOCK)
            .metrics(metrics)
            .build();
    }

    @Test
    void manualTrade_recordsPendingFillAndClose() {
        // Arrange
        engine.syncSignals(List.of(signal("s1", TradeSide.LONG, 100, 95, BASE_TIMESTAMP, 1)), null);

        // Act
        engine.takeSignal("s1");
        engine.onTick(Tick.of(1, 100, BASE_TIMESTAMP + SECOND));
        engine.onTick(Tick.of(2, 95, BASE_TIMESTAMP + 2 * SECOND));

        // Assert
        verify(metrics).recordPendingCreated(TradeSide.LONG, false);
        verify(metrics).recordFill(TradeSide.LONG);

        ArgumentCaptor<ClosedTrade> closed = ArgumentCaptor.forClass(ClosedTrade.class);
        verify(metrics).recordTradeClosed(closed.capture());
        assertEquals(ExitReason.STOP, closed.getValue().exitReason());

        verify(metrics).updateBook(1, 0, 1L);
        verify(metrics).updateBook(0, 1, 2L);
        verify(metrics).updateBook(0, 0, 3L);
        verify(metrics, never()).recordEntryBlocked(any());
    }

    @Test
    void guardrailDenial_recordsBlockedEntry() {
        // Arrange
        RiskGuardrailSettings guardrails = RiskGuardrailSettings.builder()
            .enabled(true)
            .allowedSessions(List.of())
            .maxTradesPerDay(1)
            .build();
        engine.updateSettings(b -> b.guardrails(guardrails));
        engine.syncSignals(List.of(signal("s1", TradeSide.LONG, 100, 95, BASE_TIMESTAMP, 1)), null);
        engine.takeSignal("s1");
        engine.onTick(Tick.of(1, 100, BASE_TIMESTAMP + SECOND));
        engine.onTick(Tick.of(2, 95, BASE_TIMESTAMP + 2 * SECOND));
        engine.syncSignals(List.of(signal("s2", TradeSide.SHORT, 100, 105, BASE_TIMESTAMP + 3 * SECOND, 2)), null);

        // Act
        boolean taken = engine.takeSignal("s2").isPresent();

        // Assert
        assertFalse(taken, "Daily trade cap reached");
        verify(metrics).recordEntryBlocked(GuardrailSource.DAILY_TRADES);
        verify(metrics, times(1)).recordPendingCreated(any(), anyBoolean());
        verify(metrics, atLeastOnce()).updateGuardrailStatus(GuardrailStatus.LOCKED);
    }

    @Test
    void noOpCalls_doNotTouchBookGauges() {
        // Act
        engine.cancelPending("missing");
        engine.flattenPosition("missing");

        // Assert
        verify(metrics, never()).updateBook(anyInt(), anyInt(), anyLong());
        verify(metrics, never()).updateGuardrailStatus(any());
    }
}
