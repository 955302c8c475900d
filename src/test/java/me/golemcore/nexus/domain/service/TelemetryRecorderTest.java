package me.golemcore.nexus.domain.service;

import me.golemcore.nexus.domain.model.DegradationEvent;
import me.golemcore.nexus.domain.model.DegradationKind;
import me.golemcore.nexus.domain.model.Subsystem;
import me.golemcore.nexus.domain.model.TurnMetrics;
import me.golemcore.nexus.port.outbound.TelemetryPort;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TelemetryRecorderTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void shouldCreateTimestampedEventAndForwardIt() {
        TelemetryPort sink = mock(TelemetryPort.class);
        TelemetryRecorder recorder = new TelemetryRecorder(CLOCK, List.of(sink));

        DegradationEvent event = recorder.recordDegradation(Subsystem.IDENTITY, DegradationKind.TIMEOUT, "slow");

        assertEquals(Subsystem.IDENTITY, event.subsystem());
        assertEquals(DegradationKind.TIMEOUT, event.kind());
        assertEquals("slow", event.message());
        assertEquals(NOW, event.timestamp());
        verify(sink).recordDegradation(event);
    }

    @Test
    void shouldKeepForwardingWhenOneSinkFails() {
        TelemetryPort broken = mock(TelemetryPort.class);
        TelemetryPort healthy = mock(TelemetryPort.class);
        doThrow(new IllegalStateException("disk full")).when(broken).recordDegradation(any());
        doThrow(new IllegalStateException("disk full")).when(broken).logTurn(any());
        TelemetryRecorder recorder = new TelemetryRecorder(CLOCK, List.of(broken, healthy));
        TurnMetrics metrics = TurnMetrics.builder().sessionId("s1").build();

        assertDoesNotThrow(() -> recorder.recordDegradation(Subsystem.MEMORY, DegradationKind.ERROR, "boom"));
        assertDoesNotThrow(() -> recorder.logTurn(metrics));

        verify(healthy).recordDegradation(any());
        verify(healthy).logTurn(metrics);
    }

    @Test
    void shouldWorkWithoutSinks() {
        TelemetryRecorder recorder = new TelemetryRecorder(CLOCK, null);

        assertNotNull(recorder.recordDegradation(Subsystem.MOOD, DegradationKind.FALLBACK, "render failed"));
    }
}
