package me.golemcore.nexus.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.nexus.domain.model.DegradationEvent;
import me.golemcore.nexus.domain.model.DegradationKind;
import me.golemcore.nexus.domain.model.Subsystem;
import me.golemcore.nexus.domain.model.TurnMetrics;
import me.golemcore.nexus.port.outbound.TelemetryPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Creates degradation events and forwards them, together with end-of-turn
 * metrics, to every registered {@link TelemetryPort}.
 *
 * <p>
 * Write-only and off the correctness path: a failing sink is logged and
 * skipped, never propagated into the turn.
 */
@Service
@Slf4j
public class TelemetryRecorder {

    private final Clock clock;
    private final List<TelemetryPort> sinks;

    public TelemetryRecorder(Clock clock, List<TelemetryPort> sinks) {
        this.clock = clock;
        this.sinks = sinks != null ? List.copyOf(sinks) : List.of();
    }

    public DegradationEvent recordDegradation(Subsystem subsystem, DegradationKind kind, String message) {
        DegradationEvent event = new DegradationEvent(subsystem, kind, message, Instant.now(clock));
        log.warn("[Telemetry] DEGRADATION: {} | {} | {}", subsystem.wireName(), kind.wireName(), message);
        for (TelemetryPort sink : sinks) {
            try {
                sink.recordDegradation(event);
            } catch (RuntimeException e) { // NOSONAR - telemetry must be best effort
                log.warn("[Telemetry] Sink {} failed to record degradation: {}",
                        sink.getClass().getSimpleName(), e.getMessage());
            }
        }
        return event;
    }

    public void logTurn(TurnMetrics metrics) {
        for (TelemetryPort sink : sinks) {
            try {
                sink.logTurn(metrics);
            } catch (RuntimeException e) { // NOSONAR - telemetry must be best effort
                log.warn("[Telemetry] Sink {} failed to log turn {}: {}",
                        sink.getClass().getSimpleName(), metrics.getSessionId(), e.getMessage());
            }
        }
    }
}
