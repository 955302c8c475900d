package me.golemcore.nexus.adapter.outbound.telemetry;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.nexus.domain.model.DegradationEvent;
import me.golemcore.nexus.domain.model.TurnMetrics;
import me.golemcore.nexus.port.outbound.TelemetryPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes telemetry as one JSON object per line to the {@code nexus.telemetry}
 * logger, so it can be routed to its own appender.
 */
@Component
@Slf4j
public class LoggingTelemetryAdapter implements TelemetryPort {

    static final String TELEMETRY_LOGGER = "nexus.telemetry";

    private static final Logger TELEMETRY = LoggerFactory.getLogger(TELEMETRY_LOGGER);

    private final ObjectMapper objectMapper;

    public LoggingTelemetryAdapter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void recordDegradation(DegradationEvent event) {
        if (TELEMETRY.isDebugEnabled()) {
            TELEMETRY.debug("{}", toJson(event));
        }
    }

    @Override
    public void logTurn(TurnMetrics metrics) {
        TELEMETRY.info("{}", toJson(metrics));
    }

    String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("[Telemetry] Failed to serialize {}: {}", value.getClass().getSimpleName(), e.getMessage());
            return String.valueOf(value);
        }
    }
}
