package me.golemcore.nexus.port.outbound;

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

import me.golemcore.nexus.domain.model.DegradationEvent;
import me.golemcore.nexus.domain.model.TurnMetrics;

/**
 * Write-only sink for pipeline telemetry. Calls are fire-and-forget.
 */
public interface TelemetryPort {

    void recordDegradation(DegradationEvent event);

    void logTurn(TurnMetrics metrics);
}
