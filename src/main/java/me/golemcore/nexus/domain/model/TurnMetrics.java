package me.golemcore.nexus.domain.model;

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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Complete telemetry for a single turn. Built once when the turn finishes and
 * emitted exactly once.
 */
@Value
@Builder
public class TurnMetrics {

    String userId;
    String sessionId;
    long totalLatencyMs;
    int tokensUsed;
    int capacityCeiling;
    double budgetUtilizationPct;
    @Singular
    Map<String, Integer> sectionAllocations;
    @Singular
    List<DegradationEvent> degradationEvents;
    /** Machine-readable failure codes, e.g. {@code generation.request.timeout}. */
    @Singular
    List<String> errors;
    TurnState finalState;
    TurnStatus status;
    Instant timestamp;

    public boolean isDegraded() {
        return !degradationEvents.isEmpty();
    }
}
