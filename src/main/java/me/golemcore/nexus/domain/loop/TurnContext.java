package me.golemcore.nexus.domain.loop;

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
import me.golemcore.nexus.domain.budget.BudgetReport;
import me.golemcore.nexus.domain.budget.TokenBudget;
import me.golemcore.nexus.domain.model.DegradationEvent;
import me.golemcore.nexus.domain.model.Resolution;
import me.golemcore.nexus.domain.model.TurnMetrics;
import me.golemcore.nexus.domain.model.TurnRequest;
import me.golemcore.nexus.domain.model.TurnState;
import me.golemcore.nexus.domain.model.TurnStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable per-turn state. Confined to the thread running the turn and never
 * shared between turns.
 */
@Slf4j
class TurnContext {

    private final TurnRequest request;
    private final Clock clock;
    private final long startedAtMillis;
    private final List<DegradationEvent> degradations = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private TurnState state = TurnState.INIT;
    private TokenBudget budget;
    private boolean finished;

    TurnContext(TurnRequest request, Clock clock) {
        this.request = request;
        this.clock = clock;
        this.startedAtMillis = clock.millis();
    }

    TurnRequest getRequest() {
        return request;
    }

    TurnState getState() {
        return state;
    }

    TokenBudget getBudget() {
        return budget;
    }

    void setBudget(TokenBudget budget) {
        this.budget = budget;
    }

    List<DegradationEvent> getDegradations() {
        return List.copyOf(degradations);
    }

    void transitionTo(TurnState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal turn transition " + state + " -> " + next);
        }
        log.debug("[Turn] {} -> {} (session={})", state, next, request.getSessionId());
        state = next;
    }

    <T> T accept(Resolution<T> resolution) {
        resolution.getDegradation().ifPresent(degradations::add);
        return resolution.getValue();
    }

    void addDegradation(DegradationEvent event) {
        degradations.add(event);
    }

    void addError(String code) {
        errors.add(code);
    }

    /**
     * Freezes the turn into its metrics. May be called once.
     */
    TurnMetrics finish() {
        if (finished) {
            throw new IllegalStateException("Turn metrics already built for session " + request.getSessionId());
        }
        finished = true;

        TurnMetrics.TurnMetricsBuilder metrics = TurnMetrics.builder()
                .userId(request.getUserId())
                .sessionId(request.getSessionId())
                .totalLatencyMs(Math.max(0, clock.millis() - startedAtMillis))
                .degradationEvents(degradations)
                .errors(errors)
                .finalState(state)
                .status(status())
                .timestamp(Instant.now(clock));
        if (budget != null) {
            BudgetReport report = budget.report();
            metrics.tokensUsed(report.getUsed())
                    .capacityCeiling(report.getCapacityCeiling())
                    .budgetUtilizationPct(report.getUtilizationPct())
                    .sectionAllocations(report.getAllocations());
        }
        return metrics.build();
    }

    private TurnStatus status() {
        if (state == TurnState.FAILED) {
            return TurnStatus.FAILED;
        }
        return degradations.isEmpty() ? TurnStatus.SUCCESS : TurnStatus.DEGRADED;
    }
}
