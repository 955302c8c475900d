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

/**
 * Pipeline states of a single turn, in the order they are entered.
 * {@link #FAILED} is only reachable from the generation step.
 */
public enum TurnState {
    INIT,
    IDENTITY_RESOLVED,
    MOOD_RESOLVED,
    BUDGET_READY,
    MEMORY_RESOLVED,
    PROMPT_ASSEMBLED,
    RESPONSE_READY,
    FAILED;

    public boolean isTerminal() {
        return this == RESPONSE_READY || this == FAILED;
    }

    /**
     * Whether the pipeline may move from this state to {@code next}.
     */
    public boolean canTransitionTo(TurnState next) {
        if (isTerminal() || next == null) {
            return false;
        }
        if (next == FAILED) {
            return this == PROMPT_ASSEMBLED;
        }
        return next.ordinal() == ordinal() + 1;
    }
}
