package me.golemcore.nexus.domain.budget;

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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-turn token allocator that keeps the assembled prompt inside the context
 * window.
 *
 * <p>
 * The capacity ceiling is {@code floor(totalContext * safetyBufferFraction) -
 * reservedOutput}; with the defaults (128000, 0.85, 8000) that is 100800
 * tokens. Allocations either commit fully or leave the budget untouched, so
 * {@code used <= capacityCeiling} holds at all times.
 *
 * <p>
 * Not thread-safe: an instance belongs to exactly one turn and is mutated only
 * by that turn's assembly step. Create a fresh one per turn via
 * {@link TokenBudgetFactory}.
 */
@Slf4j
public class TokenBudget {

    public static final int DEFAULT_TOTAL_CONTEXT = 128_000;
    public static final int DEFAULT_RESERVED_OUTPUT = 8_000;
    public static final double DEFAULT_SAFETY_BUFFER_FRACTION = 0.85;
    public static final int DEFAULT_MINIMUM_VIABLE_CAPACITY = 1_000;

    private final int totalContext;
    private final int reservedOutput;
    private final double safetyBufferFraction;
    private final int capacityCeiling;
    private final Map<String, Integer> allocations = new HashMap<>();

    private int used;

    public TokenBudget(int totalContext, int reservedOutput, double safetyBufferFraction,
            int minimumViableCapacity) {
        this.totalContext = totalContext;
        this.reservedOutput = reservedOutput;
        this.safetyBufferFraction = safetyBufferFraction;
        this.capacityCeiling = computeCapacityCeiling(totalContext, reservedOutput, safetyBufferFraction);
        if (capacityCeiling < minimumViableCapacity) {
            throw new InsufficientContextException(capacityCeiling, minimumViableCapacity);
        }
    }

    public static TokenBudget withDefaults() {
        return new TokenBudget(DEFAULT_TOTAL_CONTEXT, DEFAULT_RESERVED_OUTPUT, DEFAULT_SAFETY_BUFFER_FRACTION,
                DEFAULT_MINIMUM_VIABLE_CAPACITY);
    }

    static int computeCapacityCeiling(int totalContext, int reservedOutput, double safetyBufferFraction) {
        return (int) Math.floor(totalContext * safetyBufferFraction) - reservedOutput;
    }

    /**
     * Attempts to allocate tokens for a component.
     *
     * @return {@code true} if the tokens were committed, {@code false} if they
     *         would exceed the ceiling (nothing is committed in that case)
     */
    public boolean allocate(String component, int tokenCount) {
        if (tokenCount < 0) {
            throw new IllegalArgumentException("tokenCount must not be negative: " + tokenCount);
        }
        if ((long) used + tokenCount > capacityCeiling) {
            log.warn("[Budget] Refused: {} requested {} tokens. Used: {}, Available: {}",
                    component, tokenCount, used, capacityCeiling);
            return false;
        }

        used += tokenCount;
        allocations.merge(component, tokenCount, Integer::sum);
        return true;
    }

    public int remaining() {
        return capacityCeiling - used;
    }

    public int getUsed() {
        return used;
    }

    public int getCapacityCeiling() {
        return capacityCeiling;
    }

    public int getTotalContext() {
        return totalContext;
    }

    public int getReservedOutput() {
        return reservedOutput;
    }

    public double getSafetyBufferFraction() {
        return safetyBufferFraction;
    }

    public Map<String, Integer> getAllocations() {
        return Collections.unmodifiableMap(allocations);
    }

    public BudgetReport report() {
        return BudgetReport.builder()
                .capacityCeiling(capacityCeiling)
                .used(used)
                .remaining(remaining())
                .utilizationPct(capacityCeiling > 0 ? (used * 100.0) / capacityCeiling : 0.0)
                .allocations(Map.copyOf(allocations))
                .build();
    }

    @Override
    public String toString() {
        return "TokenBudget{used=" + used + ", capacityCeiling=" + capacityCeiling + "}";
    }
}
