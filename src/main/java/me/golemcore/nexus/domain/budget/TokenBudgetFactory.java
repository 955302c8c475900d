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
import me.golemcore.nexus.infrastructure.config.NexusProperties;
import org.springframework.stereotype.Component;

/**
 * Creates a fresh {@link TokenBudget} for every turn from the deployment's
 * fixed parameters.
 *
 * <p>
 * The parameters are validated when the factory is constructed, so an
 * unusable context window fails application startup with
 * {@link InsufficientContextException} instead of failing turns later.
 */
@Component
@Slf4j
public class TokenBudgetFactory {

    private final int totalContext;
    private final int reservedOutput;
    private final double safetyBufferFraction;
    private final int minimumViableCapacity;

    public TokenBudgetFactory(NexusProperties properties) {
        NexusProperties.BudgetProperties budget = properties.getBudget();
        this.totalContext = budget.getTotalContext();
        this.reservedOutput = budget.getReservedOutput();
        this.safetyBufferFraction = budget.getSafetyBufferFraction();
        this.minimumViableCapacity = budget.getMinimumViableCapacity();

        TokenBudget probe = create();
        log.info("[Budget] Capacity ceiling: {} tokens (total={}, buffer={}, reservedOutput={})",
                probe.getCapacityCeiling(), totalContext, safetyBufferFraction, reservedOutput);
    }

    public TokenBudget create() {
        return new TokenBudget(totalContext, reservedOutput, safetyBufferFraction, minimumViableCapacity);
    }
}
