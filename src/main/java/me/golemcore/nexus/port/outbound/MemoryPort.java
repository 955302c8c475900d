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

import me.golemcore.nexus.domain.budget.BudgetReport;
import me.golemcore.nexus.domain.model.MemoryQuery;

import java.util.concurrent.CompletableFuture;

/**
 * Port for semantic memory retrieval.
 */
public interface MemoryPort {

    /**
     * Retrieves context relevant to the request, rendered as prompt text.
     *
     * @param query
     *            user, session, request text, query embedding and expertise
     *            domains
     * @param budget
     *            snapshot of the turn's budget taken before retrieval, for
     *            sizing the output; the turn's budget itself is only charged
     *            during prompt assembly
     */
    CompletableFuture<String> retrieve(MemoryQuery query, BudgetReport budget);
}
