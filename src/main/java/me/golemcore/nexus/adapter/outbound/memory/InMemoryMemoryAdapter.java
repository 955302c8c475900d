package me.golemcore.nexus.adapter.outbound.memory;

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
import me.golemcore.nexus.domain.model.MemoryQuery;
import me.golemcore.nexus.domain.prompt.TokenCounter;
import me.golemcore.nexus.infrastructure.config.NexusProperties;
import me.golemcore.nexus.port.outbound.MemoryPort;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local memory store with lexical ranking.
 *
 * <p>
 * A note scores by the share of request tokens it contains, plus
 * {@link #EXPERTISE_BOOST} when a matching note also mentions one of the
 * identity's expertise domains. Notes without any overlap are never returned. The rendered list holds at
 * most {@code nexus.memory.max-items} bullets and at most
 * {@code nexus.memory.max-budget-share} of the remaining tokens reported by
 * the budget snapshot.
 */
@Component
@Slf4j
public class InMemoryMemoryAdapter implements MemoryPort {

    static final double EXPERTISE_BOOST = 0.25;

    private static final String BULLET = "- ";

    private final Map<String, List<MemoryNote>> notesByUser = new ConcurrentHashMap<>();
    private final TokenCounter tokenCounter;
    private final int maxItems;
    private final double maxBudgetShare;

    public InMemoryMemoryAdapter(TokenCounter tokenCounter, NexusProperties properties) {
        this.tokenCounter = tokenCounter;
        this.maxItems = properties.getMemory().getMaxItems();
        this.maxBudgetShare = properties.getMemory().getMaxBudgetShare();
    }

    public void remember(String userId, MemoryNote note) {
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(note, "note must not be null");
        notesByUser.computeIfAbsent(userId, key -> new CopyOnWriteArrayList<>()).add(note);
    }

    @Override
    public CompletableFuture<String> retrieve(MemoryQuery query, BudgetReport budget) {
        List<MemoryNote> notes = notesByUser.getOrDefault(query.getUserId(), List.of());
        if (notes.isEmpty()) {
            return CompletableFuture.completedFuture("");
        }

        Set<String> requestTokens = tokenize(query.getRequestText());
        List<String> domains = query.getExpertiseDomains().stream()
                .map(domain -> domain.toLowerCase(Locale.ROOT))
                .toList();

        List<ScoredNote> ranked = new ArrayList<>();
        for (MemoryNote note : notes) {
            if (note.getSessionId() != null && !note.getSessionId().equals(query.getSessionId())) {
                continue;
            }
            double score = score(note, requestTokens, domains);
            if (score > 0.0) {
                ranked.add(new ScoredNote(note, score));
            }
        }
        ranked.sort(Comparator.comparingDouble(ScoredNote::score).reversed()
                .thenComparing(scored -> scored.note().getCreatedAt(),
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())));

        String rendered = render(ranked, (int) Math.floor(budget.getRemaining() * maxBudgetShare));
        log.debug("[Memory] {} of {} notes matched for user {}", ranked.size(), notes.size(), query.getUserId());
        return CompletableFuture.completedFuture(rendered);
    }

    private String render(List<ScoredNote> ranked, int tokenAllowance) {
        StringBuilder sb = new StringBuilder();
        int spent = 0;
        int items = 0;
        for (ScoredNote scored : ranked) {
            if (items >= maxItems) {
                break;
            }
            String line = BULLET + scored.note().getContent().strip() + "\n";
            int cost = tokenCounter.count(line);
            if (spent + cost > tokenAllowance) {
                break;
            }
            sb.append(line);
            spent += cost;
            items++;
        }
        return sb.toString().stripTrailing();
    }

    private double score(MemoryNote note, Set<String> requestTokens, List<String> domains) {
        if (note.getContent() == null || note.getContent().isBlank()) {
            return 0.0;
        }
        StringBuilder searchable = new StringBuilder(note.getContent());
        for (String tag : note.getTags()) {
            searchable.append(' ').append(tag);
        }
        Set<String> noteTokens = tokenize(searchable.toString());

        double relevance = 0.0;
        if (!requestTokens.isEmpty()) {
            int matches = 0;
            for (String token : requestTokens) {
                if (noteTokens.contains(token)) {
                    matches++;
                }
            }
            relevance = (double) matches / (double) requestTokens.size();
        }

        String lowered = searchable.toString().toLowerCase(Locale.ROOT);
        boolean expertise = domains.stream().anyMatch(domain -> !domain.isBlank() && lowered.contains(domain));
        return relevance > 0.0 && expertise ? relevance + EXPERTISE_BOOST : relevance;
    }

    private Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        String[] raw = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}_./#-]+");
        for (String token : raw) {
            if (token.length() >= 3) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private record ScoredNote(MemoryNote note, double score) {
    }
}
