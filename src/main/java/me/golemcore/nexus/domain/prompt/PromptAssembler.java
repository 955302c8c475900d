package me.golemcore.nexus.domain.prompt;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.nexus.domain.budget.TokenBudget;
import me.golemcore.nexus.domain.model.PromptSection;
import me.golemcore.nexus.domain.model.SectionHeader;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Joins an ordered list of prompt sections into the final prompt without
 * exceeding the turn's {@link TokenBudget}.
 *
 * <p>
 * Each section is wrapped as {@code ---\n## HEADER\ncontent\n} and its cost is
 * measured on the wrapped text. Sections are emitted in input order. When the
 * budget refuses a section, the header's
 * {@link SectionHeader.RefusalPolicy refusal policy} decides:
 * <ul>
 * <li>{@code PLACEHOLDER} - the section is kept with
 * {@link #MEMORY_OMITTED_PLACEHOLDER} as content, without charging the
 * budget;</li>
 * <li>{@code OMIT} - the section disappears, header included;</li>
 * <li>{@code RESERVE} - never reached in order: such sections are allocated
 * before all others and truncated if even that fails.</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PromptAssembler {

    public static final String MEMORY_OMITTED_PLACEHOLDER = "[Memory context omitted due to budget constraints]";
    public static final String REQUEST_TRUNCATED_MARKER = "[Request truncated to fit context budget]";

    private static final String DELIMITER = "---\n";
    private static final String HEADER_PREFIX = "## ";
    private static final String SECTION_SEPARATOR = "\n";

    private final TokenCounter tokenCounter;

    public String formatSection(SectionHeader header, String content) {
        return DELIMITER + HEADER_PREFIX + header.getTitle() + "\n" + content + "\n";
    }

    public String assemble(List<PromptSection> sections, TokenBudget budget) {
        requireUniqueHeaders(sections);

        Map<Integer, String> reserved = reserveSections(sections, budget);

        List<String> parts = new ArrayList<>(sections.size());
        for (int i = 0; i < sections.size(); i++) {
            String reservedSection = reserved.get(i);
            if (reservedSection != null) {
                parts.add(reservedSection);
                continue;
            }

            PromptSection section = sections.get(i);
            SectionHeader header = section.getHeader();
            String formatted = formatSection(header, section.getContent());
            int cost = tokenCounter.count(formatted);

            if (budget.allocate(header.componentName(), cost)) {
                parts.add(formatted);
            } else if (header.isDegradable()) {
                log.warn("[Assembler] {} refused ({} tokens), substituting placeholder", header.getTitle(), cost);
                parts.add(formatSection(header, MEMORY_OMITTED_PLACEHOLDER));
            } else {
                log.warn("[Assembler] {} refused ({} tokens), omitting section", header.getTitle(), cost);
            }
        }

        String prompt = String.join(SECTION_SEPARATOR, parts);
        log.debug("[Assembler] Assembled {} of {} sections, {} tokens used",
                parts.size(), sections.size(), budget.getUsed());
        return prompt;
    }

    private Map<Integer, String> reserveSections(List<PromptSection> sections, TokenBudget budget) {
        Map<Integer, String> reserved = new HashMap<>();
        for (int i = 0; i < sections.size(); i++) {
            PromptSection section = sections.get(i);
            SectionHeader header = section.getHeader();
            if (header.getRefusalPolicy() != SectionHeader.RefusalPolicy.RESERVE) {
                continue;
            }

            String formatted = formatSection(header, section.getContent());
            if (budget.allocate(header.componentName(), tokenCounter.count(formatted))) {
                reserved.put(i, formatted);
            } else {
                reserved.put(i, truncateToFit(section, budget));
            }
        }
        return reserved;
    }

    private String truncateToFit(PromptSection section, TokenBudget budget) {
        SectionHeader header = section.getHeader();
        String suffix = "\n" + REQUEST_TRUNCATED_MARKER;
        int available = budget.remaining();
        int allowance = available - tokenCounter.count(formatSection(header, suffix));

        // BPE merges across the cut can make the joined text cost slightly
        // more than its parts, so shrink until the formatted section fits.
        while (allowance > 0) {
            String formatted = formatSection(header, tokenCounter.truncate(section.getContent(), allowance) + suffix);
            int cost = tokenCounter.count(formatted);
            if (budget.allocate(header.componentName(), cost)) {
                log.warn("[Assembler] {} truncated to {} tokens to fit the budget", header.getTitle(), cost);
                return formatted;
            }
            allowance -= Math.max(1, cost - available);
        }

        String markerOnly = formatSection(header, REQUEST_TRUNCATED_MARKER);
        if (!budget.allocate(header.componentName(), tokenCounter.count(markerOnly))) {
            log.error("[Assembler] {} does not fit even as a marker; emitting marker uncharged", header.getTitle());
        }
        return markerOnly;
    }

    private void requireUniqueHeaders(List<PromptSection> sections) {
        Set<SectionHeader> seen = EnumSet.noneOf(SectionHeader.class);
        for (PromptSection section : sections) {
            if (!seen.add(section.getHeader())) {
                throw new IllegalArgumentException("Duplicate prompt section: " + section.getHeader().getTitle());
            }
        }
    }
}
