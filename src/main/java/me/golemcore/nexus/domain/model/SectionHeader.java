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

import java.util.Locale;

/**
 * Closed set of prompt section headers, declared in their fixed priority order.
 * Each header carries the policy the assembler applies when the budget refuses
 * the section.
 */
public enum SectionHeader {

    SYSTEM("SYSTEM", RefusalPolicy.OMIT),

    IDENTITY_SNAPSHOT("IDENTITY SNAPSHOT", RefusalPolicy.OMIT),

    MOOD_STATE("MOOD STATE", RefusalPolicy.OMIT),

    RELEVANT_MEMORY("RELEVANT MEMORY", RefusalPolicy.PLACEHOLDER),

    /**
     * The user's message. Its cost is reserved before any other section is
     * allocated, so it is never dropped.
     */
    CURRENT_REQUEST("CURRENT REQUEST", RefusalPolicy.RESERVE);

    /**
     * What happens to a section the budget cannot accommodate.
     */
    public enum RefusalPolicy {
        /** Drop the section, header included. */
        OMIT,
        /** Keep the header, replace the content with a fixed placeholder. */
        PLACEHOLDER,
        /** Allocate ahead of all other sections; truncate if even that fails. */
        RESERVE
    }

    private final String title;
    private final RefusalPolicy refusalPolicy;

    SectionHeader(String title, RefusalPolicy refusalPolicy) {
        this.title = title;
        this.refusalPolicy = refusalPolicy;
    }

    public String getTitle() {
        return title;
    }

    public RefusalPolicy getRefusalPolicy() {
        return refusalPolicy;
    }

    public boolean isDegradable() {
        return refusalPolicy == RefusalPolicy.PLACEHOLDER;
    }

    /**
     * Budget component name for this section (the lowercased title).
     */
    public String componentName() {
        return title.toLowerCase(Locale.ROOT);
    }
}
