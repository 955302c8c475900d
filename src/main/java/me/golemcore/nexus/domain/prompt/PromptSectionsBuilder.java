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

import me.golemcore.nexus.domain.model.IdentitySnapshot;
import me.golemcore.nexus.domain.model.PromptSection;
import me.golemcore.nexus.domain.model.SectionHeader;
import me.golemcore.nexus.infrastructure.config.NexusProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the five turn sections in their fixed priority order.
 */
@Component
public class PromptSectionsBuilder {

    public static final String NO_PRIOR_CONTEXT = "[No prior relevant context]";

    private final String systemInstruction;

    public PromptSectionsBuilder(NexusProperties properties) {
        this.systemInstruction = properties.getPrompt().getSystemInstruction();
    }

    public List<PromptSection> build(IdentitySnapshot identity, String moodText, String memoryContext,
            String userText) {
        return List.of(
                PromptSection.of(SectionHeader.SYSTEM, systemInstruction),
                PromptSection.of(SectionHeader.IDENTITY_SNAPSHOT, renderIdentity(identity)),
                PromptSection.of(SectionHeader.MOOD_STATE, moodText),
                PromptSection.of(SectionHeader.RELEVANT_MEMORY,
                        memoryContext == null || memoryContext.isBlank() ? NO_PRIOR_CONTEXT : memoryContext),
                PromptSection.of(SectionHeader.CURRENT_REQUEST, userText));
    }

    public static String renderIdentity(IdentitySnapshot identity) {
        return "Name: " + identity.getName() + "\n"
                + "Role: " + identity.getRole() + "\n"
                + "Core Values: " + String.join(", ", identity.getCoreValues()) + "\n"
                + "Communication: " + identity.getCommunicationStyle() + "\n"
                + "Expertise: " + String.join(", ", identity.getExpertiseDomains()) + "\n"
                + "Invariants: " + String.join("; ", identity.getInvariants());
    }
}
