package me.golemcore.nexus.domain.prompt;

import me.golemcore.nexus.domain.model.IdentitySnapshot;
import me.golemcore.nexus.domain.model.PromptSection;
import me.golemcore.nexus.domain.model.SectionHeader;
import me.golemcore.nexus.infrastructure.config.NexusProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PromptSectionsBuilderTest {

    private final PromptSectionsBuilder builder = new PromptSectionsBuilder(new NexusProperties());

    @Test
    void shouldBuildFiveSectionsInPriorityOrder() {
        List<PromptSection> sections = builder.build(IdentitySnapshot.MINIMAL_SKELETON_IDENTITY, "calm",
                "- likes tea", "What should I drink?");

        assertEquals(List.of(SectionHeader.SYSTEM, SectionHeader.IDENTITY_SNAPSHOT, SectionHeader.MOOD_STATE,
                SectionHeader.RELEVANT_MEMORY, SectionHeader.CURRENT_REQUEST),
                sections.stream().map(PromptSection::getHeader).toList());
        assertEquals("Act as the kernel defined in IDENTITY SNAPSHOT.", sections.get(0).getContent());
        assertEquals("calm", sections.get(2).getContent());
        assertEquals("- likes tea", sections.get(3).getContent());
        assertEquals("What should I drink?", sections.get(4).getContent());
    }

    @Test
    void shouldUseNeutralTextForEmptyMemory() {
        List<PromptSection> sections = builder.build(IdentitySnapshot.MINIMAL_SKELETON_IDENTITY, "calm", "  ",
                "hi");

        assertEquals(PromptSectionsBuilder.NO_PRIOR_CONTEXT, sections.get(3).getContent());
    }

    @Test
    void shouldUseConfiguredSystemInstruction() {
        NexusProperties properties = new NexusProperties();
        properties.getPrompt().setSystemInstruction("Be brief.");

        List<PromptSection> sections = new PromptSectionsBuilder(properties)
                .build(IdentitySnapshot.MINIMAL_SKELETON_IDENTITY, "calm", "", "hi");

        assertEquals("Be brief.", sections.get(0).getContent());
    }

    @Test
    void shouldRenderIdentityFields() {
        IdentitySnapshot identity = IdentitySnapshot.builder()
                .name("Ada")
                .role("Tutor")
                .coreValue("patience")
                .coreValue("rigor")
                .communicationStyle("socratic")
                .expertiseDomain("math")
                .expertiseDomain("physics")
                .invariant("Never give the final answer first.")
                .version("v3")
                .build();

        assertEquals("Name: Ada\n"
                + "Role: Tutor\n"
                + "Core Values: patience, rigor\n"
                + "Communication: socratic\n"
                + "Expertise: math, physics\n"
                + "Invariants: Never give the final answer first.",
                PromptSectionsBuilder.renderIdentity(identity));
    }
}
