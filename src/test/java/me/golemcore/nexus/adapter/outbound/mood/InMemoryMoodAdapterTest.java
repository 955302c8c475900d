package me.golemcore.nexus.adapter.outbound.mood;

import me.golemcore.nexus.domain.model.MoodState;
import me.golemcore.nexus.infrastructure.config.NexusProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMoodAdapterTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    private final InMemoryMoodAdapter adapter = new InMemoryMoodAdapter(new NexusProperties());

    private static MoodState excited() {
        return MoodState.builder()
                .label("excited")
                .valence(0.8)
                .arousal(1.0)
                .updatedAt(T0)
                .build();
    }

    @Test
    void shouldResolveBaselineForUnknownUser() {
        assertSame(MoodState.BASELINE, adapter.resolve("nobody").join());
    }

    @Test
    void shouldResolveStoredMood() {
        adapter.store("user-1", excited());

        assertEquals(excited(), adapter.resolve("user-1").join());
    }

    @Test
    void shouldHalveDistanceToBaselineAfterOneHalfLife() {
        MoodState decayed = adapter.decay(excited(), T0.plus(Duration.ofMinutes(30)));

        assertEquals(0.4, decayed.getValence(), 1e-9);
        assertEquals(0.6, decayed.getArousal(), 1e-9);
        assertEquals("excited", decayed.getLabel());
        assertEquals(T0.plus(Duration.ofMinutes(30)), decayed.getUpdatedAt());
    }

    @Test
    void shouldSettleToBaselineLabelAfterLongIdle() {
        MoodState decayed = adapter.decay(excited(), T0.plus(Duration.ofHours(12)));

        assertEquals(MoodState.BASELINE.getLabel(), decayed.getLabel());
        assertEquals(MoodState.BASELINE.getValence(), decayed.getValence(), 1e-3);
        assertEquals(MoodState.BASELINE.getArousal(), decayed.getArousal(), 1e-3);
    }

    @Test
    void shouldLeaveStateUntouchedWhenNoTimePassed() {
        MoodState state = excited();

        assertSame(state, adapter.decay(state, T0));
        assertSame(state, adapter.decay(state, T0.minusSeconds(5)));
    }

    @Test
    void shouldRenderAffect() {
        assertEquals("Current mood: excited (valence +0.80, arousal 1.00). "
                + "Let it shape tone, never facts or decisions.", adapter.render(excited()));
    }

    @Test
    void shouldRejectNonPositiveHalfLife() {
        NexusProperties properties = new NexusProperties();
        properties.getMood().setHalfLifeMinutes(0);

        assertThrows(IllegalArgumentException.class, () -> new InMemoryMoodAdapter(properties));
    }
}
