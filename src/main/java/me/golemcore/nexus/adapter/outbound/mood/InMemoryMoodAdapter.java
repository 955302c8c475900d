package me.golemcore.nexus.adapter.outbound.mood;

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
import me.golemcore.nexus.domain.model.MoodState;
import me.golemcore.nexus.infrastructure.config.NexusProperties;
import me.golemcore.nexus.port.outbound.MoodPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local mood store. Users without a stored mood resolve to
 * {@link MoodState#BASELINE}.
 *
 * <p>
 * Decay is exponential: after one half-life, the distance of valence and
 * arousal from the baseline is halved. Once both are within
 * {@link #SETTLED_DISTANCE} of the baseline the label returns to the
 * baseline's.
 */
@Component
@Slf4j
public class InMemoryMoodAdapter implements MoodPort {

    static final double SETTLED_DISTANCE = 0.05;

    private final Map<String, MoodState> moods = new ConcurrentHashMap<>();
    private final double halfLifeMinutes;

    public InMemoryMoodAdapter(NexusProperties properties) {
        long configured = properties.getMood().getHalfLifeMinutes();
        if (configured <= 0) {
            throw new IllegalArgumentException("nexus.mood.half-life-minutes must be positive, got " + configured);
        }
        this.halfLifeMinutes = configured;
    }

    public void store(String userId, MoodState state) {
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(state, "state must not be null");
        moods.put(userId, state);
        log.debug("[Mood] Stored {} for user {}", state.getLabel(), userId);
    }

    @Override
    public CompletableFuture<MoodState> resolve(String userId) {
        MoodState stored = userId != null ? moods.get(userId) : null;
        return CompletableFuture.completedFuture(stored != null ? stored : MoodState.BASELINE);
    }

    @Override
    public MoodState decay(MoodState state, Instant now) {
        MoodState baseline = MoodState.BASELINE;
        if (state.getUpdatedAt() == null || !now.isAfter(state.getUpdatedAt())) {
            return state;
        }

        double elapsedMinutes = Duration.between(state.getUpdatedAt(), now).toMillis() / 60_000.0;
        double factor = Math.pow(0.5, elapsedMinutes / halfLifeMinutes);
        double valence = baseline.getValence() + (state.getValence() - baseline.getValence()) * factor;
        double arousal = baseline.getArousal() + (state.getArousal() - baseline.getArousal()) * factor;

        boolean settled = Math.abs(valence - baseline.getValence()) < SETTLED_DISTANCE
                && Math.abs(arousal - baseline.getArousal()) < SETTLED_DISTANCE;
        return state.toBuilder()
                .label(settled ? baseline.getLabel() : state.getLabel())
                .valence(valence)
                .arousal(arousal)
                .updatedAt(now)
                .build();
    }

    @Override
    public String render(MoodState state) {
        return String.format(Locale.ROOT,
                "Current mood: %s (valence %+.2f, arousal %.2f). Let it shape tone, never facts or decisions.",
                state.getLabel(), state.getValence(), state.getArousal());
    }
}
