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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time affective state of the persona.
 *
 * <p>
 * {@code valence} ranges from -1 (negative) to 1 (positive), {@code arousal}
 * from 0 (calm) to 1 (activated). Decay towards {@link #BASELINE} is the mood
 * provider's concern; the pipeline only passes states through.
 */
@Value
@Builder(toBuilder = true)
public class MoodState {

    /** Neutral resting affect. Built once per process and never mutated. */
    public static final MoodState BASELINE = MoodState.builder()
            .label("neutral")
            .valence(0.0)
            .arousal(0.2)
            .updatedAt(Instant.EPOCH)
            .build();

    String label;
    double valence;
    double arousal;
    Instant updatedAt;
}
