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

import me.golemcore.nexus.domain.model.MoodState;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the affective-state provider.
 */
public interface MoodPort {

    /**
     * Loads the last stored mood of a user.
     */
    CompletableFuture<MoodState> resolve(String userId);

    /**
     * Projects a stored mood to {@code now}. Pure, no I/O.
     */
    MoodState decay(MoodState state, Instant now);

    /**
     * Renders the text injected into the MOOD STATE prompt section.
     */
    String render(MoodState state);
}
