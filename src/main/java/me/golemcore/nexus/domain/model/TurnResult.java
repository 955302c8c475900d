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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Tagged outcome of a turn. Exactly one of {@link #response} and
 * {@link #error} is set; callers branch on {@link #hasError()}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TurnResult {

    public static final String SERVICE_UNAVAILABLE = "Service temporarily unavailable";

    String response;
    String identityVersion;
    MoodState moodState;
    String error;
    TurnMetrics metrics;

    public static TurnResult success(String response, String identityVersion, MoodState moodState,
            TurnMetrics metrics) {
        return new TurnResult(response, identityVersion, moodState, null, metrics);
    }

    public static TurnResult failure(TurnMetrics metrics) {
        return new TurnResult(null, null, null, SERVICE_UNAVAILABLE, metrics);
    }

    @JsonIgnore
    public boolean hasError() {
        return error != null;
    }
}
