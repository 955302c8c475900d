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
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Persona kernel resolved for a user at the start of a turn. Owned by the
 * identity provider; the pipeline treats it as an immutable input.
 */
@Value
@Builder(toBuilder = true)
public class IdentitySnapshot {

    /**
     * Minimal safe persona used whenever identity resolution is unavailable.
     * Built once per process and never mutated.
     */
    public static final IdentitySnapshot MINIMAL_SKELETON_IDENTITY = IdentitySnapshot.builder()
            .name("Nexus")
            .role("General-purpose assistant")
            .coreValue("honesty")
            .coreValue("helpfulness")
            .coreValue("safety")
            .communicationStyle("clear, concise, neutral")
            .invariant("Never claim capabilities you do not have.")
            .invariant("Never fabricate prior context.")
            .version("skeleton-0")
            .build();

    String name;
    String role;
    @Singular
    List<String> coreValues;
    String communicationStyle;
    @Singular
    List<String> expertiseDomains;
    @Singular
    List<String> invariants;
    String version;
}
