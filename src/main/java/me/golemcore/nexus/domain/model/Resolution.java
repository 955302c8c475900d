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

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of resolving a fragment from a non-critical collaborator: either the
 * collaborator's value, or a fallback value together with the degradation that
 * caused it.
 *
 * @param <T>
 *            fragment type
 */
public final class Resolution<T> {

    private final T value;
    private final DegradationEvent degradation;

    private Resolution(T value, DegradationEvent degradation) {
        this.value = value;
        this.degradation = degradation;
    }

    public static <T> Resolution<T> resolved(T value) {
        return new Resolution<>(value, null);
    }

    public static <T> Resolution<T> fallback(T value, DegradationEvent degradation) {
        return new Resolution<>(value, Objects.requireNonNull(degradation, "degradation must not be null"));
    }

    public T getValue() {
        return value;
    }

    public boolean isFallback() {
        return degradation != null;
    }

    public Optional<DegradationEvent> getDegradation() {
        return Optional.ofNullable(degradation);
    }

    @Override
    public String toString() {
        return isFallback()
                ? "Resolution.fallback(" + degradation.subsystem() + ", " + degradation.kind() + ")"
                : "Resolution.resolved";
    }
}
