package me.golemcore.nexus.adapter.outbound.identity;

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
import me.golemcore.nexus.domain.model.IdentitySnapshot;
import me.golemcore.nexus.port.outbound.IdentityPort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local identity registry keyed by user id. Unknown users fail with
 * {@link IdentityNotFoundException}.
 */
@Component
@Slf4j
public class InMemoryIdentityAdapter implements IdentityPort {

    private final Map<String, IdentitySnapshot> identities = new ConcurrentHashMap<>();

    public void register(String userId, IdentitySnapshot identity) {
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(identity, "identity must not be null");
        identities.put(userId, identity);
        log.debug("[Identity] Registered {} (version {}) for user {}", identity.getName(), identity.getVersion(),
                userId);
    }

    public boolean remove(String userId) {
        return identities.remove(userId) != null;
    }

    @Override
    public CompletableFuture<IdentitySnapshot> resolve(String userId) {
        IdentitySnapshot identity = userId != null ? identities.get(userId) : null;
        if (identity == null) {
            return CompletableFuture.failedFuture(new IdentityNotFoundException(userId));
        }
        return CompletableFuture.completedFuture(identity);
    }
}
