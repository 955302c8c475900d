package me.golemcore.nexus.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.nexus.adapter.inbound.web.dto.TurnRequestBody;
import me.golemcore.nexus.domain.loop.TurnOrchestrator;
import me.golemcore.nexus.domain.model.TurnRequest;
import me.golemcore.nexus.domain.model.TurnResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Runs turns over HTTP. A failed turn is still a {@code 200} carrying the
 * error variant of {@link TurnResult}; only malformed requests are rejected.
 */
@RestController
@RequestMapping("/api/turns")
@RequiredArgsConstructor
@Slf4j
public class TurnController {

    private final TurnOrchestrator orchestrator;

    @PostMapping
    public Mono<ResponseEntity<TurnResult>> processTurn(@RequestBody TurnRequestBody body) {
        requireText(body.getUserId(), "userId");
        requireText(body.getSessionId(), "sessionId");
        requireText(body.getText(), "text");

        TurnRequest request = TurnRequest.builder()
                .userId(body.getUserId())
                .sessionId(body.getSessionId())
                .userText(body.getText())
                .build();
        log.debug("[API] Turn requested: user={}, session={}", request.getUserId(), request.getSessionId());
        return Mono.fromFuture(() -> orchestrator.processTurnAsync(request))
                .map(ResponseEntity::ok);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, field + " is required");
        }
    }
}
