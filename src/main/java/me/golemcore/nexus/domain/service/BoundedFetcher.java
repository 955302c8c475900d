package me.golemcore.nexus.domain.service;

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
import me.golemcore.nexus.domain.model.DegradationKind;
import me.golemcore.nexus.domain.model.Resolution;
import me.golemcore.nexus.domain.model.Subsystem;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Races a collaborator call against a deadline and converts every failure into
 * a fallback {@link Resolution}.
 *
 * <p>
 * The call is started on the fetch executor, so a collaborator that blocks
 * before returning its future cannot stall the turn. The deadline runs from
 * the moment {@link #fetch} is invoked. On expiry both the queued call and the
 * future returned by the collaborator are cancelled; whether the collaborator
 * actually stops is up to it. The
 * returned future never completes exceptionally.
 */
@Component
@Slf4j
public class BoundedFetcher {

    private final Executor fetchExecutor;
    private final TelemetryRecorder telemetryRecorder;

    public BoundedFetcher(@Qualifier("fetchExecutor") Executor fetchExecutor,
            TelemetryRecorder telemetryRecorder) {
        this.fetchExecutor = fetchExecutor;
        this.telemetryRecorder = telemetryRecorder;
    }

    public <T> CompletableFuture<Resolution<T>> fetch(Subsystem subsystem, Supplier<CompletableFuture<T>> call,
            Duration timeout, T fallback) {
        AtomicReference<CompletableFuture<T>> collaborator = new AtomicReference<>();
        AtomicBoolean expired = new AtomicBoolean();
        CompletableFuture<CompletableFuture<T>> started;
        try {
            started = CompletableFuture.supplyAsync(() -> {
                CompletableFuture<T> future = call.get();
                collaborator.set(future);
                if (expired.get() && future != null) {
                    future.cancel(true);
                }
                return future;
            }, fetchExecutor);
        } catch (RuntimeException e) { // NOSONAR - executor rejection degrades like any other failure
            return CompletableFuture.completedFuture(degrade(subsystem, DegradationKind.ERROR,
                    "could not start fetch: " + describe(e), fallback));
        }

        CompletableFuture<T> bounded = started.thenCompose(Function.identity())
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        return bounded.handle((value, error) -> {
            if (error == null) {
                if (value == null) {
                    return degrade(subsystem, DegradationKind.ERROR, "collaborator returned no value", fallback);
                }
                return Resolution.resolved(value);
            }
            Throwable cause = unwrap(error);
            if (cause instanceof TimeoutException) {
                expired.set(true);
                cancel(started, collaborator.get());
                return degrade(subsystem, DegradationKind.TIMEOUT,
                        "no answer within " + timeout.toMillis() + "ms", fallback);
            }
            return degrade(subsystem, DegradationKind.ERROR, describe(cause), fallback);
        });
    }

    private static void cancel(CompletableFuture<?> started, CompletableFuture<?> collaborator) {
        // a call still queued on the executor never starts once this stage is cancelled
        started.cancel(true);
        if (collaborator != null) {
            collaborator.cancel(true);
        }
    }

    private <T> Resolution<T> degrade(Subsystem subsystem, DegradationKind kind, String message, T fallback) {
        log.debug("[Fetch] {} falling back ({}): {}", subsystem.wireName(), kind.wireName(), message);
        return Resolution.fallback(fallback, telemetryRecorder.recordDegradation(subsystem, kind, message));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        if (error instanceof CancellationException) {
            return "fetch cancelled";
        }
        String message = error.getMessage();
        return message != null && !message.isBlank()
                ? error.getClass().getSimpleName() + ": " + message
                : error.getClass().getSimpleName();
    }
}
