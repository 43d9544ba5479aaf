/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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
 */

package org.fireflyframework.dqchecker.ledger;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link LedgerSink} keeping attempts in memory. Used when the application provides
 * no ledger of its own, and in tests.
 */
@Slf4j
public class InMemoryLedgerSink implements LedgerSink {

    private final Map<String, ExecutionAttempt> attempts = new ConcurrentHashMap<>();

    @Override
    public Mono<AttemptHandle> createAttempt(String runId, CheckScope scope) {
        return Mono.fromCallable(() -> {
            ExecutionAttempt attempt = new ExecutionAttempt(runId, scope);
            if (attempts.putIfAbsent(runId, attempt) != null) {
                throw new IllegalStateException("Attempt " + runId + " already exists");
            }
            log.debug("Recorded attempt {} for {}", runId, scope);
            return AttemptHandle.of(runId);
        });
    }

    @Override
    public Mono<Void> updateAttempt(AttemptHandle handle, AttemptUpdate update) {
        return Mono.fromRunnable(() -> {
            ExecutionAttempt attempt = attempts.get(handle.getLedgerKey());
            if (attempt == null) {
                throw new IllegalStateException("Unknown attempt " + handle.getRunId());
            }
            attempt.apply(update);
            log.debug("Attempt {} is now {}", handle.getRunId(), update.getStatus().getValue());
        });
    }

    public Optional<ExecutionAttempt> findAttempt(String runId) {
        return Optional.ofNullable(attempts.get(runId));
    }

    public List<ExecutionAttempt> getAttempts() {
        return List.copyOf(attempts.values());
    }
}
