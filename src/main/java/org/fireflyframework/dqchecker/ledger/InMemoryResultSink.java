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
import org.fireflyframework.dqchecker.reconcile.CheckResult;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ResultSink} keeping results in memory.
 *
 * <p>When given the {@link InMemoryLedgerSink}, writes for an attempt that is already
 * terminal are rejected.</p>
 */
@Slf4j
public class InMemoryResultSink implements ResultSink {

    private final InMemoryLedgerSink ledger;
    private final Map<String, List<CheckResult>> results = new ConcurrentHashMap<>();

    public InMemoryResultSink() {
        this(null);
    }

    public InMemoryResultSink(InMemoryLedgerSink ledger) {
        this.ledger = ledger;
    }

    @Override
    public Mono<Void> persistResult(String runId, CheckResult result) {
        return Mono.fromRunnable(() -> {
            if (ledger != null && ledger.findAttempt(runId).map(ExecutionAttempt::isTerminal).orElse(false)) {
                throw new IllegalStateException("Attempt " + runId + " is terminal; result rejected");
            }
            results.computeIfAbsent(runId, id -> Collections.synchronizedList(new ArrayList<>())).add(result);
            log.trace("Stored result for check {} in run {}", result.getCheckId(), runId);
        });
    }

    public List<CheckResult> getResults(String runId) {
        List<CheckResult> stored = results.get(runId);
        if (stored == null) {
            return List.of();
        }
        synchronized (stored) {
            return List.copyOf(stored);
        }
    }
}
