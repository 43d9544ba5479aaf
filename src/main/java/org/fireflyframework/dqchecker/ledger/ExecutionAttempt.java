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

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;

/**
 * One execution attempt: created {@code running}, then moved exactly once to
 * {@code completed} or {@code failed}. Any further transition throws
 * {@link IllegalStateException}.
 */
@Getter
@ToString(exclude = "generatedSpec")
public class ExecutionAttempt {

    private final String runId;
    private final CheckScope scope;
    private final Instant startedAt;

    private volatile ExecutionStatus status;
    private volatile ExecutionCounts counts;
    private volatile String error;
    private volatile String generatedSpec;
    private volatile Instant finishedAt;

    public ExecutionAttempt(String runId, CheckScope scope) {
        this.runId = Objects.requireNonNull(runId, "runId must not be null");
        this.scope = scope;
        this.startedAt = Instant.now();
        this.status = ExecutionStatus.RUNNING;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isHasFailures() {
        ExecutionCounts current = counts;
        return current != null && current.hasFailures();
    }

    public void complete(ExecutionCounts counts, String generatedSpec) {
        apply(AttemptUpdate.completed(counts, generatedSpec));
    }

    public void fail(String error, ExecutionCounts counts, String generatedSpec) {
        apply(AttemptUpdate.failed(error, counts, generatedSpec));
    }

    /**
     * Applies the terminal update.
     *
     * @param update the update; its status must be terminal
     * @throws IllegalStateException if this attempt is already terminal
     * @throws IllegalArgumentException if the update's status is not terminal
     */
    public synchronized void apply(AttemptUpdate update) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Attempt " + runId + " is already " + status.getValue()
                    + "; cannot move to " + update.getStatus().getValue());
        }
        if (update.getStatus() == null || !update.getStatus().isTerminal()) {
            throw new IllegalArgumentException("Attempt " + runId + " can only move to a terminal status, got "
                    + update.getStatus());
        }
        this.counts = update.getCounts();
        this.generatedSpec = update.getGeneratedSpec();
        this.error = update.getStatus() == ExecutionStatus.FAILED ? update.getError() : null;
        this.finishedAt = Instant.now();
        this.status = update.getStatus();
    }
}
