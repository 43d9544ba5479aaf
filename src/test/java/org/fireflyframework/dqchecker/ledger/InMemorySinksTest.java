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

import org.fireflyframework.dqchecker.reconcile.CheckOutcome;
import org.fireflyframework.dqchecker.reconcile.CheckResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link InMemoryLedgerSink} and {@link InMemoryResultSink}.
 */
class InMemorySinksTest {

    private InMemoryLedgerSink ledger;
    private InMemoryResultSink results;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryLedgerSink();
        results = new InMemoryResultSink(ledger);
    }

    private static CheckResult pass(long checkId) {
        return CheckResult.builder().runId("run-1").checkId(checkId).outcome(CheckOutcome.PASS).build();
    }

    @Test
    void createAttempt_shouldRejectDuplicateRunId() {
        // Given
        ledger.createAttempt("run-1", CheckScope.suite("core")).block();

        // When & Then
        StepVerifier.create(ledger.createAttempt("run-1", CheckScope.suite("core")))
                .expectError(IllegalStateException.class)
                .verify();
        assertThat(ledger.getAttempts()).hasSize(1);
    }

    @Test
    void updateAttempt_shouldApplyTerminalUpdateOnce() {
        // Given
        AttemptHandle handle = ledger.createAttempt("run-1", CheckScope.suite("core")).block();

        // When
        StepVerifier.create(ledger.updateAttempt(handle, AttemptUpdate.completed(ExecutionCounts.EMPTY, "")))
                .verifyComplete();

        // Then
        assertThat(ledger.findAttempt("run-1")).hasValueSatisfying(attempt ->
                assertThat(attempt.getStatus()).isEqualTo(ExecutionStatus.COMPLETED));
        StepVerifier.create(ledger.updateAttempt(handle, AttemptUpdate.failed("late", null, null)))
                .expectError(IllegalStateException.class)
                .verify();
    }

    @Test
    void updateAttempt_shouldFailForUnknownHandle() {
        StepVerifier.create(ledger.updateAttempt(AttemptHandle.of("missing"),
                        AttemptUpdate.failed("x", null, null)))
                .expectErrorMessage("Unknown attempt missing")
                .verify();
    }

    @Test
    void persistResult_shouldStoreUntilAttemptIsTerminal() {
        // Given
        AttemptHandle handle = ledger.createAttempt("run-1", CheckScope.suite("core")).block();

        // When
        StepVerifier.create(results.persistResult("run-1", pass(1))).verifyComplete();
        ledger.updateAttempt(handle, AttemptUpdate.completed(new ExecutionCounts(1, 1, 0, 0), "")).block();

        // Then
        StepVerifier.create(results.persistResult("run-1", pass(2)))
                .expectError(IllegalStateException.class)
                .verify();
        assertThat(results.getResults("run-1")).extracting(CheckResult::getCheckId).containsExactly(1L);
        assertThat(results.getResults("other")).isEmpty();
    }
}
