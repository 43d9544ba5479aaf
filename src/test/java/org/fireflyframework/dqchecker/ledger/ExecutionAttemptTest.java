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

import org.fireflyframework.dqchecker.check.TableRef;
import org.fireflyframework.dqchecker.reconcile.CheckOutcome;
import org.fireflyframework.dqchecker.reconcile.CheckResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ExecutionAttempt} and {@link ExecutionCounts}.
 */
class ExecutionAttemptTest {

    private final CheckScope scope = CheckScope.table(TableRef.of("dbo", "orders"));

    @Test
    void newAttempt_shouldBeRunning() {
        // When
        ExecutionAttempt attempt = new ExecutionAttempt("run-1", scope);

        // Then
        assertThat(attempt.getStatus()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(attempt.isTerminal()).isFalse();
        assertThat(attempt.getCounts()).isNull();
        assertThat(attempt.isHasFailures()).isFalse();
        assertThat(attempt.getStartedAt()).isNotNull();
        assertThat(attempt.getFinishedAt()).isNull();
    }

    @Test
    void complete_shouldRecordCountsAndSpec() {
        // Given
        ExecutionAttempt attempt = new ExecutionAttempt("run-1", scope);

        // When
        attempt.complete(new ExecutionCounts(4, 2, 1, 1), "checks for dbo.orders:\n");

        // Then
        assertThat(attempt.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(attempt.isHasFailures()).isTrue();
        assertThat(attempt.getGeneratedSpec()).isEqualTo("checks for dbo.orders:\n");
        assertThat(attempt.getError()).isNull();
        assertThat(attempt.getFinishedAt()).isNotNull();
    }

    @Test
    void terminalAttempt_shouldRejectFurtherTransitions() {
        // Given
        ExecutionAttempt attempt = new ExecutionAttempt("run-1", scope);
        attempt.fail("Scan invocation failed: timeout", null, null);

        // When & Then
        assertThatThrownBy(() -> attempt.complete(ExecutionCounts.EMPTY, ""))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already failed");
        assertThatThrownBy(() -> attempt.fail("again", null, null))
                .isInstanceOf(IllegalStateException.class);
        assertThat(attempt.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(attempt.getError()).isEqualTo("Scan invocation failed: timeout");
    }

    @Test
    void apply_shouldRejectNonTerminalStatus() {
        // Given
        ExecutionAttempt attempt = new ExecutionAttempt("run-1", scope);

        // When & Then
        assertThatThrownBy(() -> attempt.apply(AttemptUpdate.builder().status(ExecutionStatus.RUNNING).build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(attempt.getStatus()).isEqualTo(ExecutionStatus.RUNNING);
    }

    @Test
    void counts_shouldTallyOutcomes() {
        // Given
        List<CheckResult> results = List.of(
                result(CheckOutcome.PASS), result(CheckOutcome.FAIL), result(CheckOutcome.WARN),
                result(CheckOutcome.PASS), result(CheckOutcome.UNKNOWN));

        // When
        ExecutionCounts counts = ExecutionCounts.of(results);

        // Then
        assertThat(counts).isEqualTo(new ExecutionCounts(5, 2, 1, 1));
        assertThat(counts.getUnknown()).isEqualTo(1);
        assertThat(counts.hasFailures()).isTrue();
        assertThat(ExecutionCounts.of(List.of()).hasFailures()).isFalse();
    }

    @Test
    void scope_shouldDescribeItself() {
        assertThat(CheckScope.suite("finance-core").toString()).isEqualTo("suite:finance-core");
        assertThat(scope.toString()).isEqualTo("table:dbo.orders");
    }

    private static CheckResult result(CheckOutcome outcome) {
        return CheckResult.builder().runId("run-1").checkId(1L).outcome(outcome).build();
    }
}
