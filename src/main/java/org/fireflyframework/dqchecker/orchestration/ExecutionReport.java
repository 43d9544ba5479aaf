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

package org.fireflyframework.dqchecker.orchestration;

import lombok.Builder;
import lombok.Data;
import org.fireflyframework.dqchecker.ledger.ExecutionAttempt;
import org.fireflyframework.dqchecker.ledger.ExecutionCounts;
import org.fireflyframework.dqchecker.ledger.ExecutionStatus;
import org.fireflyframework.dqchecker.reconcile.CheckOutcome;
import org.fireflyframework.dqchecker.reconcile.CheckResult;

import java.time.Instant;
import java.util.List;

/**
 * Everything an execution attempt produced.
 */
@Data
@Builder
public class ExecutionReport {

    public static final int EXIT_CLEAN = 0;
    public static final int EXIT_CHECK_FAILURES = 1;
    public static final int EXIT_ATTEMPT_FAILED = 2;

    private final ExecutionAttempt attempt;

    /**
     * Results that were persisted, in engine order.
     */
    private final List<CheckResult> results;

    private final List<SkippedCheck> skippedChecks;
    private final List<String> reconciliationWarnings;
    private final int persistenceFailures;
    private final Instant timestamp;

    public String getRunId() {
        return attempt.getRunId();
    }

    public ExecutionStatus getStatus() {
        return attempt.getStatus();
    }

    public ExecutionCounts getCounts() {
        return attempt.getCounts();
    }

    public boolean isHasFailures() {
        return attempt.isHasFailures();
    }

    /**
     * Returns how many results the engine reported with no recognised outcome.
     *
     * @return the number of {@link CheckOutcome#UNKNOWN} results
     */
    public int getUnknownCount() {
        return (int) results.stream().filter(result -> result.getOutcome() == CheckOutcome.UNKNOWN).count();
    }

    /**
     * Returns only the results that failed.
     *
     * @return results with outcome {@link CheckOutcome#FAIL}
     */
    public List<CheckResult> getFailures() {
        return results.stream()
                .filter(result -> result.getOutcome() == CheckOutcome.FAIL)
                .toList();
    }

    /**
     * Maps the attempt to a process exit code for schedulers gating on the run.
     *
     * @return {@value #EXIT_CLEAN} when completed without failures,
     *         {@value #EXIT_CHECK_FAILURES} when completed with failed checks,
     *         {@value #EXIT_ATTEMPT_FAILED} when the attempt failed
     */
    public int exitCode() {
        if (attempt.getStatus() != ExecutionStatus.COMPLETED) {
            return EXIT_ATTEMPT_FAILED;
        }
        return attempt.isHasFailures() ? EXIT_CHECK_FAILURES : EXIT_CLEAN;
    }
}
