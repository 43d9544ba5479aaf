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

package org.fireflyframework.dqchecker.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;
import org.fireflyframework.dqchecker.ledger.ExecutionAttempt;
import org.fireflyframework.dqchecker.ledger.ExecutionCounts;
import org.fireflyframework.dqchecker.orchestration.ExecutionReport;
import org.fireflyframework.dqchecker.orchestration.SkippedCheck;
import org.fireflyframework.dqchecker.reconcile.CheckResult;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for an execution attempt.
 */
@Data
@Builder
@Schema(description = "Outcome of a data-quality execution attempt")
public class ScanExecutionResponse {

    @Schema(description = "Correlation token of the attempt", example = "nightly-2026-10-17")
    private final String runId;

    @Schema(description = "Terminal status", example = "completed", allowableValues = {"completed", "failed"})
    private final String status;

    @Schema(description = "Whether any check failed", example = "true")
    private final boolean hasFailures;

    @Schema(description = "Process exit code: 0 clean, 1 check failures, 2 attempt failed", example = "1")
    private final int exitCode;

    @Schema(description = "Check counts over the persisted results")
    private final ExecutionCounts counts;

    @Schema(description = "Results with an unrecognised outcome", example = "0")
    private final int unknownCount;

    @Schema(description = "Why the attempt failed", example = "Scan invocation failed: connection refused")
    private final String error;

    private final List<CheckResult> results;

    @Schema(description = "Checks left out because they failed validation")
    private final List<SkippedCheck> skippedChecks;

    @Schema(description = "Scan output entries that could not be reconciled")
    private final List<String> reconciliationWarnings;

    @Schema(description = "Results that could not be persisted", example = "0")
    private final int persistenceFailures;

    @Schema(description = "Specification sent to the scan engine")
    private final String generatedSpec;

    private final Instant startedAt;
    private final Instant finishedAt;

    public static ScanExecutionResponse from(ExecutionReport report) {
        ExecutionAttempt attempt = report.getAttempt();
        return ScanExecutionResponse.builder()
                .runId(attempt.getRunId())
                .status(attempt.getStatus().getValue())
                .hasFailures(attempt.isHasFailures())
                .exitCode(report.exitCode())
                .counts(attempt.getCounts())
                .unknownCount(report.getUnknownCount())
                .error(attempt.getError())
                .results(report.getResults())
                .skippedChecks(report.getSkippedChecks())
                .reconciliationWarnings(report.getReconciliationWarnings())
                .persistenceFailures(report.getPersistenceFailures())
                .generatedSpec(attempt.getGeneratedSpec())
                .startedAt(attempt.getStartedAt())
                .finishedAt(attempt.getFinishedAt())
                .build();
    }
}
