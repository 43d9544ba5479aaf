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

package org.fireflyframework.dqchecker.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dqchecker.check.CheckValidation;
import org.fireflyframework.dqchecker.check.CheckValidator;
import org.fireflyframework.dqchecker.check.ValidCheck;
import org.fireflyframework.dqchecker.compiler.CompilerOptions;
import org.fireflyframework.dqchecker.compiler.ExecutableSpec;
import org.fireflyframework.dqchecker.compiler.ScanSpecCompiler;
import org.fireflyframework.dqchecker.model.ScanExecutionRequest;
import org.fireflyframework.dqchecker.model.ScanExecutionResponse;
import org.fireflyframework.dqchecker.model.SpecPreviewRequest;
import org.fireflyframework.dqchecker.model.SpecPreviewResponse;
import org.fireflyframework.dqchecker.orchestration.ScanOrchestrator;
import org.fireflyframework.dqchecker.orchestration.ScanRequest;
import org.fireflyframework.dqchecker.orchestration.SkippedCheck;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * REST controller for running data-quality attempts and previewing compiled specs.
 *
 * <p><b>Example:</b></p>
 * <pre>
 * POST /api/v1/dq-checker/executions
 * POST /api/v1/dq-checker/spec/preview
 * </pre>
 *
 * @see ScanOrchestrator
 * @see ScanSpecCompiler
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/dq-checker")
@Tag(name = "DQ Checker", description = "Data-quality check execution and spec preview")
public class ScanExecutionController {

    private final ScanOrchestrator orchestrator;
    private final CheckValidator validator;
    private final ScanSpecCompiler compiler;
    private final CompilerOptions compilerOptions;

    /**
     * Creates the controller.
     *
     * @param orchestrator    the orchestrator, or {@code null} when no check source or
     *                        scan invoker is configured; executions then answer 503
     * @param validator       the check validator
     * @param compiler        the spec compiler
     * @param compilerOptions the configured compiler options
     */
    public ScanExecutionController(ScanOrchestrator orchestrator,
                                   CheckValidator validator,
                                   ScanSpecCompiler compiler,
                                   CompilerOptions compilerOptions) {
        this.orchestrator = orchestrator;
        this.validator = validator;
        this.compiler = compiler;
        this.compilerOptions = compilerOptions;
    }

    /**
     * Runs an execution attempt and waits for its terminal state.
     *
     * @param request the scope and connection
     * @return the attempt's outcome
     */
    @PostMapping("/executions")
    @Operation(
        summary = "Run data-quality checks",
        description = "Loads the enabled checks for a suite or table, runs them through the scan engine " +
                     "and returns the terminal attempt with its results. A failed attempt is still a 200 response."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Attempt reached a terminal state"),
        @ApiResponse(responseCode = "400", description = "Invalid scope"),
        @ApiResponse(responseCode = "503", description = "No check source or scan invoker configured")
    })
    public Mono<ScanExecutionResponse> execute(@RequestBody ScanExecutionRequest request) {
        if (orchestrator == null) {
            return Mono.error(new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE,
                    "Scan execution is not configured"));
        }
        return Mono.fromCallable(request::toScope)
                .doOnNext(scope -> log.info("Received execution request - runId: {}, scope: {}",
                        request.getRunId(), scope))
                .flatMap(scope -> orchestrator.execute(ScanRequest.builder()
                        .runId(request.getRunId())
                        .scope(scope)
                        .connection(request.getConnection())
                        .build()))
                .map(ScanExecutionResponse::from);
    }

    /**
     * Validates and compiles checks without invoking the scan engine.
     *
     * @param request the checks and strictness
     * @return the compiled spec and the checks that were left out
     */
    @PostMapping("/spec/preview")
    @Operation(
        summary = "Preview the compiled specification",
        description = "Validates the checks and compiles the valid ones into the text the scan engine would " +
                     "receive. Invalid checks are listed; in strict mode they reject the request."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Specification compiled"),
        @ApiResponse(responseCode = "400", description = "Strict mode and a check failed validation"),
        @ApiResponse(responseCode = "422", description = "A valid check could not be compiled")
    })
    public Mono<SpecPreviewResponse> preview(@RequestBody SpecPreviewRequest request) {
        log.debug("Received spec preview request with {} check(s)", request.getChecks().size());
        return Mono.fromCallable(() -> {
            List<ValidCheck> valid = new ArrayList<>();
            List<SkippedCheck> skipped = new ArrayList<>();
            for (CheckValidation validation : validator.validateAll(request.getChecks())) {
                if (validation.isValid()) {
                    valid.add(validation.getValidCheck().orElseThrow());
                } else if (request.isStrict()) {
                    validation.orElseThrow();
                } else {
                    skipped.add(new SkippedCheck(validation.getCheck().getId(),
                            validation.getCheck().getDisplayName(), validation.getErrors()));
                }
            }
            ExecutableSpec spec = compiler.compile(valid, compilerOptions);
            return SpecPreviewResponse.builder()
                    .spec(spec.getText())
                    .ruleCount(spec.getRuleCount())
                    .tableCount(spec.getBlocks().size())
                    .checkIds(spec.getCheckIds())
                    .skippedChecks(skipped)
                    .build();
        });
    }
}
