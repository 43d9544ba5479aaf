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
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dqchecker.check.Check;
import org.fireflyframework.dqchecker.check.CheckValidation;
import org.fireflyframework.dqchecker.check.CheckValidator;
import org.fireflyframework.dqchecker.check.ValidCheck;
import org.fireflyframework.dqchecker.compiler.CompilerOptions;
import org.fireflyframework.dqchecker.compiler.ExecutableSpec;
import org.fireflyframework.dqchecker.compiler.ScanSpecCompiler;
import org.fireflyframework.dqchecker.event.ScanExecutionEvent;
import org.fireflyframework.dqchecker.ledger.ArchivedExecution;
import org.fireflyframework.dqchecker.ledger.AttemptHandle;
import org.fireflyframework.dqchecker.ledger.AttemptUpdate;
import org.fireflyframework.dqchecker.ledger.CheckScope;
import org.fireflyframework.dqchecker.ledger.CheckSource;
import org.fireflyframework.dqchecker.ledger.ExecutionArchive;
import org.fireflyframework.dqchecker.ledger.ExecutionAttempt;
import org.fireflyframework.dqchecker.ledger.ExecutionCounts;
import org.fireflyframework.dqchecker.ledger.LedgerSink;
import org.fireflyframework.dqchecker.ledger.ResultSink;
import org.fireflyframework.dqchecker.reconcile.CheckResult;
import org.fireflyframework.dqchecker.reconcile.Reconciliation;
import org.fireflyframework.dqchecker.reconcile.ScanResultFormatException;
import org.fireflyframework.dqchecker.reconcile.ScanResultReconciler;
import org.fireflyframework.dqchecker.scan.ScanInvoker;
import org.fireflyframework.dqchecker.scan.ScanOutput;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one execution attempt end to end: load checks, validate, compile, invoke the
 * scan engine, reconcile, persist results, record the terminal state.
 *
 * <p>Failure policy:</p>
 * <ul>
 *   <li>invalid checks are skipped; with no valid check left the attempt fails
 *       without invoking the engine</li>
 *   <li>a check-load, compile or invoke failure (including invoke timeouts) fails the
 *       attempt; no results are persisted</li>
 *   <li>an engine reporting errors fails the attempt, but its results are persisted</li>
 *   <li>a single result write failure is logged and skipped</li>
 *   <li>any other error raised before the terminal update fails the attempt</li>
 *   <li>ledger failures propagate: the attempt cannot be recorded</li>
 * </ul>
 *
 * <p>The engine is never retried here. A cancelled execution leaves its attempt
 * {@code running}.</p>
 */
@Slf4j
public class ScanOrchestrator {

    private final CheckSource checkSource;
    private final CheckValidator validator;
    private final ScanSpecCompiler compiler;
    private final CompilerOptions compilerOptions;
    private final ScanInvoker scanInvoker;
    private final ScanResultReconciler reconciler;
    private final LedgerSink ledgerSink;
    private final ResultSink resultSink;
    private final int persistConcurrency;
    private final ExecutionArchive archive;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Creates an orchestrator. {@code validator}, {@code compiler}, {@code compilerOptions}
     * and {@code reconciler} default to fresh instances; {@code archive} and
     * {@code eventPublisher} are optional.
     */
    @Builder
    public ScanOrchestrator(CheckSource checkSource,
                            CheckValidator validator,
                            ScanSpecCompiler compiler,
                            CompilerOptions compilerOptions,
                            ScanInvoker scanInvoker,
                            ScanResultReconciler reconciler,
                            LedgerSink ledgerSink,
                            ResultSink resultSink,
                            int persistConcurrency,
                            ExecutionArchive archive,
                            ApplicationEventPublisher eventPublisher) {
        this.checkSource = Objects.requireNonNull(checkSource, "checkSource must not be null");
        this.scanInvoker = Objects.requireNonNull(scanInvoker, "scanInvoker must not be null");
        this.ledgerSink = Objects.requireNonNull(ledgerSink, "ledgerSink must not be null");
        this.resultSink = Objects.requireNonNull(resultSink, "resultSink must not be null");
        this.validator = validator != null ? validator : new CheckValidator();
        this.compiler = compiler != null ? compiler : new ScanSpecCompiler();
        this.compilerOptions = compilerOptions != null ? compilerOptions : CompilerOptions.defaults();
        this.reconciler = reconciler != null ? reconciler : new ScanResultReconciler();
        this.persistConcurrency = Math.max(1, persistConcurrency);
        this.archive = archive;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Runs an execution attempt.
     *
     * @param request the scope and connection to scan
     * @return a {@link Mono} emitting the report once the attempt is terminal; it errors
     *         only when the ledger cannot record the attempt
     */
    public Mono<ExecutionReport> execute(ScanRequest request) {
        String runId = request.getRunId() != null ? request.getRunId() : UUID.randomUUID().toString();
        CheckScope scope = request.getScope();

        return ledgerSink.createAttempt(runId, scope)
                .flatMap(handle -> {
                    log.info("Started attempt {} for {}", runId, scope);
                    Execution execution = new Execution(request, new ExecutionAttempt(runId, scope), handle);
                    return run(execution);
                });
    }

    private Mono<ExecutionReport> run(Execution execution) {
        return Mono.defer(() -> checkSource.loadChecks(execution.scope()).collectList())
                .onErrorMap(e -> new StageFailure("Failed to load checks: " + describe(e), e))
                .map(checks -> validate(execution, checks))
                .map(validChecks -> compile(execution, validChecks))
                .flatMap(spec -> invoke(execution, spec))
                .map(output -> reconcile(execution, output))
                .flatMap(reconciliation -> persist(execution, reconciliation))
                .map(persisted -> completion(execution, persisted))
                .onErrorResume(e -> {
                    String error = e instanceof StageFailure ? e.getMessage() : "Attempt aborted: " + describe(e);
                    log.error("Attempt {} failed: {}", execution.runId(), error, e instanceof StageFailure ? e.getCause() : e);
                    return Mono.just(AttemptUpdate.failed(error, null, execution.specText()));
                })
                .flatMap(update -> terminate(execution, update));
    }

    private List<ValidCheck> validate(Execution execution, List<Check> checks) {
        List<ValidCheck> valid = new ArrayList<>(checks.size());
        for (CheckValidation validation : validator.validateAll(checks)) {
            if (validation.isValid()) {
                valid.add(validation.getValidCheck().orElseThrow());
            } else {
                Check check = validation.getCheck();
                log.warn("Skipping check {} ({}) in attempt {}: {}",
                        check.getId(), check.getDisplayName(), execution.runId(), validation.getErrors());
                execution.skipped.add(new SkippedCheck(check.getId(), check.getDisplayName(), validation.getErrors()));
            }
        }
        if (valid.isEmpty()) {
            throw new StageFailure("No valid checks to run: " + checks.size() + " loaded, "
                    + execution.skipped.size() + " failed validation", null);
        }
        return valid;
    }

    private ExecutableSpec compile(Execution execution, List<ValidCheck> checks) {
        try {
            ExecutableSpec spec = compiler.compile(checks, compilerOptions);
            execution.spec = spec;
            log.info("Compiled {} check(s) for attempt {}", spec.getRuleCount(), execution.runId());
            return spec;
        } catch (RuntimeException e) {
            throw new StageFailure("Spec compilation failed: " + describe(e), e);
        }
    }

    private Mono<ScanOutput> invoke(Execution execution, ExecutableSpec spec) {
        return Mono.defer(() -> scanInvoker.invoke(spec, execution.request.getConnection()))
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("scan invoker returned no output")))
                .onErrorMap(e -> new StageFailure("Scan invocation failed: " + describe(e), e))
                .doOnNext(output -> {
                    execution.output = output;
                    log.info("Scan finished for attempt {} (engine errors: {})", execution.runId(), output.isHasErrors());
                });
    }

    private Reconciliation reconcile(Execution execution, ScanOutput output) {
        try {
            Reconciliation reconciliation = reconciler.reconcile(execution.runId(), output.getRawResults());
            execution.reconciliation = reconciliation;
            return reconciliation;
        } catch (ScanResultFormatException e) {
            throw new StageFailure("Scan output could not be reconciled: " + e.getMessage(), e);
        }
    }

    private Mono<List<CheckResult>> persist(Execution execution, Reconciliation reconciliation) {
        return Flux.fromIterable(reconciliation.getResults())
                .flatMapSequential(result -> Mono.defer(() -> resultSink.persistResult(execution.runId(), result))
                        .thenReturn(result)
                        .onErrorResume(e -> {
                            execution.persistenceFailures.incrementAndGet();
                            log.warn("Failed to persist result for check {} in attempt {}: {}",
                                    result.getCheckId(), execution.runId(), describe(e));
                            return Mono.empty();
                        }), persistConcurrency)
                .collectList()
                .doOnNext(persisted -> execution.persisted = persisted);
    }

    private AttemptUpdate completion(Execution execution, List<CheckResult> persisted) {
        ExecutionCounts counts = ExecutionCounts.of(persisted);
        ScanOutput output = execution.output;
        if (output.isHasErrors()) {
            String error = "Scan engine reported errors";
            if (output.getErrorLogs() != null && !output.getErrorLogs().isBlank()) {
                error += ": " + output.getErrorLogs().strip();
            }
            log.error("Attempt {} failed: {}", execution.runId(), error);
            return AttemptUpdate.failed(error, counts, execution.specText());
        }
        return AttemptUpdate.completed(counts, execution.specText());
    }

    private Mono<ExecutionReport> terminate(Execution execution, AttemptUpdate update) {
        execution.attempt.apply(update);
        return ledgerSink.updateAttempt(execution.handle, update)
                .then(Mono.fromSupplier(() -> buildReport(execution)))
                .doOnNext(report -> log.info("Attempt {} {}: {}", report.getRunId(),
                        report.getStatus().getValue(), report.getCounts()))
                .flatMap(report -> archive(execution, report).thenReturn(report))
                .doOnNext(this::publishEvent);
    }

    private ExecutionReport buildReport(Execution execution) {
        return ExecutionReport.builder()
                .attempt(execution.attempt)
                .results(List.copyOf(execution.persisted))
                .skippedChecks(List.copyOf(execution.skipped))
                .reconciliationWarnings(execution.reconciliation != null
                        ? execution.reconciliation.getWarnings() : List.of())
                .persistenceFailures(execution.persistenceFailures.get())
                .timestamp(Instant.now())
                .build();
    }

    private Mono<Void> archive(Execution execution, ExecutionReport report) {
        if (archive == null) {
            return Mono.empty();
        }
        ExecutionAttempt attempt = execution.attempt;
        ScanOutput output = execution.output;
        ArchivedExecution archived = ArchivedExecution.builder()
                .runId(attempt.getRunId())
                .scope(String.valueOf(attempt.getScope()))
                .timestamp(report.getTimestamp())
                .status(attempt.getStatus())
                .summary(attempt.getCounts())
                .hasFailures(attempt.isHasFailures())
                .error(attempt.getError())
                .generatedSpec(attempt.getGeneratedSpec())
                .scanResults(output != null ? output.getRawResults() : null)
                .scanLogs(output != null ? output.getRawLogs() : null)
                .build();
        return archive.archive(archived)
                .onErrorResume(e -> {
                    log.warn("Failed to archive attempt {}: {}", attempt.getRunId(), describe(e));
                    return Mono.empty();
                });
    }

    private void publishEvent(ExecutionReport report) {
        if (eventPublisher != null) {
            eventPublisher.publishEvent(new ScanExecutionEvent(report));
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static final class Execution {

        private final ScanRequest request;
        private final ExecutionAttempt attempt;
        private final AttemptHandle handle;
        private final List<SkippedCheck> skipped = new ArrayList<>();
        private final AtomicInteger persistenceFailures = new AtomicInteger();
        private ExecutableSpec spec;
        private ScanOutput output;
        private Reconciliation reconciliation;
        private List<CheckResult> persisted = List.of();

        private Execution(ScanRequest request, ExecutionAttempt attempt, AttemptHandle handle) {
            this.request = request;
            this.attempt = attempt;
            this.handle = handle;
        }

        private String runId() {
            return attempt.getRunId();
        }

        private CheckScope scope() {
            return attempt.getScope();
        }

        private String specText() {
            return spec != null ? spec.getText() : null;
        }
    }

    private static final class StageFailure extends RuntimeException {

        private StageFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
