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

package org.fireflyframework.dqchecker.config;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dqchecker.check.CheckValidator;
import org.fireflyframework.dqchecker.compiler.CompilerOptions;
import org.fireflyframework.dqchecker.compiler.ScanSpecCompiler;
import org.fireflyframework.dqchecker.controller.ScanExecutionController;
import org.fireflyframework.dqchecker.controller.advice.DqCheckerExceptionHandler;
import org.fireflyframework.dqchecker.ledger.CheckSource;
import org.fireflyframework.dqchecker.ledger.ExecutionArchive;
import org.fireflyframework.dqchecker.ledger.InMemoryLedgerSink;
import org.fireflyframework.dqchecker.ledger.InMemoryResultSink;
import org.fireflyframework.dqchecker.ledger.JsonFileExecutionArchive;
import org.fireflyframework.dqchecker.ledger.LedgerSink;
import org.fireflyframework.dqchecker.ledger.ResultSink;
import org.fireflyframework.dqchecker.orchestration.ScanOrchestrator;
import org.fireflyframework.dqchecker.reconcile.ScanResultReconciler;
import org.fireflyframework.dqchecker.scan.DataSourceConfigurationRenderer;
import org.fireflyframework.dqchecker.scan.GuardedScanInvoker;
import org.fireflyframework.dqchecker.scan.ScanInvoker;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Auto-configuration for the data-quality checker.
 *
 * <p>This configuration automatically sets up:</p>
 * <ul>
 *   <li>{@link CheckValidator}, {@link ScanSpecCompiler} and {@link ScanResultReconciler}</li>
 *   <li>In-memory {@link LedgerSink} and {@link ResultSink} unless the application provides its own</li>
 *   <li>{@link JsonFileExecutionArchive} when {@code firefly.dq-checker.archive.enabled} is true</li>
 *   <li>{@link ScanOrchestrator} once the application provides a {@link CheckSource} and a
 *       {@link ScanInvoker}; the invoker is wrapped in a {@link GuardedScanInvoker}</li>
 *   <li>The REST endpoints, in reactive web applications</li>
 * </ul>
 *
 * <p><b>Example Configuration:</b></p>
 * <pre>{@code
 * firefly:
 *   dq-checker:
 *     enabled: true
 *     default-schema: dbo
 *     elide-default-schema: true
 * }</pre>
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(DqCheckerProperties.class)
@ConditionalOnProperty(
    prefix = "firefly.dq-checker",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
)
public class DqCheckerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CheckValidator checkValidator() {
        return new CheckValidator();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScanSpecCompiler scanSpecCompiler() {
        return new ScanSpecCompiler();
    }

    @Bean
    @ConditionalOnMissingBean
    public CompilerOptions compilerOptions(DqCheckerProperties properties) {
        return CompilerOptions.builder()
                .defaultSchema(properties.getDefaultSchema())
                .elideDefaultSchema(properties.isElideDefaultSchema())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScanResultReconciler scanResultReconciler() {
        return new ScanResultReconciler();
    }

    @Bean
    @ConditionalOnMissingBean
    public DataSourceConfigurationRenderer dataSourceConfigurationRenderer() {
        return new DataSourceConfigurationRenderer();
    }

    @Bean
    @ConditionalOnMissingBean(LedgerSink.class)
    public InMemoryLedgerSink inMemoryLedgerSink() {
        log.info("No LedgerSink configured; execution attempts are kept in memory");
        return new InMemoryLedgerSink();
    }

    /**
     * Creates the in-memory result sink. When the ledger is the in-memory one as well,
     * results for terminal attempts are rejected.
     *
     * @param ledgerSink the configured ledger
     * @return the result sink
     */
    @Bean
    @ConditionalOnMissingBean(ResultSink.class)
    public InMemoryResultSink inMemoryResultSink(LedgerSink ledgerSink) {
        log.info("No ResultSink configured; check results are kept in memory");
        return ledgerSink instanceof InMemoryLedgerSink inMemory
                ? new InMemoryResultSink(inMemory)
                : new InMemoryResultSink();
    }

    @Bean
    @ConditionalOnMissingBean(ExecutionArchive.class)
    @ConditionalOnProperty(prefix = "firefly.dq-checker.archive", name = "enabled", havingValue = "true")
    public JsonFileExecutionArchive jsonFileExecutionArchive(DqCheckerProperties properties) {
        Path directory = Path.of(properties.getArchive().getDirectory());
        log.info("Archiving execution attempts to {}", directory.toAbsolutePath());
        return new JsonFileExecutionArchive(directory);
    }

    /**
     * Creates the orchestrator.
     *
     * @param checkSource    the application's check source
     * @param scanInvoker    the application's scan invoker
     * @param archive        the execution archive, or {@code null} if archiving is disabled
     * @param eventPublisher the event publisher, or {@code null} if unavailable
     * @return the configured orchestrator
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({CheckSource.class, ScanInvoker.class})
    public ScanOrchestrator scanOrchestrator(
            DqCheckerProperties properties,
            CheckSource checkSource,
            ScanInvoker scanInvoker,
            CheckValidator checkValidator,
            ScanSpecCompiler scanSpecCompiler,
            CompilerOptions compilerOptions,
            ScanResultReconciler scanResultReconciler,
            LedgerSink ledgerSink,
            ResultSink resultSink,
            @Autowired(required = false) ExecutionArchive archive,
            @Autowired(required = false) ApplicationEventPublisher eventPublisher) {
        log.info("Configuring Scan Orchestrator: defaultSchema={}, elideDefaultSchema={}, archive={}",
                compilerOptions.getDefaultSchema(), compilerOptions.isElideDefaultSchema(), archive != null);
        return ScanOrchestrator.builder()
                .checkSource(checkSource)
                .scanInvoker(new GuardedScanInvoker(scanInvoker,
                        properties.getMaxConcurrentScans(), properties.getInvokeTimeout()))
                .validator(checkValidator)
                .compiler(scanSpecCompiler)
                .compilerOptions(compilerOptions)
                .reconciler(scanResultReconciler)
                .ledgerSink(ledgerSink)
                .resultSink(resultSink)
                .persistConcurrency(properties.getPersistConcurrency())
                .archive(archive)
                .eventPublisher(eventPublisher)
                .build();
    }

    /**
     * REST endpoints for running attempts and previewing compiled specs.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
    static class WebConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public ScanExecutionController scanExecutionController(
                ObjectProvider<ScanOrchestrator> orchestrator,
                CheckValidator checkValidator,
                ScanSpecCompiler scanSpecCompiler,
                CompilerOptions compilerOptions) {
            return new ScanExecutionController(orchestrator.getIfAvailable(), checkValidator,
                    scanSpecCompiler, compilerOptions);
        }

        @Bean
        @ConditionalOnMissingBean
        public DqCheckerExceptionHandler dqCheckerExceptionHandler() {
            return new DqCheckerExceptionHandler();
        }
    }
}
