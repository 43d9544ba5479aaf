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

package org.fireflyframework.dqchecker.scan;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.reactor.bulkhead.operator.BulkheadOperator;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dqchecker.compiler.ExecutableSpec;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Decorates a {@link ScanInvoker} with a concurrency limit and a timeout.
 *
 * <p>A Resilience4j bulkhead bounds how many scans run at once; a scan requested while
 * the bulkhead is full is rejected immediately with a
 * {@link io.github.resilience4j.bulkhead.BulkheadFullException} rather than queued.
 * A scan exceeding the timeout fails with a {@link java.util.concurrent.TimeoutException}.
 * Scans are never retried here.</p>
 */
@Slf4j
public class GuardedScanInvoker implements ScanInvoker {

    private final ScanInvoker delegate;
    private final Bulkhead bulkhead;
    private final Duration timeout;

    /**
     * Creates a guarded invoker.
     *
     * @param delegate           the invoker doing the actual work
     * @param maxConcurrentScans the maximum number of scans in flight
     * @param timeout            the per-scan timeout, or {@code null} for none
     */
    public GuardedScanInvoker(ScanInvoker delegate, int maxConcurrentScans, Duration timeout) {
        this.delegate = delegate;
        this.timeout = timeout;
        this.bulkhead = Bulkhead.of("dq-checker-scan", BulkheadConfig.custom()
                .maxConcurrentCalls(maxConcurrentScans)
                .maxWaitDuration(Duration.ZERO)
                .build());
        log.info("Guarding scan invoker {}: maxConcurrentScans={}, timeout={}",
                delegate.getClass().getSimpleName(), maxConcurrentScans, timeout);
    }

    @Override
    public Mono<ScanOutput> invoke(ExecutableSpec spec, ConnectionDescriptor connection) {
        Mono<ScanOutput> scan = Mono.defer(() -> delegate.invoke(spec, connection));
        if (timeout != null) {
            scan = scan.timeout(timeout);
        }
        return scan.transformDeferred(BulkheadOperator.of(bulkhead));
    }

    public int availableScanPermits() {
        return bulkhead.getMetrics().getAvailableConcurrentCalls();
    }
}
