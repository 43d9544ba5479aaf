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

import io.github.resilience4j.bulkhead.BulkheadFullException;
import org.fireflyframework.dqchecker.compiler.ExecutableSpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link GuardedScanInvoker}.
 */
@ExtendWith(MockitoExtension.class)
class GuardedScanInvokerTest {

    @Mock
    private ScanInvoker delegate;

    private final ConnectionDescriptor connection = ConnectionDescriptor.builder()
            .host("warehouse.example.com")
            .database("finance")
            .build();

    @Test
    void invoke_shouldPassThroughOutput() {
        // Given
        ScanOutput output = ScanOutput.builder().rawLogs("ok").build();
        when(delegate.invoke(any(), any())).thenReturn(Mono.just(output));
        GuardedScanInvoker invoker = new GuardedScanInvoker(delegate, 2, Duration.ofSeconds(5));

        // When & Then
        StepVerifier.create(invoker.invoke(ExecutableSpec.empty(), connection))
                .expectNext(output)
                .verifyComplete();
        assertThat(invoker.availableScanPermits()).isEqualTo(2);
    }

    @Test
    void invoke_shouldTimeOutSlowScans() {
        // Given
        when(delegate.invoke(any(), any())).thenReturn(Mono.delay(Duration.ofMillis(500)).thenReturn(
                ScanOutput.builder().build()));
        GuardedScanInvoker invoker = new GuardedScanInvoker(delegate, 1, Duration.ofMillis(50));

        // When & Then
        StepVerifier.create(invoker.invoke(ExecutableSpec.empty(), connection))
                .expectError(TimeoutException.class)
                .verify(Duration.ofSeconds(5));
        assertThat(invoker.availableScanPermits()).isEqualTo(1);
    }

    @Test
    void invoke_shouldRejectScansBeyondConcurrencyLimit() {
        // Given - the first scan never finishes and holds the only permit
        when(delegate.invoke(any(), any())).thenReturn(Mono.never());
        GuardedScanInvoker invoker = new GuardedScanInvoker(delegate, 1, null);
        Disposable running = invoker.invoke(ExecutableSpec.empty(), connection).subscribe();

        // When & Then
        StepVerifier.create(invoker.invoke(ExecutableSpec.empty(), connection))
                .expectError(BulkheadFullException.class)
                .verify(Duration.ofSeconds(5));

        running.dispose();
        assertThat(invoker.availableScanPermits()).isEqualTo(1);
    }

    @Test
    void invoke_shouldNotRetryFailedScans() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        when(delegate.invoke(any(), any())).thenAnswer(invocation -> Mono.defer(() -> {
            calls.incrementAndGet();
            return Mono.error(new IllegalStateException("login failed"));
        }));
        GuardedScanInvoker invoker = new GuardedScanInvoker(delegate, 1, Duration.ofSeconds(5));

        // When & Then
        StepVerifier.create(invoker.invoke(ExecutableSpec.empty(), connection))
                .expectErrorMessage("login failed")
                .verify(Duration.ofSeconds(5));
        assertThat(calls.get()).isEqualTo(1);
    }
}
