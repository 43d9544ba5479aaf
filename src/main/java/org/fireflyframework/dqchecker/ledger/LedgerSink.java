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

import reactor.core.publisher.Mono;

/**
 * Persists execution attempts.
 */
public interface LedgerSink {

    /**
     * Records a new attempt in the {@code running} state.
     *
     * @param runId the attempt's correlation token
     * @param scope the checks the attempt runs
     * @return a handle for the later terminal update
     */
    Mono<AttemptHandle> createAttempt(String runId, CheckScope scope);

    /**
     * Records the attempt's terminal state. Called at most once per handle.
     *
     * @param handle the handle from {@link #createAttempt}
     * @param update the terminal status, counts, error and generated spec
     * @return completion signal
     */
    Mono<Void> updateAttempt(AttemptHandle handle, AttemptUpdate update);
}
