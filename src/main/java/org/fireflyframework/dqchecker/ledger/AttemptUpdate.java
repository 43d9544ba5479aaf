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

import lombok.Builder;
import lombok.Value;

/**
 * The single terminal update applied to a ledger entry.
 */
@Value
@Builder
public class AttemptUpdate {

    ExecutionStatus status;

    /**
     * Counts over the persisted results; {@code null} when no scan ran.
     */
    ExecutionCounts counts;

    String error;
    String generatedSpec;

    public boolean isHasFailures() {
        return counts != null && counts.hasFailures();
    }

    public static AttemptUpdate completed(ExecutionCounts counts, String generatedSpec) {
        return AttemptUpdate.builder()
                .status(ExecutionStatus.COMPLETED)
                .counts(counts)
                .generatedSpec(generatedSpec)
                .build();
    }

    public static AttemptUpdate failed(String error, ExecutionCounts counts, String generatedSpec) {
        return AttemptUpdate.builder()
                .status(ExecutionStatus.FAILED)
                .error(error)
                .counts(counts)
                .generatedSpec(generatedSpec)
                .build();
    }
}
