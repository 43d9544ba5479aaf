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

import lombok.Value;
import org.fireflyframework.dqchecker.reconcile.CheckResult;

import java.util.Collection;

/**
 * Per-outcome check counts of an attempt. Results with an unknown outcome count
 * towards {@code total} only.
 */
@Value
public class ExecutionCounts {

    public static final ExecutionCounts EMPTY = new ExecutionCounts(0, 0, 0, 0);

    int total;
    int passed;
    int failed;
    int warned;

    /**
     * Counts outcomes.
     *
     * @param results the results to count
     * @return the counts
     */
    public static ExecutionCounts of(Collection<CheckResult> results) {
        int passed = 0;
        int failed = 0;
        int warned = 0;
        for (CheckResult result : results) {
            switch (result.getOutcome()) {
                case PASS -> passed++;
                case FAIL -> failed++;
                case WARN -> warned++;
                case UNKNOWN -> {
                }
            }
        }
        return new ExecutionCounts(results.size(), passed, failed, warned);
    }

    public boolean hasFailures() {
        return failed > 0;
    }

    public int getUnknown() {
        return total - passed - failed - warned;
    }
}
