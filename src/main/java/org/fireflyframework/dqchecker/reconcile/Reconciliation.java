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

package org.fireflyframework.dqchecker.reconcile;

import lombok.Value;

import java.util.List;

/**
 * Output of {@link ScanResultReconciler#reconcile}: the results in engine order plus
 * a description of every entry that had to be skipped.
 */
@Value
public class Reconciliation {

    List<CheckResult> results;
    List<String> warnings;

    public Reconciliation(List<CheckResult> results, List<String> warnings) {
        this.results = List.copyOf(results);
        this.warnings = List.copyOf(warnings);
    }

    public int getSkippedCount() {
        return warnings.size();
    }

    public int getUnresolvedCount() {
        return (int) results.stream().filter(result -> !result.isResolved()).count();
    }
}
