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

import lombok.Builder;
import lombok.Data;

/**
 * One check's measured outcome within one execution attempt.
 *
 * <p>Created only by {@link ScanResultReconciler}. {@code checkId} is {@code null}
 * when the engine output carried no recognisable identity marker.</p>
 */
@Data
@Builder(toBuilder = true)
public class CheckResult {

    private final String runId;
    private final Long checkId;

    /**
     * The engine-reported rule name, marker included.
     */
    private final String checkName;

    private final CheckOutcome outcome;
    private final Double measuredValue;
    private final Double failThreshold;
    private final Double warnThreshold;

    public boolean isResolved() {
        return checkId != null;
    }
}
