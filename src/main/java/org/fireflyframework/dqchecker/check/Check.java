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

package org.fireflyframework.dqchecker.check;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A single data-quality rule definition.
 *
 * <p>A check is raw input: nothing about it is guaranteed until it passes
 * {@link CheckValidator}, which wraps it in a {@link ValidCheck}. Only valid checks
 * can be compiled.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Check check = Check.builder()
 *         .id(42L)
 *         .name("Customer email present")
 *         .metric(MetricType.MISSING_COUNT)
 *         .column("email")
 *         .table(TableRef.of("dbo", "customers"))
 *         .fail(Threshold.of(ComparisonOperator.GREATER_THAN, 0))
 *         .build();
 * }</pre>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Check {

    /**
     * Stable identity, carried through the scan engine inside the rule name.
     */
    Long id;

    String name;

    MetricType metric;

    String column;

    TableRef table;

    Threshold fail;

    Threshold warn;

    /**
     * Boolean expression restricting the rows the metric is computed over.
     */
    String filter;

    CheckExtension extension;

    public boolean hasColumn() {
        return column != null && !column.isBlank();
    }

    public boolean hasFilter() {
        return filter != null && !filter.isBlank();
    }

    /**
     * Returns the display name, falling back to the metric name when none was given.
     *
     * @return the display name
     */
    public String getDisplayName() {
        if (name != null && !name.isBlank()) {
            return name.trim();
        }
        if (metric == null) {
            return "check";
        }
        return hasColumn() ? metric.getValue() + "(" + column.trim() + ")" : metric.getValue();
    }
}
