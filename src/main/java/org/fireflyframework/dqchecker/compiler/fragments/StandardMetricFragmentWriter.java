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

package org.fireflyframework.dqchecker.compiler.fragments;

import org.fireflyframework.dqchecker.check.Check;
import org.fireflyframework.dqchecker.check.MetricType;
import org.fireflyframework.dqchecker.check.ValidCheck;
import org.fireflyframework.dqchecker.compiler.SodaText;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Writes single-line metric rules such as {@code row_count} or {@code missing_count(email)}.
 *
 * <p>For validity metrics a filter starting with {@code valid } (for example
 * {@code valid format: email}) configures what counts as valid and is written
 * verbatim instead of as a row filter.</p>
 */
public class StandardMetricFragmentWriter extends AbstractFragmentWriter {

    private static final Set<MetricType> VALIDITY_METRICS =
            EnumSet.of(MetricType.INVALID_COUNT, MetricType.INVALID_PERCENT, MetricType.VALID_COUNT);

    @Override
    public Set<MetricType> supportedMetrics() {
        return EnumSet.of(
                MetricType.ROW_COUNT,
                MetricType.MISSING_COUNT, MetricType.MISSING_PERCENT,
                MetricType.DUPLICATE_COUNT, MetricType.DUPLICATE_PERCENT,
                MetricType.MIN, MetricType.MAX, MetricType.AVG, MetricType.SUM,
                MetricType.INVALID_COUNT, MetricType.INVALID_PERCENT, MetricType.VALID_COUNT,
                MetricType.AVG_LENGTH, MetricType.MIN_LENGTH);
    }

    @Override
    public List<String> write(ValidCheck validCheck, FragmentContext context) {
        Check check = validCheck.getCheck();
        MetricType metric = check.getMetric();
        List<String> lines = new ArrayList<>();

        String item = metric.isColumnScoped()
                ? metric.getValue() + "(" + SodaText.identifier(check.getColumn()) + ")"
                : metric.getValue();
        addItem(lines, item);
        addName(lines, validCheck);
        addThresholds(lines, check);

        if (VALIDITY_METRICS.contains(metric) && isValidityRule(check)) {
            lines.add(ATTRIBUTE + check.getFilter().trim());
        } else {
            addFilter(lines, check);
        }
        return lines;
    }

    private static boolean isValidityRule(Check check) {
        return check.hasFilter() && check.getFilter().trim().startsWith("valid ");
    }
}
