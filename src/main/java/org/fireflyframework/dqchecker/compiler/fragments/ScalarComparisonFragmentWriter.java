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

import org.fireflyframework.dqchecker.check.ComparisonOperator;
import org.fireflyframework.dqchecker.check.MetricType;
import org.fireflyframework.dqchecker.check.ScalarComparisonExtension;
import org.fireflyframework.dqchecker.check.ToleranceKind;
import org.fireflyframework.dqchecker.check.ValidCheck;
import org.fireflyframework.dqchecker.compiler.SodaText;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Writes scalar comparisons as failed-rows queries.
 *
 * <p>Both scalar queries are evaluated side by side and the query returns a row when
 * the expected relation does not hold. A tolerance loosens the relation by an absolute
 * amount or by a percentage of {@code query_a}; the engine evaluates it as part of the
 * query.</p>
 */
public class ScalarComparisonFragmentWriter extends AbstractFragmentWriter {

    @Override
    public Set<MetricType> supportedMetrics() {
        return EnumSet.of(MetricType.SCALAR_COMPARISON);
    }

    @Override
    public List<String> write(ValidCheck check, FragmentContext context) {
        ScalarComparisonExtension scalar = check.extension(ScalarComparisonExtension.class);
        List<String> lines = new ArrayList<>();

        addItem(lines, "failed rows");
        addName(lines, check);
        addQuery(lines, "fail query", List.of(
                BODY + "WITH comparison AS (",
                BODY + "  SELECT",
                BODY + "    (" + SodaText.inline(scalar.queryA()) + ") AS query_a,",
                BODY + "    (" + SodaText.inline(scalar.queryB()) + ") AS query_b",
                BODY + ")",
                BODY + "SELECT query_a, query_b, query_a - query_b AS difference",
                BODY + "FROM comparison",
                BODY + "WHERE " + violation(scalar)));
        addThresholds(lines, check.getCheck());
        addFilter(lines, check.getCheck());
        return lines;
    }

    static String violation(ScalarComparisonExtension scalar) {
        ComparisonOperator operator = scalar.operator();
        if (!scalar.hasTolerance()) {
            return "query_a " + operator.negate().getSymbol() + " query_b";
        }
        String slack = scalar.toleranceKind() == ToleranceKind.PERCENTAGE
                ? "ABS(query_a) * " + SodaText.number(scalar.toleranceValue()) + " / 100"
                : SodaText.number(scalar.toleranceValue());
        return switch (operator) {
            case EQUAL -> "ABS(query_a - query_b) > " + slack;
            case NOT_EQUAL -> "ABS(query_a - query_b) <= " + slack;
            case GREATER_THAN -> "query_a <= query_b - " + slack;
            case GREATER_THAN_OR_EQUAL -> "query_a < query_b - " + slack;
            case LESS_THAN -> "query_a >= query_b + " + slack;
            case LESS_THAN_OR_EQUAL -> "query_a > query_b + " + slack;
        };
    }
}
