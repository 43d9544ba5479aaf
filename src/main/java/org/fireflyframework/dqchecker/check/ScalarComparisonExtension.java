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

/**
 * Compares the scalar results of two queries. The check fails on every row where
 * {@code queryA <operator> queryB} does not hold, within the optional tolerance.
 *
 * @param queryA         the left-hand scalar query
 * @param queryB         the right-hand scalar query
 * @param operator       the expected relation between the two results
 * @param toleranceValue optional tolerance, {@code null} for an exact comparison
 * @param toleranceKind  how {@code toleranceValue} is interpreted, required when a tolerance is set
 */
public record ScalarComparisonExtension(String queryA,
                                        String queryB,
                                        ComparisonOperator operator,
                                        Double toleranceValue,
                                        ToleranceKind toleranceKind) implements CheckExtension {

    public ScalarComparisonExtension(String queryA, String queryB, ComparisonOperator operator) {
        this(queryA, queryB, operator, null, null);
    }

    public boolean hasTolerance() {
        return toleranceValue != null;
    }
}
