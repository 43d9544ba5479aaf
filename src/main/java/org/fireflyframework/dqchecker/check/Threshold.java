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
 * One side of a check's threshold pair: the engine flags the check when
 * {@code measured <operator> value} holds.
 *
 * @param operator the comparison operator
 * @param value    the numeric threshold
 */
public record Threshold(ComparisonOperator operator, double value) {

    public static Threshold of(ComparisonOperator operator, double value) {
        return new Threshold(operator, value);
    }

    public static Threshold of(String operator, double value) {
        return new Threshold(ComparisonOperator.fromSymbol(operator), value);
    }
}
