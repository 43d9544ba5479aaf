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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison operators accepted in check thresholds.
 */
public enum ComparisonOperator {

    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUAL(">="),
    LESS_THAN("<"),
    LESS_THAN_OR_EQUAL("<="),
    EQUAL("="),
    NOT_EQUAL("!=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    /**
     * Returns the operator that holds exactly when this one does not.
     *
     * @return the negated operator
     */
    public ComparisonOperator negate() {
        return switch (this) {
            case GREATER_THAN -> LESS_THAN_OR_EQUAL;
            case GREATER_THAN_OR_EQUAL -> LESS_THAN;
            case LESS_THAN -> GREATER_THAN_OR_EQUAL;
            case LESS_THAN_OR_EQUAL -> GREATER_THAN;
            case EQUAL -> NOT_EQUAL;
            case NOT_EQUAL -> EQUAL;
        };
    }

    /**
     * Parses an operator symbol. {@code ==} is accepted as an alias of {@code =}.
     *
     * @param symbol the operator symbol
     * @return the matching operator
     * @throws IllegalArgumentException if the symbol is not a supported operator
     */
    @JsonCreator
    public static ComparisonOperator fromSymbol(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("Comparison operator must not be null");
        }
        String trimmed = symbol.trim();
        if ("==".equals(trimmed)) {
            return EQUAL;
        }
        for (ComparisonOperator operator : values()) {
            if (operator.symbol.equals(trimmed)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unsupported comparison operator: " + symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
