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

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of metric kinds a {@link Check} can measure.
 *
 * <p>Each kind declares whether it is scoped to a column or to the whole table, and
 * which {@link CheckExtension} payload type (if any) it requires. The validator and
 * the compiler both key their behaviour on these two attributes.</p>
 */
public enum MetricType {

    ROW_COUNT("row_count", Scope.TABLE, null),
    MISSING_COUNT("missing_count", Scope.COLUMN, null),
    MISSING_PERCENT("missing_percent", Scope.COLUMN, null),
    DUPLICATE_COUNT("duplicate_count", Scope.COLUMN, null),
    DUPLICATE_PERCENT("duplicate_percent", Scope.COLUMN, null),
    MIN("min", Scope.COLUMN, null),
    MAX("max", Scope.COLUMN, null),
    AVG("avg", Scope.COLUMN, null),
    SUM("sum", Scope.COLUMN, null),
    INVALID_COUNT("invalid_count", Scope.COLUMN, null),
    INVALID_PERCENT("invalid_percent", Scope.COLUMN, null),
    VALID_COUNT("valid_count", Scope.COLUMN, null),
    AVG_LENGTH("avg_length", Scope.COLUMN, null),
    MIN_LENGTH("min_length", Scope.COLUMN, null),
    FRESHNESS("freshness", Scope.TABLE, FreshnessExtension.class),
    SCHEMA("schema", Scope.TABLE, SchemaExtension.class),
    REFERENCE("reference", Scope.COLUMN, ReferenceExtension.class),
    SCALAR_COMPARISON("scalar_comparison", Scope.TABLE, ScalarComparisonExtension.class),
    CUSTOM_SQL("custom_sql", Scope.TABLE, SqlExtension.class),
    USER_DEFINED("user_defined", Scope.COLUMN, SqlExtension.class);

    /**
     * Whether a metric measures a single column.
     */
    public enum Scope {
        TABLE,
        COLUMN
    }

    private static final Map<String, MetricType> BY_VALUE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(MetricType::getValue, Function.identity()));

    private final String value;
    private final Scope scope;
    private final Class<? extends CheckExtension> extensionType;

    MetricType(String value, Scope scope, Class<? extends CheckExtension> extensionType) {
        this.value = value;
        this.scope = scope;
        this.extensionType = extensionType;
    }

    /**
     * Returns the wire name used in check definitions and in generated scan text.
     *
     * @return the metric's wire name, e.g. {@code missing_count}
     */
    @JsonValue
    public String getValue() {
        return value;
    }

    public Scope getScope() {
        return scope;
    }

    public boolean isColumnScoped() {
        return scope == Scope.COLUMN;
    }

    public boolean isTableScoped() {
        return scope == Scope.TABLE;
    }

    /**
     * Returns the extension payload type this metric requires, or {@code null} for
     * metrics that take no extension data.
     *
     * @return the required extension type, or {@code null}
     */
    public Class<? extends CheckExtension> getExtensionType() {
        return extensionType;
    }

    public boolean requiresExtension() {
        return extensionType != null;
    }

    /**
     * Resolves a metric from its wire name (case-insensitive).
     *
     * @param value the wire name
     * @return the matching metric
     * @throws IllegalArgumentException if the name is not a supported metric
     */
    @JsonCreator
    public static MetricType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Metric must not be null");
        }
        MetricType metric = BY_VALUE.get(value.trim().toLowerCase(Locale.ROOT));
        if (metric == null) {
            throw new IllegalArgumentException("Unsupported metric: " + value);
        }
        return metric;
    }
}
