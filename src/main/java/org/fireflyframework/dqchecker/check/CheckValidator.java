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

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validates {@link Check} definitions before compilation.
 *
 * <p>Every rule is evaluated and all violations are collected; validation never stops
 * at the first problem. Invalid checks are reported, not thrown: exceptions are
 * reserved for programmer errors such as a {@code null} check.</p>
 *
 * <p>Rules:</p>
 * <ol>
 *   <li>the metric, identity and table are present</li>
 *   <li>a column is given exactly when the metric is column-scoped</li>
 *   <li>the extension payload is exactly the one the metric requires</li>
 *   <li>at least one of the fail and warn thresholds is set</li>
 *   <li>thresholds are finite; freshness thresholds are positive</li>
 *   <li>strings required by the extension payload are not blank</li>
 * </ol>
 */
@Slf4j
public class CheckValidator {

    /**
     * Validates a single check.
     *
     * @param check the check to validate
     * @return the validation outcome
     * @throws NullPointerException if {@code check} is {@code null}
     */
    public CheckValidation validate(Check check) {
        Objects.requireNonNull(check, "check must not be null");
        List<ValidationError> errors = new ArrayList<>();

        validateIdentity(check, errors);
        validateColumn(check, errors);
        validateExtension(check, errors);
        validateThresholds(check, errors);

        if (errors.isEmpty()) {
            return CheckValidation.valid(check);
        }
        log.debug("Check {} failed validation with {} error(s): {}", check.getId(), errors.size(), errors);
        return CheckValidation.invalid(check, errors);
    }

    /**
     * Validates every check, preserving input order.
     *
     * @param checks the checks to validate
     * @return one outcome per check
     */
    public List<CheckValidation> validateAll(List<Check> checks) {
        return checks.stream().map(this::validate).toList();
    }

    private void validateIdentity(Check check, List<ValidationError> errors) {
        if (check.getId() == null) {
            errors.add(new ValidationError("id", "check id is required"));
        } else if (check.getId() < 0) {
            errors.add(new ValidationError("id", "check id must not be negative"));
        }
        if (check.getMetric() == null) {
            errors.add(new ValidationError("metric", "metric is required"));
        }
        TableRef table = check.getTable();
        if (table == null) {
            errors.add(new ValidationError("table", "table reference is required"));
        } else if (table.table().isBlank()) {
            errors.add(new ValidationError("table.table", "table name must not be blank"));
        }
    }

    private void validateColumn(Check check, List<ValidationError> errors) {
        MetricType metric = check.getMetric();
        if (metric == null) {
            return;
        }
        if (metric.isColumnScoped() && !check.hasColumn()) {
            errors.add(new ValidationError("column", "metric " + metric.getValue() + " requires a column"));
        }
        if (metric.isTableScoped() && check.hasColumn()) {
            errors.add(new ValidationError("column",
                    "metric " + metric.getValue() + " is table-scoped and must not name a column"));
        }
    }

    private void validateExtension(Check check, List<ValidationError> errors) {
        MetricType metric = check.getMetric();
        if (metric == null) {
            return;
        }
        CheckExtension extension = check.getExtension();
        Class<? extends CheckExtension> required = metric.getExtensionType();

        if (required == null) {
            if (extension != null) {
                errors.add(new ValidationError("extension",
                        "metric " + metric.getValue() + " takes no extension data but got "
                                + extension.getClass().getSimpleName()));
            }
            return;
        }
        if (extension == null) {
            errors.add(new ValidationError("extension",
                    "metric " + metric.getValue() + " requires " + required.getSimpleName()));
            return;
        }
        if (!required.isInstance(extension)) {
            errors.add(new ValidationError("extension",
                    "metric " + metric.getValue() + " requires " + required.getSimpleName()
                            + " but got " + extension.getClass().getSimpleName()));
            return;
        }

        if (extension instanceof FreshnessExtension freshness) {
            validateFreshness(freshness, errors);
        } else if (extension instanceof SchemaExtension schema) {
            validateSchema(schema, errors);
        } else if (extension instanceof ReferenceExtension reference) {
            requireText(reference.referenceTable(), "extension.referenceTable", errors);
            requireText(reference.referenceColumn(), "extension.referenceColumn", errors);
        } else if (extension instanceof ScalarComparisonExtension scalar) {
            validateScalar(scalar, errors);
        } else if (extension instanceof SqlExtension sql) {
            requireText(sql.sql(), "extension.sql", errors);
        } else {
            throw new IllegalStateException("No validation rules for extension " + extension.getClass().getName());
        }
    }

    private void validateFreshness(FreshnessExtension freshness, List<ValidationError> errors) {
        requireText(freshness.dateColumn(), "extension.dateColumn", errors);
        if (freshness.thresholdValue() <= 0) {
            errors.add(new ValidationError("extension.thresholdValue", "freshness threshold must be a positive integer"));
        }
        if (freshness.thresholdUnit() == null) {
            errors.add(new ValidationError("extension.thresholdUnit", "freshness threshold unit is required"));
        }
    }

    private void validateSchema(SchemaExtension schema, List<ValidationError> errors) {
        if (!schema.hasRules()) {
            errors.add(new ValidationError("extension",
                    "schema check needs required, forbidden or typed columns"));
        }
        schema.getRequiredColumns().forEach(column -> requireText(column, "extension.requiredColumns", errors));
        schema.getForbiddenColumns().forEach(column -> requireText(column, "extension.forbiddenColumns", errors));
        for (Map.Entry<String, String> entry : schema.getColumnTypes().entrySet()) {
            requireText(entry.getKey(), "extension.columnTypes", errors);
            requireText(entry.getValue(), "extension.columnTypes[" + entry.getKey() + "]", errors);
        }
    }

    private void validateScalar(ScalarComparisonExtension scalar, List<ValidationError> errors) {
        requireText(scalar.queryA(), "extension.queryA", errors);
        requireText(scalar.queryB(), "extension.queryB", errors);
        if (scalar.operator() == null) {
            errors.add(new ValidationError("extension.operator", "scalar comparison operator is required"));
        }
        if (scalar.hasTolerance()) {
            if (!Double.isFinite(scalar.toleranceValue()) || scalar.toleranceValue() < 0) {
                errors.add(new ValidationError("extension.toleranceValue",
                        "tolerance must be a finite, non-negative number"));
            }
            if (scalar.toleranceKind() == null) {
                errors.add(new ValidationError("extension.toleranceKind", "tolerance kind is required with a tolerance"));
            }
        }
    }

    private void validateThresholds(Check check, List<ValidationError> errors) {
        if (check.getFail() == null && check.getWarn() == null) {
            errors.add(new ValidationError("thresholds", "at least one of fail or warn threshold is required"));
            return;
        }
        validateThreshold(check.getFail(), "fail", errors);
        validateThreshold(check.getWarn(), "warn", errors);
    }

    private void validateThreshold(Threshold threshold, String field, List<ValidationError> errors) {
        if (threshold == null) {
            return;
        }
        if (threshold.operator() == null) {
            errors.add(new ValidationError(field + ".operator", "comparison operator is required"));
        }
        if (!Double.isFinite(threshold.value())) {
            errors.add(new ValidationError(field + ".value", "threshold must be a finite number"));
        }
    }

    private static void requireText(String value, String field, List<ValidationError> errors) {
        if (value == null || value.isBlank()) {
            errors.add(new ValidationError(field, "must not be blank"));
        }
    }
}
