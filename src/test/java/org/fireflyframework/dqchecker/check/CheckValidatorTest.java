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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CheckValidator}.
 */
class CheckValidatorTest {

    private CheckValidator validator;

    @BeforeEach
    void setUp() {
        validator = new CheckValidator();
    }

    private static Check.CheckBuilder rowCount() {
        return Check.builder()
                .id(1L)
                .name("Orders present")
                .metric(MetricType.ROW_COUNT)
                .table(TableRef.of("dbo", "orders"))
                .fail(Threshold.of(ComparisonOperator.LESS_THAN, 1));
    }

    private static List<String> fields(CheckValidation validation) {
        return validation.getErrors().stream().map(ValidationError::field).toList();
    }

    @Test
    void validate_shouldAcceptWellFormedCheck() {
        // When
        CheckValidation validation = validator.validate(rowCount().build());

        // Then
        assertThat(validation.isValid()).isTrue();
        assertThat(validation.getErrors()).isEmpty();
        assertThat(validation.getValidCheck()).hasValueSatisfying(valid -> assertThat(valid.getId()).isEqualTo(1L));
    }

    @Test
    void validate_shouldRequireAtLeastOneThreshold() {
        // Given
        Check neither = rowCount().fail(null).build();

        // When & Then
        assertThat(fields(validator.validate(neither))).containsExactly("thresholds");
        assertThat(validator.validate(neither.toBuilder().warn(Threshold.of("<", 10)).build()).isValid()).isTrue();
        assertThat(validator.validate(neither.toBuilder().fail(Threshold.of("<", 1)).build()).isValid()).isTrue();
    }

    @Test
    void validate_shouldAcceptWarnLooserOrTighterThanFail() {
        // Given
        Check check = rowCount()
                .fail(Threshold.of("<", 100))
                .warn(Threshold.of("<", 10))
                .build();

        // When & Then
        assertThat(validator.validate(check).isValid()).isTrue();
    }

    @Test
    void validate_shouldCollectEveryViolation() {
        // Given - no id, column-scoped metric without column, stray extension, no thresholds
        Check check = Check.builder()
                .metric(MetricType.MISSING_COUNT)
                .table(TableRef.of("dbo", "orders"))
                .extension(new SqlExtension("SELECT 1"))
                .build();

        // When
        CheckValidation validation = validator.validate(check);

        // Then
        assertThat(validation.isValid()).isFalse();
        assertThat(fields(validation)).containsExactly("id", "column", "extension", "thresholds");
    }

    @Test
    void validate_shouldRejectMissingMetricAndTable() {
        // Given
        Check check = Check.builder().id(3L).fail(Threshold.of(">", 0)).build();

        // When & Then
        assertThat(fields(validator.validate(check))).containsExactly("metric", "table");
    }

    @Test
    void validate_shouldRejectNegativeId() {
        assertThat(fields(validator.validate(rowCount().id(-4L).build()))).containsExactly("id");
    }

    @Test
    void validate_shouldRejectColumnOnTableScopedMetric() {
        // Given
        Check check = rowCount().column("customer_id").build();

        // When
        CheckValidation validation = validator.validate(check);

        // Then
        assertThat(fields(validation)).containsExactly("column");
        assertThat(validation.getErrors().get(0).message()).contains("table-scoped");
    }

    @Test
    void validate_shouldTreatBlankColumnAsAbsent() {
        assertThat(validator.validate(rowCount().column("  ").build()).isValid()).isTrue();
        assertThat(fields(validator.validate(Check.builder()
                .id(2L)
                .metric(MetricType.AVG)
                .column(" ")
                .table(TableRef.of("dbo", "payments"))
                .warn(Threshold.of(">", 10))
                .build()))).containsExactly("column");
    }

    @Test
    void validate_shouldRequireExtensionForSpecialisedMetric() {
        // Given
        Check freshness = rowCount().metric(MetricType.FRESHNESS).build();

        // When
        CheckValidation validation = validator.validate(freshness);

        // Then
        assertThat(fields(validation)).containsExactly("extension");
        assertThat(validation.getErrors().get(0).message()).contains("FreshnessExtension");
    }

    @Test
    void validate_shouldRejectExtensionOfWrongKind() {
        // Given
        Check check = rowCount()
                .metric(MetricType.FRESHNESS)
                .extension(new SqlExtension("SELECT MAX(loaded_at) FROM dbo.orders"))
                .build();

        // When & Then
        assertThat(validator.validate(check).getErrors())
                .singleElement()
                .satisfies(error -> assertThat(error.message()).contains("but got SqlExtension"));
    }

    @Test
    void validate_shouldRequirePositiveFreshnessThreshold() {
        // Given
        Check check = rowCount()
                .metric(MetricType.FRESHNESS)
                .extension(new FreshnessExtension("loaded_at", 0, null))
                .build();

        // When & Then
        assertThat(fields(validator.validate(check)))
                .containsExactly("extension.thresholdValue", "extension.thresholdUnit");
    }

    @Test
    void validate_shouldRejectBlankExtensionStrings() {
        // Given
        Check reference = Check.builder()
                .id(7L)
                .metric(MetricType.REFERENCE)
                .column("customer_id")
                .table(TableRef.of("dbo", "orders"))
                .extension(new ReferenceExtension("  ", "id"))
                .fail(Threshold.of(">", 0))
                .build();
        Check customSql = rowCount().metric(MetricType.CUSTOM_SQL).extension(new SqlExtension("\n ")).build();

        // When & Then
        assertThat(fields(validator.validate(reference))).containsExactly("extension.referenceTable");
        assertThat(fields(validator.validate(customSql))).containsExactly("extension.sql");
    }

    @Test
    void validate_shouldRequireSchemaRules() {
        // Given
        Check empty = rowCount().metric(MetricType.SCHEMA).extension(SchemaExtension.builder().build()).build();
        Check blankColumn = rowCount()
                .metric(MetricType.SCHEMA)
                .extension(SchemaExtension.builder().requiredColumns(List.of("id", "")).build())
                .build();

        // When & Then
        assertThat(fields(validator.validate(empty))).containsExactly("extension");
        assertThat(fields(validator.validate(blankColumn))).containsExactly("extension.requiredColumns");
    }

    @Test
    void validate_shouldRejectInvalidScalarTolerance() {
        // Given
        Check check = rowCount()
                .metric(MetricType.SCALAR_COMPARISON)
                .extension(new ScalarComparisonExtension("SELECT COUNT(*) FROM staging.orders",
                        "SELECT COUNT(*) FROM dbo.orders", ComparisonOperator.EQUAL, -1.0, null))
                .build();

        // When & Then
        assertThat(fields(validator.validate(check)))
                .containsExactly("extension.toleranceValue", "extension.toleranceKind");
    }

    @Test
    void validate_shouldRejectNonFiniteThresholds() {
        // Given
        Check check = rowCount()
                .fail(Threshold.of(ComparisonOperator.LESS_THAN, Double.NaN))
                .warn(new Threshold(null, Double.POSITIVE_INFINITY))
                .build();

        // When & Then
        assertThat(fields(validator.validate(check))).containsExactly("fail.value", "warn.operator", "warn.value");
    }

    @Test
    void validate_shouldThrowOnNullCheck() {
        assertThatThrownBy(() -> validator.validate(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void validateAll_shouldPreserveInputOrder() {
        // Given
        List<Check> checks = List.of(rowCount().id(1L).build(), rowCount().id(2L).fail(null).build(),
                rowCount().id(3L).build());

        // When
        List<CheckValidation> validations = validator.validateAll(checks);

        // Then
        assertThat(validations).extracting(CheckValidation::isValid).containsExactly(true, false, true);
        assertThat(validations).extracting(v -> v.getCheck().getId()).containsExactly(1L, 2L, 3L);
    }

    @Test
    void orElseThrow_shouldCarryItemisedErrors() {
        // Given
        CheckValidation validation = validator.validate(rowCount().id(9L).fail(null).column("x").build());

        // When & Then
        assertThatThrownBy(validation::orElseThrow)
                .isInstanceOf(CheckValidationException.class)
                .hasMessageContaining("Check 9")
                .satisfies(e -> {
                    CheckValidationException ex = (CheckValidationException) e;
                    assertThat(ex.getCheckId()).isEqualTo(9L);
                    assertThat(ex.getErrors()).hasSize(2);
                });
    }
}
