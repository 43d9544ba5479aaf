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
import org.fireflyframework.dqchecker.check.CheckValidator;
import org.fireflyframework.dqchecker.check.ComparisonOperator;
import org.fireflyframework.dqchecker.check.FreshnessExtension;
import org.fireflyframework.dqchecker.check.FreshnessUnit;
import org.fireflyframework.dqchecker.check.MetricType;
import org.fireflyframework.dqchecker.check.ReferenceExtension;
import org.fireflyframework.dqchecker.check.ScalarComparisonExtension;
import org.fireflyframework.dqchecker.check.SchemaExtension;
import org.fireflyframework.dqchecker.check.SqlExtension;
import org.fireflyframework.dqchecker.check.TableRef;
import org.fireflyframework.dqchecker.check.Threshold;
import org.fireflyframework.dqchecker.check.ToleranceKind;
import org.fireflyframework.dqchecker.check.ValidCheck;
import org.fireflyframework.dqchecker.compiler.CompilerOptions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the fragment shapes of each metric family.
 */
class FragmentWritersTest {

    private static final TableRef ORDERS = TableRef.of("dbo", "orders");
    private static final FragmentContext CONTEXT = FragmentContext.of(ORDERS, CompilerOptions.defaults());

    private final CheckValidator validator = new CheckValidator();

    private ValidCheck valid(Check check) {
        return validator.validate(check).orElseThrow();
    }

    @Test
    void standard_shouldWriteValidityRuleVerbatim() {
        // Given
        ValidCheck check = valid(Check.builder()
                .id(4L)
                .name("Emails valid")
                .metric(MetricType.INVALID_COUNT)
                .column("email")
                .table(ORDERS)
                .fail(Threshold.of(">", 0))
                .filter("valid format: email")
                .build());

        // When
        List<String> lines = new StandardMetricFragmentWriter().write(check, CONTEXT);

        // Then
        assertThat(lines).containsExactly(
                "  - invalid_count(email):",
                "      name: \"Emails valid [check_id:4]\"",
                "      fail: when > 0",
                "      valid format: email");
    }

    @Test
    void standard_shouldWriteOrdinaryFilterForOtherMetrics() {
        // Given
        ValidCheck check = valid(Check.builder()
                .id(6L)
                .metric(MetricType.DUPLICATE_PERCENT)
                .column("order number")
                .table(ORDERS)
                .warn(Threshold.of("!=", 0))
                .filter("valid format: email")
                .build());

        // When
        List<String> lines = new StandardMetricFragmentWriter().write(check, CONTEXT);

        // Then
        assertThat(lines).containsExactly(
                "  - duplicate_percent(\"order number\"):",
                "      name: \"duplicate_percent(order number) [check_id:6]\"",
                "      warn: when != 0",
                "      filter: \"valid format: email\"");
    }

    @Test
    void freshness_shouldCarryThresholdInHeader() {
        // Given
        ValidCheck check = valid(Check.builder()
                .id(5L)
                .name("Orders fresh")
                .metric(MetricType.FRESHNESS)
                .table(ORDERS)
                .extension(new FreshnessExtension("loaded_at", 2, FreshnessUnit.HOUR))
                .fail(Threshold.of(">", 0))
                .build());

        // When
        List<String> lines = new FreshnessFragmentWriter().write(check, CONTEXT);

        // Then
        assertThat(lines).containsExactly(
                "  - freshness(loaded_at) < 2h:",
                "      name: \"Orders fresh [check_id:5]\"");
    }

    @Test
    void schema_shouldSplitRulesByEnforcementLevel() {
        // Given - required columns only warn, forbidden has no flag (fail), types fail
        ValidCheck check = valid(Check.builder()
                .id(8L)
                .name("Orders shape")
                .metric(MetricType.SCHEMA)
                .table(ORDERS)
                .extension(SchemaExtension.builder()
                        .requiredColumns(List.of("id", "created at"))
                        .forbiddenColumns(List.of("ssn"))
                        .columnTypes(Map.of("id", "int"))
                        .warnRequiredMissing(true)
                        .failWrongType(true)
                        .build())
                .fail(Threshold.of(">", 0))
                .build());

        // When
        List<String> lines = new SchemaFragmentWriter().write(check, CONTEXT);

        // Then
        assertThat(lines).containsExactly(
                "  - schema:",
                "      name: \"Orders shape [check_id:8]\"",
                "      fail:",
                "        when forbidden column present: [ssn]",
                "        when wrong column type:",
                "          id: int",
                "      warn:",
                "        when required column missing: [id, created at]");
    }

    @Test
    void reference_shouldGenerateFailedRowsQuery() {
        // Given
        ValidCheck check = valid(Check.builder()
                .id(7L)
                .name("Known customers")
                .metric(MetricType.REFERENCE)
                .column("customer_id")
                .table(ORDERS)
                .extension(new ReferenceExtension("customers", "id"))
                .fail(Threshold.of(">", 0))
                .build());

        // When
        List<String> lines = new ReferenceFragmentWriter().write(check, CONTEXT);

        // Then
        assertThat(lines).containsExactly(
                "  - failed rows:",
                "      name: \"Known customers [check_id:7]\"",
                "      fail query: |",
                "        SELECT * FROM dbo.orders",
                "        WHERE customer_id IS NOT NULL",
                "          AND customer_id NOT IN (",
                "            SELECT id FROM dbo.customers",
                "          )",
                "      fail: when > 0");
    }

    @Test
    void reference_shouldPreferCustomSql() {
        // Given
        ValidCheck check = valid(Check.builder()
                .id(7L)
                .metric(MetricType.REFERENCE)
                .column("customer_id")
                .table(ORDERS)
                .extension(new ReferenceExtension("crm.customers", "id",
                        "SELECT o.* FROM dbo.orders o\nLEFT JOIN crm.customers c ON c.id = o.customer_id\nWHERE c.id IS NULL"))
                .warn(Threshold.of(">", 5))
                .build());

        // When
        List<String> lines = new ReferenceFragmentWriter().write(check, CONTEXT);

        // Then
        assertThat(lines).containsSequence(
                "      fail query: |",
                "        SELECT o.* FROM dbo.orders o",
                "        LEFT JOIN crm.customers c ON c.id = o.customer_id",
                "        WHERE c.id IS NULL",
                "      warn: when > 5");
    }

    @Test
    void scalarComparison_shouldInvertOperatorInWhereClause() {
        // Given
        ValidCheck check = valid(Check.builder()
                .id(11L)
                .name("Staging matches")
                .metric(MetricType.SCALAR_COMPARISON)
                .table(ORDERS)
                .extension(new ScalarComparisonExtension(
                        "SELECT COUNT(*)\nFROM staging.orders", "SELECT COUNT(*) FROM dbo.orders",
                        ComparisonOperator.GREATER_THAN_OR_EQUAL))
                .fail(Threshold.of(">", 0))
                .build());

        // When
        List<String> lines = new ScalarComparisonFragmentWriter().write(check, CONTEXT);

        // Then
        assertThat(lines).containsExactly(
                "  - failed rows:",
                "      name: \"Staging matches [check_id:11]\"",
                "      fail query: |",
                "        WITH comparison AS (",
                "          SELECT",
                "            (SELECT COUNT(*) FROM staging.orders) AS query_a,",
                "            (SELECT COUNT(*) FROM dbo.orders) AS query_b",
                "        )",
                "        SELECT query_a, query_b, query_a - query_b AS difference",
                "        FROM comparison",
                "        WHERE query_a < query_b",
                "      fail: when > 0");
    }

    @Test
    void scalarComparison_shouldWriteToleranceIntoCondition() {
        assertThat(ScalarComparisonFragmentWriter.violation(new ScalarComparisonExtension(
                "a", "b", ComparisonOperator.EQUAL, 5.0, ToleranceKind.ABSOLUTE)))
                .isEqualTo("ABS(query_a - query_b) > 5");
        assertThat(ScalarComparisonFragmentWriter.violation(new ScalarComparisonExtension(
                "a", "b", ComparisonOperator.GREATER_THAN_OR_EQUAL, 2.5, ToleranceKind.PERCENTAGE)))
                .isEqualTo("query_a < query_b - ABS(query_a) * 2.5 / 100");
        assertThat(ScalarComparisonFragmentWriter.violation(new ScalarComparisonExtension(
                "a", "b", ComparisonOperator.LESS_THAN_OR_EQUAL, 1.0, ToleranceKind.ABSOLUTE)))
                .isEqualTo("query_a > query_b + 1");
        assertThat(ScalarComparisonFragmentWriter.violation(new ScalarComparisonExtension(
                "a", "b", ComparisonOperator.NOT_EQUAL)))
                .isEqualTo("query_a = query_b");
    }

    @Test
    void customSql_shouldDeriveMetricNameFromCheckName() {
        // Given
        ValidCheck check = valid(Check.builder()
                .id(9L)
                .name("Negative Amounts!")
                .metric(MetricType.CUSTOM_SQL)
                .table(ORDERS)
                .extension(new SqlExtension("SELECT COUNT(*)\nFROM dbo.payments\nWHERE amount < 0"))
                .fail(Threshold.of(">", 0))
                .filter("region = 'EU'")
                .build());

        // When
        List<String> lines = new CustomSqlFragmentWriter().write(check, CONTEXT);

        // Then
        assertThat(lines).containsExactly(
                "  - negative_amounts:",
                "      name: \"Negative Amounts! [check_id:9]\"",
                "      negative_amounts query: |",
                "        SELECT COUNT(*)",
                "        FROM dbo.payments",
                "        WHERE amount < 0",
                "      fail: when > 0",
                "      filter: region = 'EU'");
    }

    @Test
    void context_shouldQualifyReferenceTablesWithCheckSchema() {
        assertThat(CONTEXT.qualify("customers")).isEqualTo("dbo.customers");
        assertThat(CONTEXT.qualify("crm.customers")).isEqualTo("crm.customers");
    }
}
