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

package org.fireflyframework.dqchecker.compiler;

import org.fireflyframework.dqchecker.check.MetricType;
import org.fireflyframework.dqchecker.check.TableRef;
import org.fireflyframework.dqchecker.check.ValidCheck;
import org.fireflyframework.dqchecker.compiler.fragments.CustomSqlFragmentWriter;
import org.fireflyframework.dqchecker.compiler.fragments.FragmentContext;
import org.fireflyframework.dqchecker.compiler.fragments.FragmentWriter;
import org.fireflyframework.dqchecker.compiler.fragments.FreshnessFragmentWriter;
import org.fireflyframework.dqchecker.compiler.fragments.ReferenceFragmentWriter;
import org.fireflyframework.dqchecker.compiler.fragments.ScalarComparisonFragmentWriter;
import org.fireflyframework.dqchecker.compiler.fragments.SchemaFragmentWriter;
import org.fireflyframework.dqchecker.compiler.fragments.StandardMetricFragmentWriter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compiles validated checks into the scan engine's textual rule specification.
 *
 * <p>Checks are grouped by their rendered table name, so with default-schema elision
 * {@code dbo.orders} and a schema-less {@code orders} share a block. Groups appear in
 * the order their first check appears in the input, and checks keep their input order
 * inside a group; no other sorting is applied, so callers control the layout. Each
 * check becomes one rule fragment whose name carries the check id (see
 * {@link CheckIdentityMarker}).</p>
 *
 * <p>Compilation is pure: the same checks in the same order with the same
 * {@link CompilerOptions} always yield byte-identical text.</p>
 *
 * <p><b>Example output:</b></p>
 * <pre>
 * checks for dbo.orders:
 *   - row_count:
 *       name: "Orders present [check_id:1]"
 *       fail: when &lt; 1
 *   - missing_count(customer_id):
 *       name: "Customer set [check_id:2]"
 *       fail: when &gt; 0
 *       warn: when &gt; 10
 * </pre>
 */
@Slf4j
public class ScanSpecCompiler {

    private final Map<MetricType, FragmentWriter> writers;

    /**
     * Creates a compiler with the built-in fragment writers for every metric.
     */
    public ScanSpecCompiler() {
        this(List.of(
                new StandardMetricFragmentWriter(),
                new FreshnessFragmentWriter(),
                new SchemaFragmentWriter(),
                new ReferenceFragmentWriter(),
                new ScalarComparisonFragmentWriter(),
                new CustomSqlFragmentWriter()));
    }

    /**
     * Creates a compiler with the given fragment writers.
     *
     * @param writers the writers; a metric claimed by two writers is a configuration error
     */
    public ScanSpecCompiler(List<FragmentWriter> writers) {
        this.writers = new EnumMap<>(MetricType.class);
        for (FragmentWriter writer : writers) {
            for (MetricType metric : writer.supportedMetrics()) {
                FragmentWriter previous = this.writers.put(metric, writer);
                if (previous != null) {
                    throw new IllegalArgumentException("Metric " + metric.getValue() + " is claimed by both "
                            + previous.getClass().getSimpleName() + " and " + writer.getClass().getSimpleName());
                }
            }
        }
    }

    /**
     * Compiles checks into an executable specification.
     *
     * @param checks  the validated checks, in the order they should appear
     * @param options elision and default-schema settings
     * @return the compiled specification; empty when {@code checks} is empty
     * @throws SpecCompilationException if a check's metric has no fragment writer
     */
    public ExecutableSpec compile(List<ValidCheck> checks, CompilerOptions options) {
        Objects.requireNonNull(checks, "checks must not be null");
        Objects.requireNonNull(options, "options must not be null");
        if (checks.isEmpty()) {
            return ExecutableSpec.empty();
        }

        Map<String, List<ValidCheck>> groups = new LinkedHashMap<>();
        for (ValidCheck check : checks) {
            groups.computeIfAbsent(SodaText.qualifiedTable(check.getTable(), options), name -> new ArrayList<>())
                    .add(check);
        }

        List<TableBlock> blocks = new ArrayList<>(groups.size());
        groups.values().forEach(tableChecks ->
                blocks.add(compileBlock(tableChecks.get(0).getTable(), tableChecks, options)));

        ExecutableSpec spec = new ExecutableSpec(blocks);
        log.debug("Compiled {} check(s) into {} table block(s)", spec.getRuleCount(), blocks.size());
        return spec;
    }

    private TableBlock compileBlock(TableRef table, List<ValidCheck> checks, CompilerOptions options) {
        FragmentContext context = FragmentContext.of(table, options);
        List<RuleFragment> fragments = new ArrayList<>(checks.size());
        for (ValidCheck check : checks) {
            fragments.add(compileFragment(check, context));
        }
        return new TableBlock(table, "checks for " + context.qualifiedTable() + ":", fragments);
    }

    private RuleFragment compileFragment(ValidCheck check, FragmentContext context) {
        MetricType metric = check.getMetric();
        FragmentWriter writer = writers.get(metric);
        if (writer == null) {
            throw new SpecCompilationException(check.getId(),
                    "No fragment writer for metric " + metric.getValue() + " (check " + check.getId() + ")");
        }
        List<String> lines = writer.write(check, context);
        if (lines.isEmpty()) {
            throw new SpecCompilationException(check.getId(),
                    writer.getClass().getSimpleName() + " produced no text for check " + check.getId());
        }
        String ruleName = CheckIdentityMarker.embed(check.getCheck().getDisplayName(), check.getId());
        log.trace("Compiled check {} ({}) for {}", check.getId(), metric.getValue(), context.qualifiedTable());
        return new RuleFragment(check.getId(), metric, ruleName, lines);
    }
}
