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

import org.fireflyframework.dqchecker.check.MetricType;
import org.fireflyframework.dqchecker.check.SchemaExtension;
import org.fireflyframework.dqchecker.check.ValidCheck;
import org.fireflyframework.dqchecker.compiler.SodaText;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes schema rules. Each violation category lands in the {@code fail:} block, the
 * {@code warn:} block, or both, according to the extension's enforcement flags; a
 * category without any flag is a failure.
 */
public class SchemaFragmentWriter extends AbstractFragmentWriter {

    @Override
    public Set<MetricType> supportedMetrics() {
        return EnumSet.of(MetricType.SCHEMA);
    }

    @Override
    public List<String> write(ValidCheck check, FragmentContext context) {
        SchemaExtension schema = check.extension(SchemaExtension.class);
        List<String> failRules = new ArrayList<>();
        List<String> warnRules = new ArrayList<>();

        if (!schema.getRequiredColumns().isEmpty()) {
            List<String> rule = List.of(BODY + "when required column missing: "
                    + SodaText.list(schema.getRequiredColumns()));
            place(rule, schema.isWarnRequiredMissing(), schema.isFailRequiredMissing(), warnRules, failRules);
        }
        if (!schema.getForbiddenColumns().isEmpty()) {
            List<String> rule = List.of(BODY + "when forbidden column present: "
                    + SodaText.list(schema.getForbiddenColumns()));
            place(rule, schema.isWarnForbiddenPresent(), schema.isFailForbiddenPresent(), warnRules, failRules);
        }
        if (!schema.getColumnTypes().isEmpty()) {
            List<String> rule = new ArrayList<>();
            rule.add(BODY + "when wrong column type:");
            for (Map.Entry<String, String> entry : schema.getColumnTypes().entrySet()) {
                rule.add(BODY + "  " + SodaText.identifier(entry.getKey()) + ": " + SodaText.value(entry.getValue()));
            }
            place(rule, schema.isWarnWrongType(), schema.isFailWrongType(), warnRules, failRules);
        }

        List<String> lines = new ArrayList<>();
        addItem(lines, "schema");
        addName(lines, check);
        if (!failRules.isEmpty()) {
            lines.add(ATTRIBUTE + "fail:");
            lines.addAll(failRules);
        }
        if (!warnRules.isEmpty()) {
            lines.add(ATTRIBUTE + "warn:");
            lines.addAll(warnRules);
        }
        addFilter(lines, check.getCheck());
        return lines;
    }

    private static void place(List<String> rule, boolean warn, boolean fail,
                              List<String> warnRules, List<String> failRules) {
        if (fail || !warn) {
            failRules.addAll(rule);
        }
        if (warn) {
            warnRules.addAll(rule);
        }
    }
}
