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
import org.fireflyframework.dqchecker.check.ReferenceExtension;
import org.fireflyframework.dqchecker.check.ValidCheck;
import org.fireflyframework.dqchecker.compiler.SodaText;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Writes referential-integrity rules as failed-rows queries returning every source
 * value missing from the referenced column. A custom query in the extension replaces
 * the generated one.
 */
public class ReferenceFragmentWriter extends AbstractFragmentWriter {

    @Override
    public Set<MetricType> supportedMetrics() {
        return EnumSet.of(MetricType.REFERENCE);
    }

    @Override
    public List<String> write(ValidCheck check, FragmentContext context) {
        ReferenceExtension reference = check.extension(ReferenceExtension.class);
        List<String> lines = new ArrayList<>();

        addItem(lines, "failed rows");
        addName(lines, check);
        addQuery(lines, "fail query", reference.hasCustomSql()
                ? SodaText.indentLines(reference.customSql(), BODY)
                : generatedQuery(check, reference, context));
        addThresholds(lines, check.getCheck());
        addFilter(lines, check.getCheck());
        return lines;
    }

    private static List<String> generatedQuery(ValidCheck check, ReferenceExtension reference,
                                               FragmentContext context) {
        String column = SodaText.identifier(check.getCheck().getColumn());
        return List.of(
                BODY + "SELECT * FROM " + context.qualifiedTable(),
                BODY + "WHERE " + column + " IS NOT NULL",
                BODY + "  AND " + column + " NOT IN (",
                BODY + "    SELECT " + SodaText.identifier(reference.referenceColumn())
                        + " FROM " + context.qualify(reference.referenceTable()),
                BODY + "  )");
    }
}
