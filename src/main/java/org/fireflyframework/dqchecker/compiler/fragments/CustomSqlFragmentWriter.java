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
import org.fireflyframework.dqchecker.check.SqlExtension;
import org.fireflyframework.dqchecker.check.ValidCheck;
import org.fireflyframework.dqchecker.compiler.SodaText;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Writes user-defined SQL metrics: the query defines a named metric that the
 * thresholds are evaluated against.
 */
public class CustomSqlFragmentWriter extends AbstractFragmentWriter {

    @Override
    public Set<MetricType> supportedMetrics() {
        return EnumSet.of(MetricType.CUSTOM_SQL, MetricType.USER_DEFINED);
    }

    @Override
    public List<String> write(ValidCheck check, FragmentContext context) {
        SqlExtension sql = check.extension(SqlExtension.class);
        String metric = SodaText.metricIdentifier(check.getCheck().getDisplayName(), check.getId());
        List<String> lines = new ArrayList<>();

        addItem(lines, metric);
        addName(lines, check);
        addQuery(lines, metric + " query", SodaText.indentLines(sql.sql(), BODY));
        addThresholds(lines, check.getCheck());
        addFilter(lines, check.getCheck());
        return lines;
    }
}
