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

import org.fireflyframework.dqchecker.check.FreshnessExtension;
import org.fireflyframework.dqchecker.check.MetricType;
import org.fireflyframework.dqchecker.check.ValidCheck;
import org.fireflyframework.dqchecker.compiler.SodaText;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Writes freshness rules, e.g. {@code freshness(updated_at) < 24h}.
 *
 * <p>The maximum age comes from the extension and is written into the rule itself, so
 * no separate {@code fail:}/{@code warn:} lines are emitted.</p>
 */
public class FreshnessFragmentWriter extends AbstractFragmentWriter {

    @Override
    public Set<MetricType> supportedMetrics() {
        return EnumSet.of(MetricType.FRESHNESS);
    }

    @Override
    public List<String> write(ValidCheck check, FragmentContext context) {
        FreshnessExtension freshness = check.extension(FreshnessExtension.class);
        List<String> lines = new ArrayList<>();

        addItem(lines, "freshness(" + SodaText.identifier(freshness.dateColumn()) + ") < "
                + freshness.thresholdValue() + freshness.thresholdUnit().getSuffix());
        addName(lines, check);
        addFilter(lines, check.getCheck());
        return lines;
    }
}
