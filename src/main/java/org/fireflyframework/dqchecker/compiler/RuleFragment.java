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

import java.util.List;

/**
 * The scan text generated for one check.
 *
 * @param checkId  the originating check id
 * @param metric   the check's metric
 * @param ruleName the name written into the rule, identity marker included
 * @param lines    the fragment's lines, indented for placement under a table header
 */
public record RuleFragment(long checkId, MetricType metric, String ruleName, List<String> lines) {

    public RuleFragment {
        lines = List.copyOf(lines);
    }
}
