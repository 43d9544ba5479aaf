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
import org.fireflyframework.dqchecker.check.ValidCheck;

import java.util.List;
import java.util.Set;

/**
 * Writes the rule fragment for one family of metrics.
 *
 * <p>Implementations are stateless and deterministic. The compiler picks the writer by
 * the check's {@link MetricType}; each metric must be claimed by exactly one writer.</p>
 */
public interface FragmentWriter {

    /**
     * Returns the metrics this writer knows how to render.
     *
     * @return the supported metrics
     */
    Set<MetricType> supportedMetrics();

    /**
     * Renders the fragment lines for a check, indented for placement under a table
     * header. The first line is the rule's list item.
     *
     * @param check   the validated check
     * @param context the table and compiler settings the fragment is written for
     * @return the fragment lines
     */
    List<String> write(ValidCheck check, FragmentContext context);
}
