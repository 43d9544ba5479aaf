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
import org.fireflyframework.dqchecker.check.Threshold;
import org.fireflyframework.dqchecker.check.ValidCheck;
import org.fireflyframework.dqchecker.compiler.CheckIdentityMarker;
import org.fireflyframework.dqchecker.compiler.SodaText;

import java.util.List;

/**
 * Shared line layout for fragment writers.
 *
 * <p>Fragments are indented two spaces for the list item, six for rule attributes
 * and eight for attribute bodies.</p>
 */
public abstract class AbstractFragmentWriter implements FragmentWriter {

    protected static final String ITEM = "  - ";
    protected static final String ATTRIBUTE = "      ";
    protected static final String BODY = "        ";

    /**
     * Returns the rule name with the identity marker appended.
     */
    protected static String ruleName(ValidCheck check) {
        return CheckIdentityMarker.embed(check.getCheck().getDisplayName(), check.getId());
    }

    protected static void addItem(List<String> lines, String item) {
        lines.add(ITEM + item + ":");
    }

    protected static void addName(List<String> lines, ValidCheck check) {
        lines.add(ATTRIBUTE + "name: " + SodaText.quoted(ruleName(check)));
    }

    /**
     * Adds a {@code fail:} line when the check has a fail threshold and a {@code warn:}
     * line when it has a warn threshold.
     */
    protected static void addThresholds(List<String> lines, Check check) {
        addThreshold(lines, "fail", check.getFail());
        addThreshold(lines, "warn", check.getWarn());
    }

    protected static void addFilter(List<String> lines, Check check) {
        if (check.hasFilter()) {
            lines.add(ATTRIBUTE + "filter: " + SodaText.value(check.getFilter()));
        }
    }

    protected static void addQuery(List<String> lines, String key, List<String> queryLines) {
        lines.add(ATTRIBUTE + key + ": |");
        lines.addAll(queryLines);
    }

    private static void addThreshold(List<String> lines, String key, Threshold threshold) {
        if (threshold != null) {
            lines.add(ATTRIBUTE + key + ": when " + threshold.operator().getSymbol() + " "
                    + SodaText.number(threshold.value()));
        }
    }
}
