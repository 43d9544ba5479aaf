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

import org.fireflyframework.dqchecker.check.TableRef;

import java.util.List;

/**
 * All rules targeting one table, under a single {@code checks for <table>:} header.
 *
 * @param table     the table every fragment in this block targets
 * @param header    the block header line
 * @param fragments the rule fragments, in input order
 */
public record TableBlock(TableRef table, String header, List<RuleFragment> fragments) {

    public TableBlock {
        fragments = List.copyOf(fragments);
    }

    public String render() {
        StringBuilder sb = new StringBuilder(header);
        for (RuleFragment fragment : fragments) {
            for (String line : fragment.lines()) {
                sb.append('\n').append(line);
            }
        }
        return sb.toString();
    }
}
