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

import java.util.List;
import java.util.stream.Collectors;

/**
 * Compiled scan specification: an ordered sequence of table blocks.
 *
 * <p>Immutable. The rendered text is computed once and is byte-identical for identical
 * input, which is what gets stored on the execution attempt.</p>
 */
public final class ExecutableSpec {

    private static final ExecutableSpec EMPTY = new ExecutableSpec(List.of());

    private final List<TableBlock> blocks;
    private final String text;

    ExecutableSpec(List<TableBlock> blocks) {
        this.blocks = List.copyOf(blocks);
        this.text = this.blocks.isEmpty()
                ? ""
                : this.blocks.stream().map(TableBlock::render).collect(Collectors.joining("\n\n")) + "\n";
    }

    public static ExecutableSpec empty() {
        return EMPTY;
    }

    public List<TableBlock> getBlocks() {
        return blocks;
    }

    /**
     * Returns the scan text handed to the engine.
     *
     * @return the rendered specification, empty for a spec without blocks
     */
    public String getText() {
        return text;
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    public int getRuleCount() {
        return blocks.stream().mapToInt(block -> block.fragments().size()).sum();
    }

    public List<Long> getCheckIds() {
        return blocks.stream()
                .flatMap(block -> block.fragments().stream())
                .map(RuleFragment::checkId)
                .toList();
    }

    @Override
    public String toString() {
        return text;
    }
}
