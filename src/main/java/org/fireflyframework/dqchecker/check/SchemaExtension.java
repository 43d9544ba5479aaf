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

package org.fireflyframework.dqchecker.check;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schema validation configuration.
 *
 * <p>Each violation category (required column missing, forbidden column present,
 * wrong column type) can be reported as a warning, a failure, or both. A category
 * with neither flag set is reported as a failure.</p>
 */
@Value
public class SchemaExtension implements CheckExtension {

    List<String> requiredColumns;
    List<String> forbiddenColumns;
    Map<String, String> columnTypes;

    boolean warnRequiredMissing;
    boolean failRequiredMissing;
    boolean warnForbiddenPresent;
    boolean failForbiddenPresent;
    boolean warnWrongType;
    boolean failWrongType;

    /**
     * Creates a schema configuration. Absent column collections are treated as empty.
     */
    @Builder
    @Jacksonized
    public SchemaExtension(List<String> requiredColumns,
                           List<String> forbiddenColumns,
                           Map<String, String> columnTypes,
                           boolean warnRequiredMissing,
                           boolean failRequiredMissing,
                           boolean warnForbiddenPresent,
                           boolean failForbiddenPresent,
                           boolean warnWrongType,
                           boolean failWrongType) {
        this.requiredColumns = copyOf(requiredColumns);
        this.forbiddenColumns = copyOf(forbiddenColumns);
        this.columnTypes = columnTypes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(columnTypes));
        this.warnRequiredMissing = warnRequiredMissing;
        this.failRequiredMissing = failRequiredMissing;
        this.warnForbiddenPresent = warnForbiddenPresent;
        this.failForbiddenPresent = failForbiddenPresent;
        this.warnWrongType = warnWrongType;
        this.failWrongType = failWrongType;
    }

    public boolean hasRules() {
        return !requiredColumns.isEmpty() || !forbiddenColumns.isEmpty() || !columnTypes.isEmpty();
    }

    // blank or null entries are kept so the validator can report them
    private static List<String> copyOf(List<String> columns) {
        return columns == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(columns));
    }
}
