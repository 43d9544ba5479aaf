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

/**
 * Referential-integrity configuration: every non-null value of the check's column
 * must exist in {@code referenceTable.referenceColumn}.
 *
 * @param referenceTable  the referenced table, optionally schema-qualified
 * @param referenceColumn the referenced column
 * @param customSql       optional query returning the offending rows, replacing the generated one
 */
public record ReferenceExtension(String referenceTable, String referenceColumn, String customSql)
        implements CheckExtension {

    public ReferenceExtension(String referenceTable, String referenceColumn) {
        this(referenceTable, referenceColumn, null);
    }

    public boolean hasCustomSql() {
        return customSql != null && !customSql.isBlank();
    }
}
