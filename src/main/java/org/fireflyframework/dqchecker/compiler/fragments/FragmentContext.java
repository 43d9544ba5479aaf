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

import org.fireflyframework.dqchecker.check.TableRef;
import org.fireflyframework.dqchecker.compiler.CompilerOptions;
import org.fireflyframework.dqchecker.compiler.SodaText;

/**
 * Per-table state available to a {@link FragmentWriter}.
 *
 * @param table          the table the enclosing block targets
 * @param qualifiedTable the table name as written in the block header
 * @param options        the compiler options
 */
public record FragmentContext(TableRef table, String qualifiedTable, CompilerOptions options) {

    public static FragmentContext of(TableRef table, CompilerOptions options) {
        return new FragmentContext(table, SodaText.qualifiedTable(table, options), options);
    }

    /**
     * Qualifies another table name the way block headers are qualified. Names that
     * already contain a schema are returned unchanged.
     *
     * @param tableName the table name, optionally schema-qualified
     * @return the table name as it should appear in generated SQL
     */
    public String qualify(String tableName) {
        String trimmed = tableName.trim();
        if (trimmed.contains(".")) {
            return trimmed;
        }
        return SodaText.qualifiedTable(TableRef.of(table.schema(), trimmed), options);
    }
}
