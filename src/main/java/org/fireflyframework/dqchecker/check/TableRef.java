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

import java.util.Objects;

/**
 * Schema-qualified table a check runs against. Checks whose tables render to the same
 * name compile into the same table block.
 *
 * @param schema the schema name, may be {@code null} when the table is unqualified
 * @param table  the table name
 */
public record TableRef(String schema, String table) {

    public TableRef {
        Objects.requireNonNull(table, "table must not be null");
    }

    public static TableRef of(String schema, String table) {
        return new TableRef(schema, table);
    }

    public boolean hasSchema() {
        return schema != null && !schema.isBlank();
    }

    @Override
    public String toString() {
        return hasSchema() ? schema + "." + table : table;
    }
}
