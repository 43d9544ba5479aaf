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

package org.fireflyframework.dqchecker.ledger;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.fireflyframework.dqchecker.check.TableRef;

import java.util.Objects;

/**
 * Which checks an attempt runs: every enabled check of a suite, or of a single table.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CheckScope {

    public enum Kind {
        SUITE,
        TABLE
    }

    Kind kind;
    String suiteId;
    TableRef table;

    public static CheckScope suite(String suiteId) {
        Objects.requireNonNull(suiteId, "suiteId must not be null");
        return new CheckScope(Kind.SUITE, suiteId, null);
    }

    public static CheckScope table(TableRef table) {
        Objects.requireNonNull(table, "table must not be null");
        return new CheckScope(Kind.TABLE, null, table);
    }

    @Override
    public String toString() {
        return kind == Kind.SUITE ? "suite:" + suiteId : "table:" + table;
    }
}
