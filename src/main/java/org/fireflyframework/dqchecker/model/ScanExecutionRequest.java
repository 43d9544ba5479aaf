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

package org.fireflyframework.dqchecker.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.fireflyframework.dqchecker.check.TableRef;
import org.fireflyframework.dqchecker.ledger.CheckScope;
import org.fireflyframework.dqchecker.scan.ConnectionDescriptor;

/**
 * Request DTO for running an execution attempt. Exactly one of {@code suiteId} and
 * {@code table} selects the checks.
 *
 * <p><b>Example Request:</b></p>
 * <pre>{@code
 * {
 *   "runId": "nightly-2026-10-17",
 *   "suiteId": "finance-core",
 *   "connection": {
 *     "host": "example.datawarehouse.fabric.microsoft.com",
 *     "database": "finance",
 *     "authentication": "SQLSERVER_SERVICE_PRINCIPAL",
 *     "clientId": "...",
 *     "clientSecret": "..."
 *   }
 * }
 * }</pre>
 */
@Value
@Builder
@Jacksonized
@Schema(description = "Scope and connection for a data-quality execution attempt")
public class ScanExecutionRequest {

    @Schema(description = "Correlation token; generated when absent", example = "nightly-2026-10-17")
    String runId;

    @Schema(description = "Suite whose enabled checks are run", example = "finance-core")
    String suiteId;

    @Schema(description = "Schema of the table whose checks are run", example = "dbo")
    String schema;

    @Schema(description = "Table whose checks are run", example = "orders")
    String table;

    @Schema(description = "Connection the scan engine uses")
    ConnectionDescriptor connection;

    /**
     * Resolves the requested scope.
     *
     * @return the scope
     * @throws IllegalArgumentException unless exactly one of suite and table is given
     */
    public CheckScope toScope() {
        boolean hasSuite = suiteId != null && !suiteId.isBlank();
        boolean hasTable = table != null && !table.isBlank();
        if (hasSuite == hasTable) {
            throw new IllegalArgumentException("Exactly one of suiteId or table must be given");
        }
        return hasSuite
                ? CheckScope.suite(suiteId.trim())
                : CheckScope.table(new TableRef(schema, table.trim()));
    }
}
