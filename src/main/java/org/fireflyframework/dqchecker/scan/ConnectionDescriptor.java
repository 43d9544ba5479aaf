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

package org.fireflyframework.dqchecker.scan;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Where a scan should run. The orchestrator passes it through to the
 * {@link ScanInvoker} untouched; {@link DataSourceConfigurationRenderer} turns it into
 * the engine's data-source configuration.
 */
@Value
@Builder
@Jacksonized
public class ConnectionDescriptor {

    @Builder.Default
    String dataSourceName = "fabric_dwh";

    String host;

    Integer port;

    String database;

    @Builder.Default
    AuthenticationMethod authentication = AuthenticationMethod.SQLSERVER_SERVICE_PRINCIPAL;

    /**
     * Service principal client id.
     */
    String clientId;

    @ToString.Exclude
    String clientSecret;

    /**
     * Additional engine-specific settings, rendered verbatim.
     */
    @Builder.Default
    Map<String, String> properties = Map.of();
}
