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

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders a {@link ConnectionDescriptor} as the scan engine's data-source
 * configuration block. Meant for {@link ScanInvoker} implementations.
 */
@Slf4j
public class DataSourceConfigurationRenderer {

    static final String DRIVER = "ODBC Driver 18 for SQL Server";
    static final int DEFAULT_PORT = 1433;

    /**
     * Renders the configuration.
     *
     * @param connection the connection to render
     * @return the configuration text
     * @throws IllegalArgumentException if the connection lacks a setting its authentication method needs
     */
    public String render(ConnectionDescriptor connection) {
        AuthenticationMethod method = connection.getAuthentication();
        require(connection.getHost(), "host");
        require(connection.getDatabase(), "database");
        if (method.usesServicePrincipal()) {
            require(connection.getClientId(), "clientId");
            require(connection.getClientSecret(), "clientSecret");
        }

        List<String> lines = new ArrayList<>();
        lines.add("data_source " + connection.getDataSourceName() + ":");
        lines.add("  type: " + method.getDataSourceType());
        lines.add("  driver: " + DRIVER);
        lines.add("  host: " + connection.getHost());
        if ("sqlserver".equals(method.getDataSourceType())) {
            int port = connection.getPort() != null ? connection.getPort() : DEFAULT_PORT;
            lines.add("  port: '" + port + "'");
        }
        lines.add("  database: " + connection.getDatabase());

        switch (method) {
            case SQLSERVER_SERVICE_PRINCIPAL -> {
                lines.add("  authentication: " + method.getAuthentication());
                lines.add("  username: " + connection.getClientId());
                lines.add("  password: " + connection.getClientSecret());
            }
            case FABRIC_SERVICE_PRINCIPAL -> {
                lines.add("  authentication: " + method.getAuthentication());
                lines.add("  client_id: " + connection.getClientId());
                lines.add("  client_secret: " + connection.getClientSecret());
            }
            case FABRIC_MANAGED_IDENTITY -> lines.add("  authentication: " + method.getAuthentication());
            case SQLSERVER_TRUSTED -> lines.add("  trusted_connection: true");
        }
        lines.add("  encrypt: true");
        if (method == AuthenticationMethod.SQLSERVER_SERVICE_PRINCIPAL) {
            lines.add("  trust_server_certificate: false");
        }

        Map<String, String> extra = new TreeMap<>(connection.getProperties());
        extra.forEach((key, value) -> lines.add("  " + key + ": " + value));

        log.debug("Rendered {} data source configuration for {}", method, connection.getDataSourceName());
        return String.join("\n", lines) + "\n";
    }

    private static void require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Connection " + field + " is required");
        }
    }
}
