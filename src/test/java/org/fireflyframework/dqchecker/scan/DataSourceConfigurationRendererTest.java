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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DataSourceConfigurationRenderer}.
 */
class DataSourceConfigurationRendererTest {

    private DataSourceConfigurationRenderer renderer;

    @BeforeEach
    void setUp() {
        renderer = new DataSourceConfigurationRenderer();
    }

    private static ConnectionDescriptor.ConnectionDescriptorBuilder warehouse() {
        return ConnectionDescriptor.builder()
                .host("abc.datawarehouse.fabric.microsoft.com")
                .database("finance");
    }

    @Test
    void render_shouldWriteSqlServerServicePrincipal() {
        // Given
        ConnectionDescriptor connection = warehouse()
                .clientId("app-id")
                .clientSecret("s3cret")
                .build();

        // When
        String config = renderer.render(connection);

        // Then
        assertThat(config).isEqualTo(String.join("\n",
                "data_source fabric_dwh:",
                "  type: sqlserver",
                "  driver: ODBC Driver 18 for SQL Server",
                "  host: abc.datawarehouse.fabric.microsoft.com",
                "  port: '1433'",
                "  database: finance",
                "  authentication: ActiveDirectoryServicePrincipal",
                "  username: app-id",
                "  password: s3cret",
                "  encrypt: true",
                "  trust_server_certificate: false",
                ""));
    }

    @Test
    void render_shouldWriteManagedIdentityWithoutCredentials() {
        // Given
        ConnectionDescriptor connection = warehouse()
                .dataSourceName("lakehouse")
                .authentication(AuthenticationMethod.FABRIC_MANAGED_IDENTITY)
                .build();

        // When
        String config = renderer.render(connection);

        // Then
        assertThat(config)
                .startsWith("data_source lakehouse:\n  type: fabric\n")
                .contains("  authentication: fabricspark\n")
                .doesNotContain("port:")
                .doesNotContain("client_secret");
    }

    @Test
    void render_shouldWriteFabricServicePrincipalKeys() {
        // Given
        ConnectionDescriptor connection = warehouse()
                .authentication(AuthenticationMethod.FABRIC_SERVICE_PRINCIPAL)
                .clientId("app-id")
                .clientSecret("s3cret")
                .build();

        // When & Then
        assertThat(renderer.render(connection))
                .contains("  client_id: app-id\n", "  client_secret: s3cret\n")
                .doesNotContain("username:");
    }

    @Test
    void render_shouldWriteTrustedConnectionAndSortedExtras() {
        // Given
        ConnectionDescriptor connection = warehouse()
                .authentication(AuthenticationMethod.SQLSERVER_TRUSTED)
                .port(14330)
                .properties(Map.of("login_timeout", "30", "application_name", "dq-checker"))
                .build();

        // When
        String config = renderer.render(connection);

        // Then
        assertThat(config)
                .contains("  port: '14330'\n", "  trusted_connection: true\n")
                .endsWith("  application_name: dq-checker\n  login_timeout: 30\n");
    }

    @Test
    void render_shouldRequireServicePrincipalCredentials() {
        assertThatThrownBy(() -> renderer.render(warehouse().clientId("app-id").build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("clientSecret");
        assertThatThrownBy(() -> renderer.render(warehouse().host(" ").build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("host");
    }

    @Test
    void toString_shouldNotExposeSecret() {
        assertThat(warehouse().clientSecret("s3cret").build().toString()).doesNotContain("s3cret");
    }
}
