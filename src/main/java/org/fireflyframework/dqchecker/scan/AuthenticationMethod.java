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

/**
 * Ways the scan engine can authenticate against the warehouse.
 */
public enum AuthenticationMethod {

    /**
     * Service principal through the SQL Server driver.
     */
    SQLSERVER_SERVICE_PRINCIPAL("sqlserver", "ActiveDirectoryServicePrincipal"),

    /**
     * Service principal through the Fabric driver.
     */
    FABRIC_SERVICE_PRINCIPAL("fabric", "activedirectoryserviceprincipal"),

    /**
     * Managed identity of the runtime executing the scan.
     */
    FABRIC_MANAGED_IDENTITY("fabric", "fabricspark"),

    /**
     * Integrated authentication through the SQL Server driver.
     */
    SQLSERVER_TRUSTED("sqlserver", null);

    private final String dataSourceType;
    private final String authentication;

    AuthenticationMethod(String dataSourceType, String authentication) {
        this.dataSourceType = dataSourceType;
        this.authentication = authentication;
    }

    public String getDataSourceType() {
        return dataSourceType;
    }

    public String getAuthentication() {
        return authentication;
    }

    public boolean usesServicePrincipal() {
        return this == SQLSERVER_SERVICE_PRINCIPAL || this == FABRIC_SERVICE_PRINCIPAL;
    }
}
