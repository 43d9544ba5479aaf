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

package org.fireflyframework.dqchecker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration for the data-quality checker.
 *
 * <pre>
 * firefly:
 *   dq-checker:
 *     enabled: true
 *     default-schema: dbo
 *     elide-default-schema: true
 *     invoke-timeout: 30m
 *     max-concurrent-scans: 4
 *     persist-concurrency: 1
 *     archive:
 *       enabled: true
 *       directory: /lakehouse/default/Files/dq_checker/executions
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "firefly.dq-checker")
public class DqCheckerProperties {

    private boolean enabled = true;

    /**
     * Schema the target connection resolves unqualified names against.
     */
    private String defaultSchema;

    /**
     * Omit {@link #defaultSchema} from table names in compiled specs.
     */
    private boolean elideDefaultSchema = false;

    /**
     * Upper bound on a single scan; a scan running longer fails its attempt.
     */
    private Duration invokeTimeout = Duration.ofMinutes(30);

    private int maxConcurrentScans = 4;

    /**
     * Result writes in flight per attempt.
     */
    private int persistConcurrency = 1;

    private Archive archive = new Archive();

    @Data
    public static class Archive {

        private boolean enabled = false;

        private String directory = "dq-checker/executions";
    }
}
