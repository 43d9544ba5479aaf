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
import lombok.Data;
import org.fireflyframework.dqchecker.orchestration.SkippedCheck;

import java.util.List;

/**
 * Response DTO for the spec preview endpoint.
 *
 * <p><b>Example Response:</b></p>
 * <pre>{@code
 * {
 *   "spec": "checks for orders:\n  - row_count:\n      name: \"Orders present [check_id:1]\"\n      fail: when < 1\n",
 *   "ruleCount": 1,
 *   "tableCount": 1,
 *   "checkIds": [1],
 *   "skippedChecks": []
 * }
 * }</pre>
 */
@Data
@Builder
@Schema(description = "Compiled specification for a set of checks, without executing it")
public class SpecPreviewResponse {

    @Schema(description = "Specification text the scan engine would receive")
    private final String spec;

    @Schema(description = "Number of compiled rules", example = "3")
    private final int ruleCount;

    @Schema(description = "Number of table blocks", example = "1")
    private final int tableCount;

    @Schema(description = "Ids of the compiled checks, in spec order", example = "[1, 2, 3]")
    private final List<Long> checkIds;

    @Schema(description = "Checks left out because they failed validation")
    private final List<SkippedCheck> skippedChecks;
}
