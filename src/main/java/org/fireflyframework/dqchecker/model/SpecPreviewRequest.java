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
import org.fireflyframework.dqchecker.check.Check;

import java.util.List;

/**
 * Request DTO for compiling checks without running them.
 */
@Value
@Builder
@Jacksonized
@Schema(description = "Checks to validate and compile")
public class SpecPreviewRequest {

    @Builder.Default
    @Schema(description = "Check definitions, in compile order")
    List<Check> checks = List.of();

    @Schema(description = "Reject the whole request when any check is invalid", example = "false")
    boolean strict;
}
