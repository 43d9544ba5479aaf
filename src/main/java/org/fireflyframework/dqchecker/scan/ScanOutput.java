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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

/**
 * What the scan engine returned for one scan.
 */
@Value
@Builder
public class ScanOutput {

    /**
     * The engine's result document, untyped. Usually an object with a {@code checks} array.
     */
    JsonNode rawResults;

    String rawLogs;

    /**
     * Whether the engine logged errors while scanning, independent of check outcomes.
     */
    boolean hasErrors;

    /**
     * Error log excerpt, present when {@link #hasErrors} is set.
     */
    String errorLogs;
}
