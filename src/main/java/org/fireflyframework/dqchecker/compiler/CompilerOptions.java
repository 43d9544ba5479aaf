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

package org.fireflyframework.dqchecker.compiler;

import lombok.Builder;
import lombok.Value;

/**
 * Settings that influence the generated scan text. Passed explicitly to every
 * {@link ScanSpecCompiler#compile} call.
 */
@Value
@Builder
public class CompilerOptions {

    /**
     * Schema the scan engine's connection resolves unqualified tables against.
     */
    String defaultSchema;

    /**
     * When {@code true}, tables in {@link #defaultSchema} are written without a schema prefix.
     */
    boolean elideDefaultSchema;

    public static CompilerOptions defaults() {
        return CompilerOptions.builder().build();
    }

    public boolean elides(String schema) {
        return elideDefaultSchema && defaultSchema != null && defaultSchema.equals(schema);
    }
}
