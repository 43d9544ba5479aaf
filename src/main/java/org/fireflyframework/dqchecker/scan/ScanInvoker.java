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

import org.fireflyframework.dqchecker.compiler.ExecutableSpec;
import reactor.core.publisher.Mono;

/**
 * Port to the external scan engine.
 *
 * <p>Implementations hand the compiled specification and connection to the engine and
 * report what it returned. An engine that ran but logged errors completes normally
 * with {@link ScanOutput#isHasErrors()} set; an engine that could not be reached (or
 * timed out) signals an error instead.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * public class NotebookScanInvoker implements ScanInvoker {
 *
 *     @Override
 *     public Mono<ScanOutput> invoke(ExecutableSpec spec, ConnectionDescriptor connection) {
 *         return notebookClient.runScan(spec.getText(), renderer.render(connection))
 *                 .map(run -> ScanOutput.builder()
 *                         .rawResults(run.results())
 *                         .rawLogs(run.logs())
 *                         .hasErrors(run.hasErrorLogs())
 *                         .build());
 *     }
 * }
 * }</pre>
 */
public interface ScanInvoker {

    /**
     * Runs a scan.
     *
     * @param spec       the compiled specification
     * @param connection where the engine should scan; not interpreted by the caller
     * @return a {@link Mono} emitting the engine's output
     */
    Mono<ScanOutput> invoke(ExecutableSpec spec, ConnectionDescriptor connection);
}
