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

package org.fireflyframework.dqchecker.reconcile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dqchecker.compiler.CheckIdentityMarker;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Turns the scan engine's untyped output into {@link CheckResult}s.
 *
 * <p>This is the only place that reads engine output. Every field is optional and
 * has an explicit fallback:</p>
 * <ul>
 *   <li>check id: the identity marker in {@code name}, else {@code null}</li>
 *   <li>outcome: {@code outcome}, case-insensitive, else {@link CheckOutcome#UNKNOWN}</li>
 *   <li>measured value: {@code diagnostics.value}, else {@code value}, else {@code null}</li>
 *   <li>thresholds: the single value of the {@code diagnostics.fail} / {@code diagnostics.warn}
 *       maps (e.g. {@code {"greaterThan": 10}}), else {@code null}</li>
 * </ul>
 *
 * <p>Entries that are not objects, or that have no name, are skipped and reported as
 * warnings. Entries are never deduplicated: a marker appearing twice yields two
 * results.</p>
 */
@Slf4j
public class ScanResultReconciler {

    private final ObjectMapper objectMapper;

    public ScanResultReconciler() {
        this(new ObjectMapper());
    }

    public ScanResultReconciler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Reconciles engine output without attaching a run id.
     *
     * @param rawResults the engine output
     * @return the reconciled results
     */
    public Reconciliation reconcile(JsonNode rawResults) {
        return reconcile(null, rawResults);
    }

    /**
     * Reconciles engine output given as plain maps and lists, e.g. as returned by a
     * scripting bridge.
     *
     * @param runId      the attempt the results belong to
     * @param rawResults a {@link Map} with a {@code checks} list, or a list of entries
     * @return the reconciled results
     */
    public Reconciliation reconcile(String runId, Object rawResults) {
        if (rawResults instanceof JsonNode node) {
            return reconcile(runId, node);
        }
        return reconcile(runId, rawResults == null ? null : objectMapper.<JsonNode>valueToTree(rawResults));
    }

    /**
     * Reconciles engine output.
     *
     * @param runId      the attempt the results belong to
     * @param rawResults an object with a {@code checks} array, or an array of entries
     * @return the reconciled results, in engine order
     * @throws ScanResultFormatException if {@code rawResults} holds no list of entries
     */
    public Reconciliation reconcile(String runId, JsonNode rawResults) {
        JsonNode entries = entries(rawResults);
        List<CheckResult> results = new ArrayList<>(entries.size());
        List<String> warnings = new ArrayList<>();

        int index = 0;
        for (Iterator<JsonNode> it = entries.elements(); it.hasNext(); index++) {
            JsonNode entry = it.next();
            if (!entry.isObject()) {
                skip(warnings, "entry " + index + " is not an object (" + entry.getNodeType() + ")");
                continue;
            }
            String name = text(entry.get("name"));
            if (name == null || name.isBlank()) {
                skip(warnings, "entry " + index + " has no name");
                continue;
            }
            results.add(toResult(runId, name, entry));
        }

        Reconciliation reconciliation = new Reconciliation(results, warnings);
        log.debug("Reconciled {} result(s) for run {} ({} skipped, {} unresolved)",
                results.size(), runId, warnings.size(), reconciliation.getUnresolvedCount());
        return reconciliation;
    }

    private CheckResult toResult(String runId, String name, JsonNode entry) {
        Long checkId = CheckIdentityMarker.extract(name).orElse(null);
        if (checkId == null) {
            log.warn("Scan result '{}' carries no check id marker; recording it unresolved", name);
        }
        JsonNode diagnostics = entry.path("diagnostics");

        Double measured = number(diagnostics.get("value"));
        if (measured == null) {
            measured = number(entry.get("value"));
        }

        return CheckResult.builder()
                .runId(runId)
                .checkId(checkId)
                .checkName(name)
                .outcome(CheckOutcome.fromValue(text(entry.get("outcome"))))
                .measuredValue(measured)
                .failThreshold(threshold(diagnostics.get("fail")))
                .warnThreshold(threshold(diagnostics.get("warn")))
                .build();
    }

    private static JsonNode entries(JsonNode rawResults) {
        if (rawResults == null || rawResults.isNull() || rawResults.isMissingNode()) {
            throw new ScanResultFormatException("Scan output is missing");
        }
        if (rawResults.isArray()) {
            return rawResults;
        }
        if (rawResults.isObject()) {
            JsonNode checks = rawResults.get("checks");
            if (checks == null || checks.isNull()) {
                return JsonNodeFactory.instance.arrayNode();
            }
            if (checks.isArray()) {
                return checks;
            }
            throw new ScanResultFormatException("Scan output 'checks' is " + checks.getNodeType() + ", not a list");
        }
        throw new ScanResultFormatException("Scan output is " + rawResults.getNodeType() + ", not a list of checks");
    }

    private static void skip(List<String> warnings, String reason) {
        log.warn("Skipping scan result: {}", reason);
        warnings.add(reason);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }

    private static Double number(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return finite(node.doubleValue());
        }
        if (node.isTextual()) {
            try {
                return finite(Double.parseDouble(node.asText().trim()));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    // {"greaterThan": 10} or {">": 10}; the operator key is not checked
    private static Double threshold(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (!node.isObject()) {
            return number(node);
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Double value = number(it.next().getValue());
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static Double finite(double value) {
        return Double.isFinite(value) ? value : null;
    }
}
