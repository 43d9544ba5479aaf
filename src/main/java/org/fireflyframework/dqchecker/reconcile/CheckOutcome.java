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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of one check as reported by the scan engine.
 */
public enum CheckOutcome {

    PASS("pass"),
    FAIL("fail"),
    WARN("warn"),

    /**
     * The engine reported no outcome, or one this subsystem does not recognise.
     */
    UNKNOWN("unknown");

    private final String value;

    CheckOutcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Maps an engine outcome string, ignoring case and surrounding whitespace.
     *
     * @param value the engine's outcome, possibly {@code null}
     * @return the matching outcome, or {@link #UNKNOWN}
     */
    @JsonCreator
    public static CheckOutcome fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (CheckOutcome outcome : values()) {
            if (outcome.value.equals(normalized)) {
                return outcome;
            }
        }
        return UNKNOWN;
    }
}
