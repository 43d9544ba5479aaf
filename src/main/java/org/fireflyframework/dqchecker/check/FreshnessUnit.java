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

package org.fireflyframework.dqchecker.check;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Time units for freshness thresholds, with the suffix the scan engine expects.
 */
public enum FreshnessUnit {

    SECOND("second", "s"),
    MINUTE("minute", "m"),
    HOUR("hour", "h"),
    DAY("day", "d");

    private final String value;
    private final String suffix;

    FreshnessUnit(String value, String suffix) {
        this.value = value;
        this.suffix = suffix;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getSuffix() {
        return suffix;
    }

    /**
     * Parses a unit name; plural forms ({@code hours}) are accepted.
     *
     * @param value the unit name
     * @return the matching unit
     */
    @JsonCreator
    public static FreshnessUnit fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Freshness unit must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith("s") && normalized.length() > 1) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        for (FreshnessUnit unit : values()) {
            if (unit.value.equals(normalized)) {
                return unit;
            }
        }
        throw new IllegalArgumentException("Unsupported freshness unit: " + value);
    }
}
