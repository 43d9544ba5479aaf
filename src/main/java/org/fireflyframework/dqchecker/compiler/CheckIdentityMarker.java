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

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Embeds a check id into a rule name and recovers it from scan output.
 *
 * <p>The scan engine echoes each rule's {@code name} back in its results but offers no
 * other channel for caller metadata, so the name carries the id as a trailing marker:
 * {@code "<display-name> [check_id:<id>]"}. The compiler and the reconciler both go
 * through this class; changing the format breaks every stored spec and must bump
 * {@link #FORMAT_VERSION}.</p>
 */
public final class CheckIdentityMarker {

    public static final int FORMAT_VERSION = 1;

    /**
     * Matches the marker anywhere in a name; group 1 is the id.
     */
    public static final Pattern PATTERN = Pattern.compile("\\[check_id:(\\d+)\\]");

    private CheckIdentityMarker() {
    }

    /**
     * Appends the identity marker to a display name.
     *
     * @param displayName the human-readable check name
     * @param checkId     the check id, non-negative
     * @return the marked name
     */
    public static String embed(String displayName, long checkId) {
        if (checkId < 0) {
            throw new IllegalArgumentException("Check id must not be negative: " + checkId);
        }
        return displayName + " [check_id:" + checkId + "]";
    }

    /**
     * Extracts the check id from a marked name. {@link #embed} appends its marker, so
     * when a display name already contains one the last marker wins.
     *
     * @param name the name reported by the scan engine, may be {@code null}
     * @return the id, or empty when the name carries no (parseable) marker
     */
    public static Optional<Long> extract(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Matcher matcher = PATTERN.matcher(name);
        String id = null;
        while (matcher.find()) {
            id = matcher.group(1);
        }
        if (id == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(id));
        } catch (NumberFormatException e) {
            // digits overflowing a long cannot be one of our ids
            return Optional.empty();
        }
    }
}
