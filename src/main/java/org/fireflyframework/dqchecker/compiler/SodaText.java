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

import org.fireflyframework.dqchecker.check.TableRef;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Formatting helpers for the scan engine's YAML-based check language.
 */
public final class SodaText {

    private static final Pattern NEEDS_IDENTIFIER_QUOTES = Pattern.compile("[\\s\\-]|^\\d");
    private static final Pattern NON_METRIC_CHARS = Pattern.compile("[^a-z0-9]+");
    private static final String SPECIAL_VALUE_CHARS = ":#{}[]&*!|>@`%";

    private SodaText() {
    }

    /**
     * Double-quotes an identifier containing whitespace or hyphens, or starting with a digit.
     *
     * @param identifier the table or column name
     * @return the identifier, quoted when needed
     */
    public static String identifier(String identifier) {
        String trimmed = identifier.trim();
        if (NEEDS_IDENTIFIER_QUOTES.matcher(trimmed).find()) {
            return "\"" + trimmed.replace("\"", "\"\"") + "\"";
        }
        return trimmed;
    }

    /**
     * Renders the table name used in block headers and generated queries.
     *
     * @param table   the table reference
     * @param options compiler options deciding default-schema elision
     * @return the possibly schema-qualified table name
     */
    public static String qualifiedTable(TableRef table, CompilerOptions options) {
        if (!table.hasSchema() || options.elides(table.schema())) {
            return identifier(table.table());
        }
        return identifier(table.schema()) + "." + identifier(table.table());
    }

    /**
     * Renders a double-quoted YAML scalar.
     *
     * @param value the raw string
     * @return the quoted, escaped value
     */
    public static String quoted(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    /**
     * Renders a single-line YAML value, quoting only when the value would otherwise
     * be misread.
     *
     * @param value the raw value
     * @return the value, safe to place after {@code key: }
     */
    public static String value(String value) {
        String trimmed = value.trim().replace("\r\n", " ").replace('\n', ' ');
        boolean needsQuotes = trimmed.startsWith("'") || trimmed.startsWith("\"")
                || trimmed.chars().anyMatch(c -> SPECIAL_VALUE_CHARS.indexOf(c) >= 0);
        return needsQuotes ? quoted(trimmed) : trimmed;
    }

    /**
     * Renders a flow-style YAML list, e.g. {@code [id, "created at"]}.
     *
     * @param items the list items
     * @return the rendered list
     */
    public static String list(List<String> items) {
        return items.stream()
                .map(String::trim)
                .map(item -> needsListQuotes(item) ? quoted(item) : item)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    /**
     * Formats a threshold number without a trailing {@code .0} for whole values.
     *
     * @param number a finite number
     * @return the plain decimal representation
     */
    public static String number(double number) {
        if (number == Math.rint(number) && Math.abs(number) < 1e15) {
            return Long.toString((long) number);
        }
        return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
    }

    /**
     * Derives a metric identifier for a user-defined SQL metric from its display name.
     *
     * @param displayName the check's display name
     * @param checkId     the check id, used when the name has no usable characters
     * @return a lower-case identifier of letters, digits and underscores
     */
    public static String metricIdentifier(String displayName, long checkId) {
        String identifier = NON_METRIC_CHARS.matcher(displayName.toLowerCase(Locale.ROOT)).replaceAll("_");
        identifier = identifier.replaceAll("^_+|_+$", "");
        if (identifier.isEmpty()) {
            return "check_" + checkId;
        }
        if (Character.isDigit(identifier.charAt(0))) {
            return "check_" + identifier;
        }
        return identifier;
    }

    /**
     * Indents every line of a multi-line text block.
     *
     * @param text   the text, possibly spanning several lines
     * @param indent the prefix for each line
     * @return one indented entry per non-trailing line
     */
    public static List<String> indentLines(String text, String indent) {
        return text.strip().lines()
                .map(line -> indent + line.stripTrailing())
                .toList();
    }

    /**
     * Collapses a multi-line query so it can be embedded inside another expression.
     *
     * @param query the query text
     * @return the query on a single line
     */
    public static String inline(String query) {
        return query.strip().lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.joining(" "));
    }

    private static boolean needsListQuotes(String item) {
        return item.isEmpty() || item.chars().anyMatch(c -> c == ',' || SPECIAL_VALUE_CHARS.indexOf(c) >= 0)
                || Character.isWhitespace(item.charAt(0));
    }
}
