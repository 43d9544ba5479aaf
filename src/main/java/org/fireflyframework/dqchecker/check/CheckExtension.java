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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Kind-specific configuration attached to a {@link Check}.
 *
 * <p>Exactly one implementation belongs to each metric that needs extra data; the
 * mapping lives in {@link MetricType#getExtensionType()}.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FreshnessExtension.class, name = "freshness"),
        @JsonSubTypes.Type(value = SchemaExtension.class, name = "schema"),
        @JsonSubTypes.Type(value = ReferenceExtension.class, name = "reference"),
        @JsonSubTypes.Type(value = ScalarComparisonExtension.class, name = "scalar_comparison"),
        @JsonSubTypes.Type(value = SqlExtension.class, name = "sql")
})
public interface CheckExtension {
}
