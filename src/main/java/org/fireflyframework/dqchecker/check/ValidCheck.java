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

import java.util.Objects;

/**
 * A {@link Check} that satisfied every validation rule. Instances are only created by
 * {@link CheckValidator}, so holding one is proof the wrapped check is compilable.
 */
public final class ValidCheck {

    private final Check check;

    ValidCheck(Check check) {
        this.check = Objects.requireNonNull(check, "check must not be null");
    }

    public Check getCheck() {
        return check;
    }

    public long getId() {
        return check.getId();
    }

    public MetricType getMetric() {
        return check.getMetric();
    }

    public TableRef getTable() {
        return check.getTable();
    }

    /**
     * Narrows the extension payload to the type the metric requires.
     *
     * @param type the expected extension type
     * @param <E>  the extension type
     * @return the typed extension
     */
    public <E extends CheckExtension> E extension(Class<E> type) {
        return type.cast(check.getExtension());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ValidCheck other && check.equals(other.check);
    }

    @Override
    public int hashCode() {
        return check.hashCode();
    }

    @Override
    public String toString() {
        return "ValidCheck(" + check + ")";
    }
}
