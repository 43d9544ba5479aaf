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
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SodaText}.
 */
class SodaTextTest {

    @Test
    void identifier_shouldQuoteOnlyWhenNeeded() {
        assertThat(SodaText.identifier("orders")).isEqualTo("orders");
        assertThat(SodaText.identifier("order items")).isEqualTo("\"order items\"");
        assertThat(SodaText.identifier("order-items")).isEqualTo("\"order-items\"");
        assertThat(SodaText.identifier("2024_sales")).isEqualTo("\"2024_sales\"");
    }

    @Test
    void qualifiedTable_shouldOmitMissingSchema() {
        assertThat(SodaText.qualifiedTable(TableRef.of(null, "orders"), CompilerOptions.defaults()))
                .isEqualTo("orders");
    }

    @Test
    void value_shouldQuoteYamlSpecialCharacters() {
        assertThat(SodaText.value("amount > 0")).isEqualTo("\"amount > 0\"");
        assertThat(SodaText.value("region = 'EU'")).isEqualTo("region = 'EU'");
        assertThat(SodaText.value("a\nb")).isEqualTo("a b");
    }

    @Test
    void list_shouldRenderFlowList() {
        assertThat(SodaText.list(List.of("id", " created_at ", "a:b"))).isEqualTo("[id, created_at, \"a:b\"]");
    }

    @Test
    void number_shouldDropTrailingZeroFraction() {
        assertThat(SodaText.number(10.0)).isEqualTo("10");
        assertThat(SodaText.number(-3)).isEqualTo("-3");
        assertThat(SodaText.number(0.25)).isEqualTo("0.25");
        assertThat(SodaText.number(1000.5)).isEqualTo("1000.5");
    }

    @Test
    void metricIdentifier_shouldProduceSafeName() {
        assertThat(SodaText.metricIdentifier("Negative Amounts!", 9)).isEqualTo("negative_amounts");
        assertThat(SodaText.metricIdentifier("7 day avg", 1)).isEqualTo("check_7_day_avg");
        assertThat(SodaText.metricIdentifier("!!!", 4)).isEqualTo("check_4");
    }
}
