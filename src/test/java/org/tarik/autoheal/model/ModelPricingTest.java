/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
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
package org.tarik.autoheal.model;

import dev.langchain4j.model.output.TokenUsage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tarik.autoheal.exceptions.ConfigurationException;
import org.tarik.autoheal.model.ModelPricing.TokenPrice;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelPricingTest {
    private final ModelPricing pricing = new ModelPricing(Map.of(
            "cheap-model", TokenPrice.parse("0.15,0.60"),
            "expensive-model", TokenPrice.parse("30.00, 60.00")), "cheap-model");

    @Test
    @DisplayName("The cost is priced per million input and output tokens")
    void shouldPriceTokens() {
        assertThat(pricing.costOf("expensive-model", 2_000, 1_000)).isEqualByComparingTo("0.12");
        assertThat(pricing.costOf("cheap-model", new TokenUsage(1_000_000, 0))).isEqualByComparingTo("0.15");
    }

    @Test
    @DisplayName("A missing token usage costs nothing")
    void shouldTreatMissingUsageAsFree() {
        assertThat(pricing.costOf("cheap-model", (TokenUsage) null)).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("An unknown model is priced like the fallback model")
    void shouldUseFallbackPrice() {
        assertThat(pricing.priceOf("some/new-model")).isEqualTo(TokenPrice.parse("0.15,0.60"));
    }

    @Test
    @DisplayName("Without a fallback price the most expensive known price is used")
    void shouldUseMostExpensivePriceWithoutFallback() {
        // Given
        var pricingWithoutFallback = new ModelPricing(Map.of(
                "cheap-model", TokenPrice.parse("0.15,0.60"),
                "expensive-model", TokenPrice.parse("30.00,60.00")), "missing-model");

        // When / Then
        assertThat(pricingWithoutFallback.priceOf("other-model").inputPerMillion()).isEqualByComparingTo("30.00");
    }

    @Test
    @DisplayName("Malformed prices are configuration errors")
    void shouldRejectMalformedPrices() {
        assertThatThrownBy(() -> TokenPrice.parse("0.15")).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> TokenPrice.parse("abc,0.60")).isInstanceOf(ConfigurationException.class);
    }
}
