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
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.autoheal.AgentConfig;
import org.tarik.autoheal.exceptions.ConfigurationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static java.math.BigDecimal.ZERO;
import static java.util.Optional.ofNullable;
import static org.tarik.autoheal.utils.CommonUtils.parseStringAsDecimal;

/**
 * Token prices of the models, in dollars per million tokens. A model without its own entry is priced like the
 * fallback model, or like the most expensive known model if the fallback has no entry either.
 */
public class ModelPricing {
    private static final Logger LOG = LoggerFactory.getLogger(ModelPricing.class);
    private static final BigDecimal ONE_MILLION = BigDecimal.valueOf(1_000_000);
    private static final int COST_SCALE = 6;
    private final Map<String, TokenPrice> prices;
    private final String fallbackModel;

    public record TokenPrice(@NotNull BigDecimal inputPerMillion, @NotNull BigDecimal outputPerMillion) {
        public TokenPrice {
            checkArgument(inputPerMillion.compareTo(ZERO) >= 0 && outputPerMillion.compareTo(ZERO) >= 0,
                    "Token prices can't be negative");
        }

        /**
         * Parses {@code <input price>,<output price>}.
         */
        public static TokenPrice parse(String value) {
            var parts = value.split(",");
            if (parts.length != 2) {
                throw new ConfigurationException("Model price must have the format '<input>,<output>', got '%s'"
                        .formatted(value));
            }
            var input = parseStringAsDecimal(parts[0]);
            var output = parseStringAsDecimal(parts[1]);
            if (input.isEmpty() || output.isEmpty()) {
                throw new ConfigurationException("Model price '%s' contains an invalid number".formatted(value));
            }
            return new TokenPrice(input.get(), output.get());
        }
    }

    public ModelPricing(@NotNull Map<String, TokenPrice> prices, @NotNull String fallbackModel) {
        checkArgument(!prices.isEmpty(), "At least one model price must be configured");
        this.prices = Map.copyOf(prices);
        this.fallbackModel = fallbackModel;
    }

    public static ModelPricing fromConfig() {
        var prices = new HashMap<String, TokenPrice>();
        AgentConfig.getModelPricingEntries().forEach((model, value) -> prices.put(model, TokenPrice.parse(value)));
        return new ModelPricing(prices, AgentConfig.getFallbackModel());
    }

    public BigDecimal costOf(@NotNull String modelName, @Nullable TokenUsage tokenUsage) {
        if (tokenUsage == null) {
            LOG.warn("No token usage reported for model '{}', booking zero cost", modelName);
            return ZERO;
        }
        int input = ofNullable(tokenUsage.inputTokenCount()).orElse(0);
        int output = ofNullable(tokenUsage.outputTokenCount()).orElse(0);
        return costOf(modelName, input, output);
    }

    public BigDecimal costOf(@NotNull String modelName, long inputTokens, long outputTokens) {
        var price = priceOf(modelName);
        var total = price.inputPerMillion().multiply(BigDecimal.valueOf(inputTokens))
                .add(price.outputPerMillion().multiply(BigDecimal.valueOf(outputTokens)));
        return total.divide(ONE_MILLION, COST_SCALE, RoundingMode.HALF_UP);
    }

    public TokenPrice priceOf(@NotNull String modelName) {
        var price = prices.get(modelName);
        if (price != null) {
            return price;
        }
        var fallbackPrice = prices.get(fallbackModel);
        if (fallbackPrice != null) {
            LOG.debug("No price for model '{}', using the price of '{}'", modelName, fallbackModel);
            return fallbackPrice;
        }
        return prices.values().stream()
                .max(Comparator.comparing((TokenPrice p) -> p.inputPerMillion().add(p.outputPerMillion())))
                .orElseThrow();
    }
}
