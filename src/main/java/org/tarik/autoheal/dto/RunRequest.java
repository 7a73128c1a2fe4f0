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
package org.tarik.autoheal.dto;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.tarik.autoheal.AgentConfig.BrowserType;
import org.tarik.autoheal.exceptions.ConfigurationException;

import java.math.BigDecimal;
import java.util.Arrays;

import static java.util.Arrays.stream;

/**
 * Task submitted over HTTP. Options which are not set keep their configured defaults.
 */
public record RunRequest(@Nullable String description,
                         @Nullable String url,
                         @Nullable Boolean headless,
                         @Nullable String browserType,
                         @Nullable Long timeoutMs,
                         @Nullable Integer maxRepairAttempts,
                         @Nullable Boolean autoHeal,
                         @Nullable BigDecimal maxCostPerRun,
                         @Nullable Long runDeadlineMs) {

    public Task toTask(@NotNull TaskConfig defaults) {
        var config = defaults;
        if (headless != null) {
            config = config.withHeadless(headless);
        }
        if (browserType != null) {
            config = config.withBrowserType(parseBrowserType(browserType));
        }
        if (timeoutMs != null) {
            config = config.withTimeoutMillis(timeoutMs);
        }
        if (maxRepairAttempts != null) {
            config = config.withMaxRepairAttempts(maxRepairAttempts);
        }
        if (autoHeal != null) {
            config = config.withAutoHeal(autoHeal);
        }
        if (maxCostPerRun != null) {
            config = config.withMaxCostPerRun(maxCostPerRun);
        }
        if (runDeadlineMs != null) {
            config = config.withRunDeadlineMillis(runDeadlineMs);
        }
        return Task.of(description == null ? "" : description, url, config);
    }

    private static BrowserType parseBrowserType(String value) {
        return stream(BrowserType.values())
                .filter(type -> type.name().equalsIgnoreCase(value.trim()))
                .findAny()
                .orElseThrow(() -> new ConfigurationException("%s is not a supported browser type. Supported ones: %s"
                        .formatted(value, Arrays.toString(BrowserType.values()))));
    }
}
