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
import org.tarik.autoheal.AgentConfig;
import org.tarik.autoheal.AgentConfig.BrowserType;
import org.tarik.autoheal.exceptions.ConfigurationException;

import java.math.BigDecimal;

import static java.math.BigDecimal.ZERO;

/**
 * Per-run options of a task. Immutable once the run starts.
 *
 * @param headless             whether the sandbox runs the browser headless
 * @param browserType          browser engine used by the sandbox
 * @param timeoutMillis        per-attempt execution timeout handed to the sandbox
 * @param maxRepairAttempts    number of repairs allowed after the initial attempt
 * @param autoHeal             whether failed attempts are repaired at all
 * @param maxCostPerRun        per-run spend ceiling
 * @param runDeadlineMillis    wall-clock bound of the whole run, independent of the per-attempt timeout
 * @param repairHistoryWindow  number of prior failing attempts summarized in a repair hint
 * @param unknownStreakLimit   consecutive unclassifiable failures after which the run stops (1 or 2)
 */
public record TaskConfig(boolean headless,
                         @NotNull BrowserType browserType,
                         long timeoutMillis,
                         int maxRepairAttempts,
                         boolean autoHeal,
                         @NotNull BigDecimal maxCostPerRun,
                         long runDeadlineMillis,
                         int repairHistoryWindow,
                         int unknownStreakLimit) {
    private static final int MAX_UNKNOWN_STREAK_LIMIT = 2;

    public static TaskConfig defaults() {
        return new TaskConfig(
                AgentConfig.isHeadless(),
                AgentConfig.getBrowserType(),
                AgentConfig.getDefaultTimeoutMillis(),
                AgentConfig.getMaxRepairAttempts(),
                AgentConfig.isAutoHeal(),
                AgentConfig.getMaxCostPerRun(),
                AgentConfig.getRunDeadlineMillis(),
                AgentConfig.getRepairHistoryWindow(),
                AgentConfig.getRepairUnknownStreakLimit());
    }

    public TaskConfig withHeadless(boolean headless) {
        return new TaskConfig(headless, browserType, timeoutMillis, maxRepairAttempts, autoHeal, maxCostPerRun,
                runDeadlineMillis, repairHistoryWindow, unknownStreakLimit);
    }

    public TaskConfig withBrowserType(BrowserType browserType) {
        return new TaskConfig(headless, browserType, timeoutMillis, maxRepairAttempts, autoHeal, maxCostPerRun,
                runDeadlineMillis, repairHistoryWindow, unknownStreakLimit);
    }

    public TaskConfig withTimeoutMillis(long timeoutMillis) {
        return new TaskConfig(headless, browserType, timeoutMillis, maxRepairAttempts, autoHeal, maxCostPerRun,
                runDeadlineMillis, repairHistoryWindow, unknownStreakLimit);
    }

    public TaskConfig withMaxRepairAttempts(int maxRepairAttempts) {
        return new TaskConfig(headless, browserType, timeoutMillis, maxRepairAttempts, autoHeal, maxCostPerRun,
                runDeadlineMillis, repairHistoryWindow, unknownStreakLimit);
    }

    public TaskConfig withAutoHeal(boolean autoHeal) {
        return new TaskConfig(headless, browserType, timeoutMillis, maxRepairAttempts, autoHeal, maxCostPerRun,
                runDeadlineMillis, repairHistoryWindow, unknownStreakLimit);
    }

    public TaskConfig withMaxCostPerRun(BigDecimal maxCostPerRun) {
        return new TaskConfig(headless, browserType, timeoutMillis, maxRepairAttempts, autoHeal, maxCostPerRun,
                runDeadlineMillis, repairHistoryWindow, unknownStreakLimit);
    }

    public TaskConfig withRunDeadlineMillis(long runDeadlineMillis) {
        return new TaskConfig(headless, browserType, timeoutMillis, maxRepairAttempts, autoHeal, maxCostPerRun,
                runDeadlineMillis, repairHistoryWindow, unknownStreakLimit);
    }

    /**
     * Checks the options and throws {@link ConfigurationException} naming the first invalid one.
     */
    public void validate() {
        if (browserType == null) {
            throw new ConfigurationException("Browser type must be set");
        }
        if (timeoutMillis <= 0) {
            throw new ConfigurationException("Timeout must be positive, got %d ms".formatted(timeoutMillis));
        }
        if (maxRepairAttempts < 0) {
            throw new ConfigurationException("Max repair attempts must not be negative, got %d"
                    .formatted(maxRepairAttempts));
        }
        if (maxCostPerRun == null || maxCostPerRun.compareTo(ZERO) <= 0) {
            throw new ConfigurationException("Max cost per run must be positive, got %s".formatted(maxCostPerRun));
        }
        if (runDeadlineMillis <= 0) {
            throw new ConfigurationException("Run deadline must be positive, got %d ms".formatted(runDeadlineMillis));
        }
        if (repairHistoryWindow < 0) {
            throw new ConfigurationException("Repair history window must not be negative, got %d"
                    .formatted(repairHistoryWindow));
        }
        if (unknownStreakLimit < 1 || unknownStreakLimit > MAX_UNKNOWN_STREAK_LIMIT) {
            throw new ConfigurationException("Unknown streak limit must be between 1 and %d, got %d"
                    .formatted(MAX_UNKNOWN_STREAK_LIMIT, unknownStreakLimit));
        }
    }
}
