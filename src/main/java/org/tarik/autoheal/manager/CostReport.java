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
package org.tarik.autoheal.manager;

import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Snapshot of the daily spend.
 *
 * @param day                  calendar day the figures belong to
 * @param dailyCeiling         configured daily budget
 * @param spentToday           committed spend of the day
 * @param reserved             amount held by in-flight calls
 * @param remaining            budget left after the committed spend
 * @param sessionSpendBySource spend of this process by model or service
 */
public record CostReport(LocalDate day,
                         BigDecimal dailyCeiling,
                         BigDecimal spentToday,
                         BigDecimal reserved,
                         BigDecimal remaining,
                         Map<String, BigDecimal> sessionSpendBySource) {
    @Override
    public @NotNull String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("==================== API COST SUMMARY ====================\n");
        sb.append("Day: ").append(day).append("\n");
        sb.append("Today: $").append(spentToday.toPlainString()).append("\n");
        sb.append("Reserved: $").append(reserved.toPlainString()).append("\n");
        sb.append("Daily Limit: $").append(dailyCeiling.toPlainString()).append("\n");
        sb.append("Remaining: $").append(remaining.toPlainString()).append("\n");
        if (!sessionSpendBySource.isEmpty()) {
            sb.append("Cost by source:\n");
            sessionSpendBySource.forEach((source, cost) ->
                    sb.append("  ").append(source).append(": $").append(cost.toPlainString()).append("\n"));
        }
        sb.append("==========================================================");
        return sb.toString();
    }
}
