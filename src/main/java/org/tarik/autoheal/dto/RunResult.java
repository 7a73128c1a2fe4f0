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

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Consumer-facing result of a finished run.
 */
public record RunResult(@NotNull String taskId,
                        @NotNull String taskDescription,
                        @NotNull RunStatus finalStatus,
                        @Nullable String stopReason,
                        @NotNull BigDecimal totalCost,
                        @NotNull List<AttemptSummary> attempts,
                        @NotNull List<String> artifactHandles,
                        @NotNull Instant startedAt,
                        @NotNull Instant finishedAt) {
    public RunResult {
        attempts = List.copyOf(attempts);
        artifactHandles = List.copyOf(artifactHandles);
    }

    public boolean succeeded() {
        return finalStatus == RunStatus.SUCCEEDED;
    }

    @Override
    public @NotNull String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("============================================================\n");
        sb.append("Task: ").append(taskDescription).append(" (").append(taskId).append(")\n");
        sb.append("Final Status: ").append(finalStatus.value()).append("\n");
        if (stopReason != null && !stopReason.isBlank()) {
            sb.append("Stop Reason: ").append(stopReason).append("\n");
        }
        sb.append("Total Cost: $").append(totalCost.toPlainString()).append("\n");
        sb.append("Start Time: ").append(startedAt).append("\n");
        sb.append("End Time: ").append(finishedAt).append("\n");
        sb.append("============================================================\n");
        sb.append("Attempts:\n");
        if (attempts.isEmpty()) {
            sb.append("  - No attempts were made.\n");
        } else {
            for (AttemptSummary attempt : attempts) {
                sb.append("\n[Attempt ").append(attempt.ordinal()).append("]\n");
                sb.append("  - Script Version: ")
                        .append(attempt.scriptVersion() != null ? "v" + attempt.scriptVersion() : "N/A").append("\n");
                sb.append("  - Status: ").append(attempt.status().value()).append("\n");
                if (attempt.diagnosisCategory() != null) {
                    sb.append("  - Diagnosis: ").append(attempt.diagnosisCategory().value()).append("\n");
                }
                sb.append("  - Cost: $").append(attempt.cost().toPlainString()).append("\n");
            }
        }
        sb.append("Artifacts: ").append(artifactHandles.size()).append("\n");
        sb.append("====================== End of Run ========================");
        return sb.toString();
    }
}
