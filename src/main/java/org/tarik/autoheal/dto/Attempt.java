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

import static com.google.common.base.Preconditions.checkArgument;
import static java.math.BigDecimal.ZERO;

/**
 * One generate-execute-diagnose cycle of a run.
 *
 * @param ordinal   1-based position in the run history
 * @param script    script which was executed, null if script synthesis itself failed
 * @param trace     execution outcome, synthetic if an external service faulted
 * @param diagnosis classification of a failed trace, null on success
 * @param cost      money spent on generating and executing at this step
 */
public record Attempt(int ordinal,
                      @Nullable ScriptArtifact script,
                      @NotNull ExecutionTrace trace,
                      @Nullable Diagnosis diagnosis,
                      @NotNull BigDecimal cost,
                      @NotNull Instant startedAt,
                      @NotNull Instant finishedAt) {
    public Attempt {
        checkArgument(ordinal >= 1, "Attempt ordinals start at 1, got %s", ordinal);
        checkArgument(trace != null, "Attempt trace must be set");
        checkArgument(cost != null && cost.compareTo(ZERO) >= 0, "Attempt cost can't be negative: %s", cost);
        checkArgument(trace.isSuccess() || diagnosis != null, "A failed attempt must carry a diagnosis");
    }

    public boolean isSuccess() {
        return trace.isSuccess();
    }

    public AttemptSummary toSummary() {
        return new AttemptSummary(ordinal, script == null ? null : script.version(), trace.status(),
                diagnosis == null ? null : diagnosis.category(), cost);
    }
}
