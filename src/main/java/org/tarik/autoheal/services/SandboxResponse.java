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
package org.tarik.autoheal.services;

import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.tarik.autoheal.dto.ErrorSignal;
import org.tarik.autoheal.dto.ExecutionTrace;

import java.math.BigDecimal;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.math.BigDecimal.ZERO;

/**
 * Outcome reported by the execution sandbox.
 *
 * @param cost what the sandbox charged for the execution, zero if it doesn't charge
 */
public record SandboxResponse(@NotNull Status status,
                              @Nullable List<String> logs,
                              @Nullable List<String> artifactHandles,
                              long durationMs,
                              @Nullable ErrorSignal errorSignal,
                              @Nullable BigDecimal cost) {
    public SandboxResponse {
        checkArgument(status != null, "Sandbox response status must be set");
        checkArgument(durationMs >= 0, "Duration can't be negative: %s", durationMs);
        logs = logs == null ? List.of() : List.copyOf(logs);
        artifactHandles = artifactHandles == null ? List.of() : List.copyOf(artifactHandles);
        cost = cost == null ? ZERO : cost;
        checkArgument(cost.compareTo(ZERO) >= 0, "Execution cost can't be negative: %s", cost);
    }

    public static SandboxResponse success(List<String> logs, List<String> artifactHandles, long durationMs,
                                          BigDecimal cost) {
        return new SandboxResponse(Status.SUCCESS, logs, artifactHandles, durationMs, null, cost);
    }

    public static SandboxResponse failure(ErrorSignal errorSignal, List<String> logs, List<String> artifactHandles,
                                          long durationMs, BigDecimal cost) {
        return new SandboxResponse(Status.FAILURE, logs, artifactHandles, durationMs, errorSignal, cost);
    }

    public ExecutionTrace toTrace() {
        return status == Status.SUCCESS
                ? ExecutionTrace.success(logs, artifactHandles, durationMs)
                : ExecutionTrace.failure(errorSignal, logs, artifactHandles, durationMs);
    }

    public enum Status {
        SUCCESS("success"), FAILURE("failure"), TIMED_OUT("timed_out");

        private final String value;

        Status(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }
}
