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

import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Outcome of running one script artifact.
 */
public record ExecutionTrace(@NotNull TraceStatus status,
                             @NotNull List<String> logs,
                             @NotNull List<String> artifactHandles,
                             long durationMillis,
                             @Nullable ErrorSignal errorSignal) {
    public ExecutionTrace {
        checkArgument(status != null, "Trace status must be set");
        checkArgument(durationMillis >= 0, "Duration can't be negative: %s", durationMillis);
        logs = logs == null ? List.of() : List.copyOf(logs);
        artifactHandles = artifactHandles == null ? List.of() : List.copyOf(artifactHandles);
        if (status == TraceStatus.FAILURE && errorSignal == null) {
            errorSignal = ErrorSignal.of("");
        }
    }

    public static ExecutionTrace success(List<String> logs, List<String> artifactHandles, long durationMillis) {
        return new ExecutionTrace(TraceStatus.SUCCESS, logs, artifactHandles, durationMillis, null);
    }

    public static ExecutionTrace failure(ErrorSignal errorSignal, List<String> logs, List<String> artifactHandles,
                                         long durationMillis) {
        return new ExecutionTrace(TraceStatus.FAILURE, logs, artifactHandles, durationMillis, errorSignal);
    }

    /**
     * Trace standing in for an execution which never produced one, e.g. because an external service faulted.
     */
    public static ExecutionTrace synthetic(String message, @Nullable String stackTrace, long durationMillis) {
        return new ExecutionTrace(TraceStatus.FAILURE, List.of(), List.of(), durationMillis,
                new ErrorSignal(message, stackTrace, null));
    }

    public boolean isSuccess() {
        return status == TraceStatus.SUCCESS;
    }

    public enum TraceStatus {
        SUCCESS("success"), FAILURE("failure");

        private final String value;

        TraceStatus(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }
}
