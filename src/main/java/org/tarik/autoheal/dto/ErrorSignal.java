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

/**
 * Raw failure information reported for a failed script execution.
 *
 * @param message          error message as reported by the browser tooling
 * @param stackTrace       optional stack-like trace
 * @param failingStepIndex optional index of the script step which failed
 */
public record ErrorSignal(@NotNull String message,
                          @Nullable String stackTrace,
                          @Nullable Integer failingStepIndex) {
    public ErrorSignal {
        message = message == null ? "" : message;
    }

    public static ErrorSignal of(String message) {
        return new ErrorSignal(message, null, null);
    }
}
