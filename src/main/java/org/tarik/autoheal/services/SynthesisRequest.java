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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Request to the script synthesis service. A request with a repair hint asks for a repaired version of the prior
 * script, otherwise for a fresh one.
 */
public record SynthesisRequest(@NotNull String taskDescription,
                               @Nullable String targetUrl,
                               @Nullable String priorScript,
                               @Nullable String repairHint) {
    public SynthesisRequest {
        checkArgument(taskDescription != null && !taskDescription.isBlank(), "Task description must be set");
    }

    public static SynthesisRequest initial(String taskDescription, @Nullable String targetUrl) {
        return new SynthesisRequest(taskDescription, targetUrl, null, null);
    }

    public static SynthesisRequest repair(String taskDescription, @Nullable String targetUrl,
                                          @Nullable String priorScript, @NotNull String repairHint) {
        return new SynthesisRequest(taskDescription, targetUrl, priorScript, repairHint);
    }

    public boolean isRepair() {
        return repairHint != null;
    }
}
