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
import org.tarik.autoheal.AgentConfig.BrowserType;

import static com.google.common.base.Preconditions.checkArgument;

public record SandboxRequest(@NotNull String scriptCode,
                             boolean headless,
                             @NotNull BrowserType browserType,
                             long timeoutMs) {
    public SandboxRequest {
        checkArgument(scriptCode != null && !scriptCode.isBlank(), "Script code must not be blank");
        checkArgument(timeoutMs > 0, "Timeout must be positive, got %s", timeoutMs);
    }
}
