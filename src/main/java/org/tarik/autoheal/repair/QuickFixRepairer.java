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
package org.tarik.autoheal.repair;

import org.jetbrains.annotations.NotNull;
import org.tarik.autoheal.dto.Diagnosis;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Rewrites a failed script without calling a paid service. Consulted before a repair is requested from the script
 * synthesis service, which is only called if no quick fix applies.
 */
public interface QuickFixRepairer {

    /**
     * @return the rewritten script, or empty if no rule applies or the rules would leave the script unchanged
     */
    Optional<QuickFix> tryFix(@NotNull String scriptCode, @NotNull Diagnosis diagnosis);

    static QuickFixRepairer none() {
        return (scriptCode, diagnosis) -> Optional.empty();
    }

    /**
     * @param code        rewritten script
     * @param description what was changed, logged and kept for the repair history
     */
    record QuickFix(@NotNull String code, @NotNull String description) {
        public QuickFix {
            checkArgument(code != null && !code.isBlank(), "Quick fix code must not be blank");
            description = description == null ? "" : description;
        }
    }
}
