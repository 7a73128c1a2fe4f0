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
 * Generated automation code. Version 1 is the initial script, every repair produces the next version.
 *
 * @param version         1-based, increasing with each repair
 * @param code            automation code
 * @param sourceDiagnosis diagnosis the repair was based on, null for the initial script
 * @param modelName       model which produced the code, or {@code quick-fix} for a rule-based rewrite
 * @param generationCost  actual cost of the synthesis call
 * @param generatedAt     creation time
 */
public record ScriptArtifact(int version,
                             @NotNull String code,
                             @Nullable Diagnosis sourceDiagnosis,
                             @NotNull String modelName,
                             @NotNull BigDecimal generationCost,
                             @NotNull Instant generatedAt) {
    public ScriptArtifact {
        checkArgument(version >= 1, "Script version starts at 1, got %s", version);
        checkArgument(code != null, "Script code must be set");
        checkArgument(generationCost != null && generationCost.compareTo(ZERO) >= 0,
                "Generation cost can't be negative: %s", generationCost);
    }

    public boolean isRepair() {
        return sourceDiagnosis != null;
    }
}
