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
import org.tarik.autoheal.error.ErrorCategory;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Typed classification of a failed execution.
 *
 * @param category     failure category
 * @param summary      human-readable root cause
 * @param evidence     part of the trace the classification is based on
 * @param confidence   0.0 to 1.0
 * @param suggestedFix hint passed on to the repair request
 */
public record Diagnosis(@NotNull ErrorCategory category,
                        @NotNull String summary,
                        @NotNull String evidence,
                        double confidence,
                        @NotNull String suggestedFix) {
    public Diagnosis {
        checkArgument(category != null, "Diagnosis category must be set");
        checkArgument(confidence >= 0.0 && confidence <= 1.0, "Confidence must be within [0, 1], got %s", confidence);
        summary = summary == null ? "" : summary;
        evidence = evidence == null ? "" : evidence;
        suggestedFix = suggestedFix == null ? "" : suggestedFix;
    }

    public boolean isUnknown() {
        return category == ErrorCategory.UNKNOWN;
    }
}
