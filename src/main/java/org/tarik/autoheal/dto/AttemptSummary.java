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

import org.jetbrains.annotations.Nullable;
import org.tarik.autoheal.dto.ExecutionTrace.TraceStatus;
import org.tarik.autoheal.error.ErrorCategory;

import java.math.BigDecimal;

/**
 * Consumer-facing view of an attempt.
 */
public record AttemptSummary(int ordinal,
                             @Nullable Integer scriptVersion,
                             TraceStatus status,
                             @Nullable ErrorCategory diagnosisCategory,
                             BigDecimal cost) {
}
