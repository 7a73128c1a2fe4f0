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

import com.fasterxml.jackson.annotation.JsonValue;
import org.tarik.autoheal.dto.RunStatus;

/**
 * Why the attempt loop stopped without a successful attempt, with the terminal run status each reason maps to.
 */
public enum StopReason {
    AUTO_HEAL_DISABLED("auto_heal_disabled", RunStatus.FAILED),
    ATTEMPT_LIMIT_EXHAUSTED("attempt_limit_exhausted", RunStatus.ATTEMPT_LIMIT_EXHAUSTED),
    UNRECOVERABLE("unrecoverable", RunStatus.UNRECOVERABLE),
    BUDGET_EXHAUSTED("budget_exhausted", RunStatus.BUDGET_EXHAUSTED),
    CANCELLED("cancelled", RunStatus.ABORTED),
    DEADLINE_EXCEEDED("deadline_exceeded", RunStatus.ABORTED),
    INTERNAL_ERROR("internal_error", RunStatus.FAILED);

    private final String value;
    private final RunStatus runStatus;

    StopReason(String value, RunStatus runStatus) {
        this.value = value;
        this.runStatus = runStatus;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public RunStatus runStatus() {
        return runStatus;
    }
}
