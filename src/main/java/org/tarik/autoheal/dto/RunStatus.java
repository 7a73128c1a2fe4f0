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

/**
 * Terminal status of a run, explaining why the attempt loop stopped.
 */
public enum RunStatus {
    SUCCEEDED("succeeded"),
    FAILED("failed"),
    BUDGET_EXHAUSTED("budget_exhausted"),
    ATTEMPT_LIMIT_EXHAUSTED("attempt_limit_exhausted"),
    UNRECOVERABLE("unrecoverable"),
    ABORTED("aborted");

    private final String value;

    RunStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
