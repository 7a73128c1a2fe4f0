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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Outcome of {@link RepairPlanner#plan}: either another attempt with a repaired script, or the end of the run.
 */
public sealed interface RepairDecision permits RepairDecision.RetryWithRepair, RepairDecision.Stop {

    static RepairDecision retry(String hint) {
        return new RetryWithRepair(hint);
    }

    static RepairDecision stop(StopReason reason, String details) {
        return new Stop(reason, details);
    }

    boolean isRetry();

    record RetryWithRepair(@NotNull String hint) implements RepairDecision {
        public RetryWithRepair {
            checkArgument(hint != null && !hint.isBlank(), "Repair hint must not be blank");
        }

        @Override
        public boolean isRetry() {
            return true;
        }
    }

    record Stop(@NotNull StopReason reason, @NotNull String details) implements RepairDecision {
        public Stop {
            checkArgument(reason != null, "Stop reason must be set");
            details = details == null ? "" : details;
        }

        @Override
        public boolean isRetry() {
            return false;
        }
    }
}
