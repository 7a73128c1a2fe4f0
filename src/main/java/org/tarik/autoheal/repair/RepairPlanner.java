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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.autoheal.dto.Attempt;
import org.tarik.autoheal.dto.Diagnosis;
import org.tarik.autoheal.dto.TaskConfig;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Decides whether a failed run gets another, repaired attempt. The stop conditions are checked in a fixed order:
 * disabled auto-heal, an exhausted attempt limit, and a streak of unclassifiable failures. Any other failure is
 * retried with a hint built from the diagnosis and the recent history.
 */
public class RepairPlanner {
    private static final Logger LOG = LoggerFactory.getLogger(RepairPlanner.class);

    /**
     * @param history          attempts of the run so far, ending with the attempt the diagnosis belongs to
     * @param latestDiagnosis  diagnosis of the last attempt
     * @param config           options of the run
     */
    public RepairDecision plan(@NotNull List<Attempt> history, @NotNull Diagnosis latestDiagnosis,
                               @NotNull TaskConfig config) {
        checkArgument(!history.isEmpty(), "Repair can only be planned after at least one attempt");

        if (!config.autoHeal()) {
            LOG.warn("Auto-heal is disabled, not repairing the failed attempt");
            return RepairDecision.stop(StopReason.AUTO_HEAL_DISABLED, "Auto-heal is disabled");
        }

        int attemptLimit = config.maxRepairAttempts() + 1;
        if (history.size() >= attemptLimit) {
            LOG.warn("All {} attempt(s) used up", attemptLimit);
            return RepairDecision.stop(StopReason.ATTEMPT_LIMIT_EXHAUSTED,
                    "%d of %d allowed attempt(s) failed".formatted(history.size(), attemptLimit));
        }

        int unknownStreak = unknownStreak(history, latestDiagnosis);
        if (unknownStreak >= config.unknownStreakLimit()) {
            LOG.warn("{} consecutive unclassifiable failure(s), repairing won't converge", unknownStreak);
            return RepairDecision.stop(StopReason.UNRECOVERABLE,
                    "%d consecutive failure(s) of unknown category".formatted(unknownStreak));
        }

        var hint = new RepairHintBuilder(config.repairHistoryWindow()).build(history, latestDiagnosis);
        LOG.info("Planning repair of attempt {} for a {} failure", history.size(),
                latestDiagnosis.category().value());
        return RepairDecision.retry(hint);
    }

    private static int unknownStreak(List<Attempt> history, Diagnosis latestDiagnosis) {
        if (!latestDiagnosis.isUnknown()) {
            return 0;
        }
        int streak = 1;
        for (int i = history.size() - 2; i >= 0; i--) {
            var diagnosis = history.get(i).diagnosis();
            if (diagnosis == null || !diagnosis.isUnknown()) {
                break;
            }
            streak++;
        }
        return streak;
    }
}
