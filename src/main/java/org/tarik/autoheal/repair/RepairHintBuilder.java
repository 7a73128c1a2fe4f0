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
import org.tarik.autoheal.dto.Attempt;
import org.tarik.autoheal.dto.Diagnosis;

import java.util.List;

import static org.tarik.autoheal.utils.CommonUtils.abbreviate;
import static org.tarik.autoheal.utils.CommonUtils.isNotBlank;

/**
 * Renders the repair hint handed to script synthesis: the latest diagnosis followed by a condensed list of the
 * failing attempts before it, so that the next script doesn't repeat a fix which already failed.
 */
public class RepairHintBuilder {
    private static final int MAX_SUMMARY_LENGTH = 160;
    private final int historyWindow;

    public RepairHintBuilder(int historyWindow) {
        this.historyWindow = Math.max(0, historyWindow);
    }

    /**
     * @param history attempts of the run, the last one being the attempt the diagnosis belongs to
     */
    public String build(@NotNull List<Attempt> history, @NotNull Diagnosis diagnosis) {
        StringBuilder sb = new StringBuilder();
        sb.append("Failure category: ").append(diagnosis.category().value()).append("\n");
        sb.append("Root cause: ").append(diagnosis.summary()).append("\n");
        if (isNotBlank(diagnosis.evidence())) {
            sb.append("Evidence: ").append(diagnosis.evidence()).append("\n");
        }
        if (isNotBlank(diagnosis.suggestedFix())) {
            sb.append("Suggested fix: ").append(diagnosis.suggestedFix()).append("\n");
        }

        var previousFailures = previousFailures(history);
        if (!previousFailures.isEmpty()) {
            sb.append("Earlier failed attempts, don't repeat their approach:\n");
            for (Attempt attempt : previousFailures) {
                sb.append("- Attempt ").append(attempt.ordinal());
                if (attempt.script() != null) {
                    sb.append(" (script v").append(attempt.script().version()).append(")");
                }
                if (attempt.diagnosis() != null) {
                    sb.append(": ").append(attempt.diagnosis().category().value()).append(" - ")
                            .append(abbreviate(attempt.diagnosis().summary(), MAX_SUMMARY_LENGTH));
                }
                sb.append("\n");
            }
        }
        return sb.toString().trim();
    }

    private List<Attempt> previousFailures(List<Attempt> history) {
        if (history.size() <= 1 || historyWindow == 0) {
            return List.of();
        }
        var earlier = history.subList(0, history.size() - 1).stream()
                .filter(attempt -> !attempt.isSuccess())
                .toList();
        return earlier.subList(Math.max(0, earlier.size() - historyWindow), earlier.size());
    }
}
