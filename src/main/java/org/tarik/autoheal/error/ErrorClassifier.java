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
package org.tarik.autoheal.error;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.autoheal.dto.Diagnosis;
import org.tarik.autoheal.dto.ExecutionTrace;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static org.tarik.autoheal.utils.CommonUtils.abbreviate;
import static org.tarik.autoheal.utils.CommonUtils.isBlank;

/**
 * Maps a failed {@link ExecutionTrace} to a {@link Diagnosis} by applying an ordered list of rules. The first rule
 * which matches wins. If none matches, the diagnosis is {@link ErrorCategory#UNKNOWN} with zero confidence. The
 * same trace and timeout always produce the same diagnosis.
 */
public class ErrorClassifier {
    private static final Logger LOG = LoggerFactory.getLogger(ErrorClassifier.class);
    private static final int MAX_EVIDENCE_LENGTH = 300;
    private static final String UNKNOWN_FIX = "Re-read the task and regenerate the failing part of the script " +
            "from scratch using simpler, well-documented browser automation calls";
    private final List<ClassificationRule> rules;

    public ErrorClassifier() {
        this(ClassificationRules.defaults());
    }

    public ErrorClassifier(@NotNull List<ClassificationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * @param trace         failed trace
     * @param timeoutMillis per-attempt timeout the trace was executed with, used to recognize timeouts which left
     *                      no message behind
     */
    public Diagnosis classify(@NotNull ExecutionTrace trace, long timeoutMillis) {
        checkArgument(!trace.isSuccess(), "Only failed traces can be classified");
        for (ClassificationRule rule : rules) {
            Optional<Diagnosis> diagnosis = rule.classify(trace, timeoutMillis);
            if (diagnosis.isPresent()) {
                LOG.debug("Rule '{}' classified the failure as {}", rule.name(), diagnosis.get().category());
                return diagnosis.get();
            }
        }
        return unknown(trace);
    }

    private static Diagnosis unknown(ExecutionTrace trace) {
        var message = trace.errorSignal() == null ? "" : trace.errorSignal().message();
        var summary = isBlank(message) ? "Execution failed without an error message" : "Unclassified failure";
        return new Diagnosis(ErrorCategory.UNKNOWN, summary, abbreviate(message, MAX_EVIDENCE_LENGTH), 0.0,
                UNKNOWN_FIX);
    }
}
