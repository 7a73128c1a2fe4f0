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

import org.tarik.autoheal.dto.Diagnosis;
import org.tarik.autoheal.dto.ExecutionTrace;

import java.util.List;
import java.util.Optional;

/**
 * Classifies a failure as a timeout if its message reports one, or if the execution ran for at least the
 * configured timeout.
 */
public class TimeoutClassificationRule implements ClassificationRule {
    private static final String SUMMARY = "Operation exceeded its time limit";
    private static final String SUGGESTED_FIX = "Increase the timeout of the slow operation (e.g. timeout=60000); " +
            "wait for 'domcontentloaded' instead of 'networkidle' on heavy pages; wait for the specific element " +
            "the next step needs instead of fixed sleeps";
    private static final double CONFIDENCE = 0.85;
    private final PatternClassificationRule messageRule;

    public TimeoutClassificationRule(List<String> messagePatterns) {
        this.messageRule = new PatternClassificationRule("timeout-message", ErrorCategory.TIMEOUT, messagePatterns,
                CONFIDENCE, SUMMARY, SUGGESTED_FIX);
    }

    @Override
    public String name() {
        return "timeout";
    }

    @Override
    public Optional<Diagnosis> classify(ExecutionTrace trace, long timeoutMillis) {
        var byMessage = messageRule.classify(trace, timeoutMillis);
        if (byMessage.isPresent()) {
            return byMessage;
        }
        if (timeoutMillis > 0 && trace.durationMillis() >= timeoutMillis) {
            var evidence = "Execution ran for %d ms, configured timeout is %d ms".formatted(trace.durationMillis(),
                    timeoutMillis);
            return Optional.of(new Diagnosis(ErrorCategory.TIMEOUT, SUMMARY, evidence, CONFIDENCE, SUGGESTED_FIX));
        }
        return Optional.empty();
    }
}
