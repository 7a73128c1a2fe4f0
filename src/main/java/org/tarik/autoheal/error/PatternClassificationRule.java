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
import org.tarik.autoheal.dto.Diagnosis;
import org.tarik.autoheal.dto.ErrorSignal;
import org.tarik.autoheal.dto.ExecutionTrace;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.regex.Pattern.CASE_INSENSITIVE;
import static java.util.regex.Pattern.compile;
import static org.tarik.autoheal.utils.CommonUtils.abbreviate;

/**
 * Matches the error message of a failed trace against a list of patterns. The first pattern which matches decides
 * the evidence.
 */
public class PatternClassificationRule implements ClassificationRule {
    private static final int MAX_EVIDENCE_LENGTH = 300;
    private final String name;
    private final ErrorCategory category;
    private final List<Pattern> patterns;
    private final double confidence;
    private final String summary;
    private final String suggestedFix;

    public PatternClassificationRule(@NotNull String name, @NotNull ErrorCategory category,
                                     @NotNull List<String> regexes, double confidence, @NotNull String summary,
                                     @NotNull String suggestedFix) {
        checkArgument(!regexes.isEmpty(), "Rule '%s' needs at least one pattern", name);
        checkArgument(category != ErrorCategory.UNKNOWN, "Rule '%s' can't produce the fallback category", name);
        this.name = name;
        this.category = category;
        this.patterns = regexes.stream().map(regex -> compile(regex, CASE_INSENSITIVE)).toList();
        this.confidence = confidence;
        this.summary = summary;
        this.suggestedFix = suggestedFix;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<Diagnosis> classify(ExecutionTrace trace, long timeoutMillis) {
        var signal = trace.errorSignal();
        if (signal == null) {
            return Optional.empty();
        }
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(signal.message());
            if (matcher.find()) {
                return Optional.of(new Diagnosis(category, describe(signal), evidenceLine(signal.message(), matcher),
                        confidence, suggestedFix));
            }
        }
        return Optional.empty();
    }

    private String describe(ErrorSignal signal) {
        return signal.failingStepIndex() == null ? summary : "%s (step %d)".formatted(summary,
                signal.failingStepIndex());
    }

    static String evidenceLine(String message, Matcher matcher) {
        int lineStart = message.lastIndexOf('\n', matcher.start()) + 1;
        int lineEnd = message.indexOf('\n', matcher.end());
        var line = message.substring(lineStart, lineEnd < 0 ? message.length() : lineEnd).trim();
        return abbreviate(line, MAX_EVIDENCE_LENGTH);
    }
}
