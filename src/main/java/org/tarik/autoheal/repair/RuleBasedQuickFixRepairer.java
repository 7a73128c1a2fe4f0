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
import org.tarik.autoheal.dto.Diagnosis;
import org.tarik.autoheal.error.ErrorCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.regex.Pattern.compile;

/**
 * Quick fixes for Playwright for Python scripts. A timeout gets a longer navigation timeout and an earlier load
 * state on every {@code page.goto(...)} call which doesn't set them yet. Other categories need a model to be fixed.
 */
public class RuleBasedQuickFixRepairer implements QuickFixRepairer {
    private static final Logger LOG = LoggerFactory.getLogger(RuleBasedQuickFixRepairer.class);
    // arguments without nested parentheses, so that a call spanning a function call argument is left alone
    private static final Pattern GOTO_CALL = compile("page\\.goto\\(([^()\\n]*)\\)");
    static final long NAVIGATION_TIMEOUT_MILLIS = 60_000;
    static final String WAIT_UNTIL = "domcontentloaded";

    @Override
    public Optional<QuickFix> tryFix(@NotNull String scriptCode, @NotNull Diagnosis diagnosis) {
        if (diagnosis.category() != ErrorCategory.TIMEOUT) {
            return Optional.empty();
        }
        List<String> changes = new ArrayList<>();
        Matcher matcher = GOTO_CALL.matcher(scriptCode);
        StringBuilder fixed = new StringBuilder();
        while (matcher.find()) {
            var arguments = matcher.group(1);
            var replacement = matcher.group();
            // an options object means the script isn't Python
            if (!arguments.isBlank() && !arguments.contains("{")) {
                var extended = new StringBuilder(arguments.stripTrailing());
                if (!arguments.contains("timeout=")) {
                    extended.append(", timeout=").append(NAVIGATION_TIMEOUT_MILLIS);
                    addOnce(changes, "navigation timeout raised to %d ms".formatted(NAVIGATION_TIMEOUT_MILLIS));
                }
                if (!arguments.contains("wait_until=")) {
                    extended.append(", wait_until='").append(WAIT_UNTIL).append("'");
                    addOnce(changes, "navigation waits for '%s'".formatted(WAIT_UNTIL));
                }
                replacement = "page.goto(" + extended + ")";
            }
            matcher.appendReplacement(fixed, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(fixed);

        if (changes.isEmpty()) {
            return Optional.empty();
        }
        var description = String.join(", ", changes);
        LOG.info("Quick fix for a timeout: {}", description);
        return Optional.of(new QuickFix(fixed.toString(), description));
    }

    private static void addOnce(List<String> changes, String change) {
        if (!changes.contains(change)) {
            changes.add(change);
        }
    }
}
