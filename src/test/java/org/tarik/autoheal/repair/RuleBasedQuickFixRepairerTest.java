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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tarik.autoheal.dto.Diagnosis;
import org.tarik.autoheal.error.ErrorCategory;

import static org.assertj.core.api.Assertions.assertThat;

class RuleBasedQuickFixRepairerTest {
    private final RuleBasedQuickFixRepairer repairer = new RuleBasedQuickFixRepairer();

    private static Diagnosis diagnosis(ErrorCategory category) {
        return new Diagnosis(category, "failed", "evidence", 0.9, "fix it");
    }

    @Test
    @DisplayName("A timeout adds a navigation timeout and an earlier load state to every page.goto call")
    void shouldExtendNavigationCallsOnTimeout() {
        // Given
        var script = """
                page.goto("https://example.com/login")
                page.fill("#user", "admin")
                page.goto(dashboard_url)
                """;

        // When
        var fix = repairer.tryFix(script, diagnosis(ErrorCategory.TIMEOUT));

        // Then
        assertThat(fix).isPresent();
        assertThat(fix.get().code()).isEqualTo("""
                page.goto("https://example.com/login", timeout=60000, wait_until='domcontentloaded')
                page.fill("#user", "admin")
                page.goto(dashboard_url, timeout=60000, wait_until='domcontentloaded')
                """);
        assertThat(fix.get().description()).contains("60000 ms").contains("domcontentloaded");
    }

    @Test
    @DisplayName("Only the missing keyword argument is added to a navigation call")
    void shouldKeepExistingNavigationTimeout() {
        // Given
        var script = "page.goto(url, timeout=90000)";

        // When
        var fix = repairer.tryFix(script, diagnosis(ErrorCategory.TIMEOUT));

        // Then
        assertThat(fix).isPresent();
        assertThat(fix.get().code()).isEqualTo("page.goto(url, timeout=90000, wait_until='domcontentloaded')");
    }

    @Test
    @DisplayName("A script whose navigation calls are already extended has no quick fix")
    void shouldNotFixAlreadyExtendedScript() {
        // Given
        var script = "page.goto(url, timeout=60000, wait_until='domcontentloaded')\npage.click('#go')";

        // When / Then
        assertThat(repairer.tryFix(script, diagnosis(ErrorCategory.TIMEOUT))).isEmpty();
    }

    @Test
    @DisplayName("A script without navigation has no quick fix for a timeout")
    void shouldNotFixScriptWithoutNavigation() {
        assertThat(repairer.tryFix("page.click('#submit')", diagnosis(ErrorCategory.TIMEOUT))).isEmpty();
    }

    @Test
    @DisplayName("Navigation with an options object or a nested call is left alone")
    void shouldSkipNonPythonOrNestedNavigation() {
        // Given
        var script = "await page.goto(url, { timeout: 5000 })\npage.goto(build_url(\"login\"))";

        // When / Then
        assertThat(repairer.tryFix(script, diagnosis(ErrorCategory.TIMEOUT))).isEmpty();
    }

    @Test
    @DisplayName("Failures other than timeouts are left to the synthesis service")
    void shouldNotFixOtherCategories() {
        // Given
        var script = "page.goto(\"https://example.com\")";

        // When / Then
        assertThat(repairer.tryFix(script, diagnosis(ErrorCategory.SELECTOR_NOT_FOUND))).isEmpty();
        assertThat(repairer.tryFix(script, diagnosis(ErrorCategory.NETWORK_ERROR))).isEmpty();
        assertThat(repairer.tryFix(script, diagnosis(ErrorCategory.UNKNOWN))).isEmpty();
    }

    @Test
    @DisplayName("The disabled repairer never fixes anything")
    void shouldNeverFixWithDisabledRepairer() {
        assertThat(QuickFixRepairer.none().tryFix("page.goto(url)", diagnosis(ErrorCategory.TIMEOUT))).isEmpty();
    }
}
