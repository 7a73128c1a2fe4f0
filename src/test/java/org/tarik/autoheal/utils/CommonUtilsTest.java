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
package org.tarik.autoheal.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tarik.autoheal.utils.CommonUtils.*;

class CommonUtilsTest {

    @Test
    @DisplayName("The longest fenced block is extracted from a model answer")
    void shouldExtractLongestCodeBlock() {
        // Given
        var answer = """
                First a helper:
                ```python
                x = 1
                ```
                And the script:
                ```python
                async def run_automation(page):
                    await page.goto("https://example.com")
                ```
                """;

        // When
        var code = extractCodeFromMarkdown(answer);

        // Then
        assertThat(code).startsWith("async def run_automation(page):").endsWith("await page.goto(\"https://example.com\")");
    }

    @Test
    @DisplayName("An answer without a fenced block is taken as code")
    void shouldReturnPlainAnswer() {
        assertThat(extractCodeFromMarkdown("  print('hi')\n")).isEqualTo("print('hi')");
        assertThat(extractCodeFromMarkdown(null)).isEmpty();
    }

    @Test
    @DisplayName("Numbers are parsed leniently")
    void shouldParseNumbers() {
        assertThat(parseStringAsInteger(" 42 ")).contains(42);
        assertThat(parseStringAsInteger("4x")).isEmpty();
        assertThat(parseStringAsDecimal("0.05")).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("0.05"));
        assertThat(parseStringAsDouble("")).isEmpty();
    }

    @Test
    @DisplayName("Long text is abbreviated to the given length")
    void shouldAbbreviate() {
        assertThat(abbreviate("abcdefghij", 6)).isEqualTo("abc...");
        assertThat(abbreviate("abc", 6)).isEqualTo("abc");
    }
}
