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
package org.tarik.autoheal.prompts;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static org.tarik.autoheal.utils.CommonUtils.isNotBlank;

public class ScriptGenerationPrompt extends AbstractPrompt {
    private static final String SYSTEM_PROMPT_FOLDER = "script_synthesis";
    private static final String SYSTEM_PROMPT_FILE_NAME = "generation_prompt.txt";
    private static final String TASK_DESCRIPTION_PLACEHOLDER = "task_description";
    private static final String TARGET_URL_PLACEHOLDER = "target_url";
    private static final String NO_URL = "not specified, derive it from the task";

    private ScriptGenerationPrompt(Map<String, String> userMessagePlaceholders) {
        super(Map.of(), userMessagePlaceholders);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    protected String getUserMessageTemplate() {
        return """
                Task: {{task_description}}
                Target URL: {{target_url}}""";
    }

    @Override
    protected String getSystemMessageTemplate() {
        return getSystemPromptFileContent(SYSTEM_PROMPT_FOLDER, SYSTEM_PROMPT_FILE_NAME);
    }

    public static class Builder {
        private String taskDescription;
        private String targetUrl;

        public Builder withTaskDescription(@NotNull String taskDescription) {
            this.taskDescription = taskDescription;
            return this;
        }

        public Builder withTargetUrl(@Nullable String targetUrl) {
            this.targetUrl = targetUrl;
            return this;
        }

        public ScriptGenerationPrompt build() {
            checkArgument(isNotBlank(taskDescription), "Task description must be set");
            return new ScriptGenerationPrompt(Map.of(
                    TASK_DESCRIPTION_PLACEHOLDER, taskDescription,
                    TARGET_URL_PLACEHOLDER, isNotBlank(targetUrl) ? targetUrl : NO_URL));
        }
    }
}
