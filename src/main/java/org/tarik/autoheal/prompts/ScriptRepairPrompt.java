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

public class ScriptRepairPrompt extends AbstractPrompt {
    private static final String SYSTEM_PROMPT_FOLDER = "script_synthesis";
    private static final String SYSTEM_PROMPT_FILE_NAME = "repair_prompt.txt";
    private static final String TASK_DESCRIPTION_PLACEHOLDER = "task_description";
    private static final String TARGET_URL_PLACEHOLDER = "target_url";
    private static final String PRIOR_SCRIPT_PLACEHOLDER = "prior_script";
    private static final String REPAIR_HINT_PLACEHOLDER = "repair_hint";
    private static final String NO_URL = "not specified";
    private static final String NO_PRIOR_SCRIPT = "(the previous attempt produced no script)";

    private ScriptRepairPrompt(Map<String, String> userMessagePlaceholders) {
        super(Map.of(), userMessagePlaceholders);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    protected String getUserMessageTemplate() {
        return """
                Task: {{task_description}}
                Target URL: {{target_url}}

                Script which failed:
                ```python
                {{prior_script}}
                ```

                Diagnosis of the failure:
                {{repair_hint}}""";
    }

    @Override
    protected String getSystemMessageTemplate() {
        return getSystemPromptFileContent(SYSTEM_PROMPT_FOLDER, SYSTEM_PROMPT_FILE_NAME);
    }

    public static class Builder {
        private String taskDescription;
        private String targetUrl;
        private String priorScript;
        private String repairHint;

        public Builder withTaskDescription(@NotNull String taskDescription) {
            this.taskDescription = taskDescription;
            return this;
        }

        public Builder withTargetUrl(@Nullable String targetUrl) {
            this.targetUrl = targetUrl;
            return this;
        }

        public Builder withPriorScript(@Nullable String priorScript) {
            this.priorScript = priorScript;
            return this;
        }

        public Builder withRepairHint(@NotNull String repairHint) {
            this.repairHint = repairHint;
            return this;
        }

        public ScriptRepairPrompt build() {
            checkArgument(isNotBlank(taskDescription), "Task description must be set");
            checkArgument(isNotBlank(repairHint), "Repair hint must be set");
            return new ScriptRepairPrompt(Map.of(
                    TASK_DESCRIPTION_PLACEHOLDER, taskDescription,
                    TARGET_URL_PLACEHOLDER, isNotBlank(targetUrl) ? targetUrl : NO_URL,
                    PRIOR_SCRIPT_PLACEHOLDER, isNotBlank(priorScript) ? priorScript : NO_PRIOR_SCRIPT,
                    REPAIR_HINT_PLACEHOLDER, repairHint));
        }
    }
}
