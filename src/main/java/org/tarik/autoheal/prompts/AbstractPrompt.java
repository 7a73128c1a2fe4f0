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

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.input.PromptTemplate;
import org.jetbrains.annotations.NotNull;
import org.tarik.autoheal.AgentConfig;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.Map;

import static java.lang.System.lineSeparator;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.stream.Collectors.joining;

public abstract class AbstractPrompt {
    private static final String SYSTEM_PROMPTS_ROOT_FOLDER = "prompt_templates/system";
    private final Map<String, Object> systemMessagePlaceholders;
    private final Map<String, Object> userMessagePlaceholders;

    protected AbstractPrompt(@NotNull Map<String, String> systemMessagePlaceholders,
                             @NotNull Map<String, String> userMessagePlaceholders) {
        this.systemMessagePlaceholders = Map.copyOf(systemMessagePlaceholders);
        this.userMessagePlaceholders = Map.copyOf(userMessagePlaceholders);
    }

    public UserMessage getUserMessage() {
        return UserMessage.from(PromptTemplate.from(getUserMessageTemplate()).apply(userMessagePlaceholders).text());
    }

    public SystemMessage getSystemMessage() {
        return SystemMessage.from(PromptTemplate.from(getSystemMessageTemplate()).apply(systemMessagePlaceholders)
                .text());
    }

    /**
     * Number of characters sent to the model, used to estimate the input token count before the call.
     */
    public int getLength() {
        return getSystemMessage().text().length() + getUserMessage().singleText().length();
    }

    protected abstract String getUserMessageTemplate();

    protected abstract String getSystemMessageTemplate();

    protected static String getPromptFileContent(String pathString) {
        URL resource = AbstractPrompt.class.getClassLoader().getResource(pathString);
        if (resource == null) {
            throw new UncheckedIOException(new IOException("Couldn't find the prompt file: %s".formatted(pathString)));
        }
        try (InputStreamReader reader = new InputStreamReader(resource.openStream(), UTF_8);
             BufferedReader bufferedReader = new BufferedReader(reader)) {
            return bufferedReader.lines().collect(joining(lineSeparator()));
        } catch (IOException e) {
            throw new UncheckedIOException("Couldn't read the contents of the prompt from the file %s"
                    .formatted(pathString), e);
        }
    }

    /**
     * Reads a system prompt of the configured prompt version, e.g.
     * {@code prompt_templates/system/script_synthesis/v1.0.0/generation_prompt.txt}.
     */
    protected static String getSystemPromptFileContent(String folder, String name) {
        return getPromptFileContent("%s/%s/%s/%s".formatted(SYSTEM_PROMPTS_ROOT_FOLDER, folder,
                AgentConfig.getSynthesisPromptVersion(), name));
    }
}
