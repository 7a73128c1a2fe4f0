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
package org.tarik.autoheal.model;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.autoheal.prompts.AbstractPrompt;

import java.time.Instant;

import static java.time.Duration.between;
import static java.time.Instant.now;
import static java.util.Objects.requireNonNull;

/**
 * A chat model together with the model ID it was created for. The ID is what pricing is looked up by, since
 * providers tend to report a more specific name in the response metadata.
 */
public class GenAiModel implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GenAiModel.class);
    private final String modelName;
    private final ChatModel chatModel;

    public GenAiModel(@NotNull String modelName, @NotNull ChatModel chatModel) {
        this.modelName = modelName;
        this.chatModel = chatModel;
    }

    public String getModelName() {
        return modelName;
    }

    public ChatResponse generate(@NotNull AbstractPrompt prompt, double temperature,
                                 @NotNull String generationDescription) {
        var start = now();
        var chatRequest = ChatRequest.builder()
                .messages(prompt.getSystemMessage(), prompt.getUserMessage())
                .parameters(ChatRequestParameters.builder().temperature(temperature).build())
                .build();
        var response = chatModel.chat(chatRequest);
        validateAndLogResponse(generationDescription, response, start);
        return response;
    }

    @Override
    public void close() {
        if (chatModel instanceof AutoCloseable closeableModel) {
            try {
                closeableModel.close();
            } catch (Exception e) {
                throw new RuntimeException(e);
            }
        }
    }

    private void validateAndLogResponse(String generationDescription, ChatResponse response, Instant start) {
        requireNonNull(response, "Model response can't be null");
        requireNonNull(response.aiMessage(), "Model response message can't be null");
        LOG.debug("Done content generation for {} by {} in {} millis", generationDescription, modelName,
                between(start, now()).toMillis());
    }
}
