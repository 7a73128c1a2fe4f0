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

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.tarik.autoheal.exceptions.ConfigurationException;

import java.util.List;

import static org.tarik.autoheal.AgentConfig.*;

public class ModelFactory {
    private static final int MAX_RETRIES = getModelMaxRetries();
    private static final int MAX_OUTPUT_TOKENS = getMaxOutputTokens();
    private static final double TEMPERATURE = getGenerationTemperature();
    private static final boolean LOG_MODEL_OUTPUTS = isModelLoggingEnabled();

    public static GenAiModel getModel(String modelName, ModelProvider modelProvider) {
        return switch (modelProvider) {
            case OPENROUTER, OPENAI -> new GenAiModel(modelName, getOpenAiCompatibleModel(modelName));
            case ANTHROPIC -> new GenAiModel(modelName, getAnthropicModel(modelName));
            case GOOGLE -> new GenAiModel(modelName, getGeminiModel(modelName));
        };
    }

    // OpenRouter exposes the OpenAI chat completions API, only the base URL differs
    private static ChatModel getOpenAiCompatibleModel(String modelName) {
        return OpenAiChatModel.builder()
                .baseUrl(getModelEndpoint())
                .apiKey(getApiKey())
                .modelName(modelName)
                .maxRetries(MAX_RETRIES)
                .maxTokens(MAX_OUTPUT_TOKENS)
                .temperature(TEMPERATURE)
                .logRequests(LOG_MODEL_OUTPUTS)
                .logResponses(LOG_MODEL_OUTPUTS)
                .listeners(List.of(new ChatModelEventListener()))
                .build();
    }

    private static ChatModel getAnthropicModel(String modelName) {
        return AnthropicChatModel.builder()
                .apiKey(getApiKey())
                .modelName(modelName)
                .maxRetries(MAX_RETRIES)
                .maxTokens(MAX_OUTPUT_TOKENS)
                .temperature(TEMPERATURE)
                .logRequests(LOG_MODEL_OUTPUTS)
                .logResponses(LOG_MODEL_OUTPUTS)
                .listeners(List.of(new ChatModelEventListener()))
                .build();
    }

    private static ChatModel getGeminiModel(String modelName) {
        return GoogleAiGeminiChatModel.builder()
                .apiKey(getApiKey())
                .modelName(modelName)
                .maxRetries(MAX_RETRIES)
                .maxOutputTokens(MAX_OUTPUT_TOKENS)
                .temperature(TEMPERATURE)
                .logRequestsAndResponses(LOG_MODEL_OUTPUTS)
                .listeners(List.of(new ChatModelEventListener()))
                .build();
    }

    private static String getApiKey() {
        String apiKey = getModelApiKey();
        if (apiKey.isBlank()) {
            throw new ConfigurationException("Model API key is missing, set MODEL_API_KEY");
        }
        return apiKey;
    }
}
