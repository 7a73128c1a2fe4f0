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

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.chat.response.ChatResponseMetadata;
import dev.langchain4j.model.output.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Optional.ofNullable;
import static org.tarik.autoheal.utils.CommonUtils.isNotBlank;

public class ChatModelEventListener implements ChatModelListener {
    private static final Logger log = LoggerFactory.getLogger(ChatModelEventListener.class);
    private static final String MESSAGE_SEPARATOR = "---------------------------------------------------------------------";

    @Override
    public void onRequest(ChatModelRequestContext requestContext) {
        requestContext.chatRequest().messages().forEach(ChatModelEventListener::logMessage);
    }

    @Override
    public void onResponse(ChatModelResponseContext responseContext) {
        var chatResponse = responseContext.chatResponse();
        var aiMessage = chatResponse.aiMessage();
        if (isNotBlank(aiMessage.text())) {
            logWithSeparator("Received model text response", aiMessage.text());
        }

        ChatResponseMetadata metadata = chatResponse.metadata();
        if (metadata != null) {
            var metadataInfo = "Model response meta: model name = '%s'".formatted(metadata.modelName());
            TokenUsage tokenUsage = metadata.tokenUsage();
            if (tokenUsage != null) {
                int input = ofNullable(tokenUsage.inputTokenCount()).orElse(0);
                int output = ofNullable(tokenUsage.outputTokenCount()).orElse(0);
                int total = ofNullable(tokenUsage.totalTokenCount()).orElse(0);
                metadataInfo = "%s, input tokens = %d, output tokens = %d, total tokens = %d"
                        .formatted(metadataInfo, input, output, total);
            }
            log.debug(metadataInfo);
        }
    }

    @Override
    public void onError(ChatModelErrorContext errorContext) {
        log.error("Model call failed", errorContext.error());
    }

    private static void logWithSeparator(String typeOfMessage, String content) {
        log.debug("{}:\n{}\n{}\n{}", typeOfMessage, MESSAGE_SEPARATOR, content, MESSAGE_SEPARATOR);
    }

    private static void logMessage(ChatMessage chatMessage) {
        if (chatMessage instanceof SystemMessage systemMessage) {
            logWithSeparator("Sending a System Message", systemMessage.text());
        } else if (chatMessage instanceof UserMessage userMessage) {
            userMessage.contents().forEach(content -> {
                if (content instanceof TextContent textContent) {
                    logWithSeparator("Sending a User Message with Text", textContent.text());
                } else {
                    log.debug("Sending a User Message with <{}> content type", content.type());
                }
            });
        }
    }
}
