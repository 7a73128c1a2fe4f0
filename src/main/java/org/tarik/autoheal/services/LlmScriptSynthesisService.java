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
package org.tarik.autoheal.services;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.autoheal.AgentConfig;
import org.tarik.autoheal.error.RetryPolicy;
import org.tarik.autoheal.exceptions.ServiceException;
import org.tarik.autoheal.model.GenAiModel;
import org.tarik.autoheal.model.ModelFactory;
import org.tarik.autoheal.model.ModelPricing;
import org.tarik.autoheal.prompts.AbstractPrompt;
import org.tarik.autoheal.prompts.ScriptGenerationPrompt;
import org.tarik.autoheal.prompts.ScriptRepairPrompt;

import java.math.BigDecimal;

import static java.lang.System.currentTimeMillis;
import static org.tarik.autoheal.exceptions.ServiceException.ServiceKind.SYNTHESIS;
import static org.tarik.autoheal.utils.CommonUtils.extractCodeFromMarkdown;
import static org.tarik.autoheal.utils.CommonUtils.isBlank;
import static org.tarik.autoheal.utils.CommonUtils.sleepMillis;

/**
 * Script synthesis backed by a chat model. Failed calls are retried according to the retry policy. If the default
 * model keeps failing, the fallback model gets one more round before the request is given up.
 */
public class LlmScriptSynthesisService implements ScriptSynthesisService {
    private static final Logger LOG = LoggerFactory.getLogger(LlmScriptSynthesisService.class);
    private static final int CHARS_PER_TOKEN = 4;
    private final GenAiModel defaultModel;
    private final GenAiModel fallbackModel;
    private final ModelPricing pricing;
    private final RetryPolicy retryPolicy;
    private final int maxOutputTokens;
    private final double generationTemperature;
    private final double repairTemperature;

    public LlmScriptSynthesisService(@NotNull GenAiModel defaultModel, @Nullable GenAiModel fallbackModel,
                                     @NotNull ModelPricing pricing, @NotNull RetryPolicy retryPolicy,
                                     int maxOutputTokens, double generationTemperature, double repairTemperature) {
        this.defaultModel = defaultModel;
        this.fallbackModel = fallbackModel;
        this.pricing = pricing;
        this.retryPolicy = retryPolicy;
        this.maxOutputTokens = maxOutputTokens;
        this.generationTemperature = generationTemperature;
        this.repairTemperature = repairTemperature;
    }

    public static LlmScriptSynthesisService fromConfig() {
        var provider = AgentConfig.getModelProvider();
        var defaultModel = ModelFactory.getModel(AgentConfig.getDefaultModel(), provider);
        var fallbackModelName = AgentConfig.getFallbackModel();
        var fallbackModel = isBlank(fallbackModelName) || fallbackModelName.equals(AgentConfig.getDefaultModel())
                ? null
                : ModelFactory.getModel(fallbackModelName, provider);
        return new LlmScriptSynthesisService(defaultModel, fallbackModel, ModelPricing.fromConfig(),
                AgentConfig.getSynthesisRetryPolicy(), AgentConfig.getMaxOutputTokens(),
                AgentConfig.getGenerationTemperature(), AgentConfig.getRepairTemperature());
    }

    @Override
    public BigDecimal estimateCost(@NotNull SynthesisRequest request) {
        long inputTokens = (long) Math.ceil((double) buildPrompt(request).getLength() / CHARS_PER_TOKEN);
        return pricing.costOf(defaultModel.getModelName(), inputTokens, maxOutputTokens);
    }

    @Override
    public SynthesisResponse synthesize(@NotNull SynthesisRequest request) {
        var prompt = buildPrompt(request);
        var description = request.isRepair() ? "script repair" : "script generation";
        double temperature = request.isRepair() ? repairTemperature : generationTemperature;
        try {
            return synthesizeWithRetry(defaultModel, prompt, temperature, description);
        } catch (ServiceException e) {
            if (fallbackModel == null || Thread.currentThread().isInterrupted()) {
                throw e;
            }
            LOG.warn("Model '{}' failed the {}, switching to the fallback model '{}'", defaultModel.getModelName(),
                    description, fallbackModel.getModelName());
            return synthesizeWithRetry(fallbackModel, prompt, temperature, description);
        }
    }

    private SynthesisResponse synthesizeWithRetry(GenAiModel model, AbstractPrompt prompt, double temperature,
                                                  String description) {
        int attempt = 0;
        long startTime = currentTimeMillis();
        while (true) {
            attempt++;
            String failure;
            Exception cause = null;
            try {
                var response = model.generate(prompt, temperature, description);
                var code = extractCodeFromMarkdown(response.aiMessage().text());
                if (!isBlank(code)) {
                    var cost = pricing.costOf(model.getModelName(), response.tokenUsage());
                    return new SynthesisResponse(code, cost, model.getModelName());
                }
                failure = "Model returned no code";
            } catch (RuntimeException e) {
                failure = e.getMessage();
                cause = e;
            }

            long elapsedTime = currentTimeMillis() - startTime;
            boolean isTimeout = retryPolicy.timeoutMillis() > 0 && elapsedTime > retryPolicy.timeoutMillis();
            boolean isMaxRetriesReached = attempt > retryPolicy.maxRetries();
            if (isTimeout || isMaxRetriesReached || Thread.currentThread().isInterrupted()) {
                LOG.error("{} by '{}' failed after {} attempt(s) (elapsed: {}ms). Last error: {}", description,
                        model.getModelName(), attempt, elapsedTime, failure);
                throw new ServiceException("%s by model '%s' failed: %s".formatted(description, model.getModelName(),
                        failure), SYNTHESIS, cause);
            }

            long delayMillis = retryPolicy.delayBeforeRetry(attempt);
            LOG.warn("Attempt {} of {} by '{}' failed: {}. Retrying in {}ms...", attempt, description,
                    model.getModelName(), failure, delayMillis);
            try {
                sleepMillis(delayMillis);
            } catch (IllegalStateException e) {
                throw new ServiceException("Interrupted while waiting to retry the %s".formatted(description),
                        SYNTHESIS, e);
            }
        }
    }

    private static AbstractPrompt buildPrompt(SynthesisRequest request) {
        if (request.isRepair()) {
            return ScriptRepairPrompt.builder()
                    .withTaskDescription(request.taskDescription())
                    .withTargetUrl(request.targetUrl())
                    .withPriorScript(request.priorScript())
                    .withRepairHint(request.repairHint())
                    .build();
        }
        return ScriptGenerationPrompt.builder()
                .withTaskDescription(request.taskDescription())
                .withTargetUrl(request.targetUrl())
                .build();
    }
}
