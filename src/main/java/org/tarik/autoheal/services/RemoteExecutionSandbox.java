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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.autoheal.AgentConfig;
import org.tarik.autoheal.exceptions.SandboxTimeoutException;
import org.tarik.autoheal.exceptions.ServiceException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;

import static java.lang.System.currentTimeMillis;
import static org.tarik.autoheal.exceptions.ServiceException.ServiceKind.EXECUTION;
import static org.tarik.autoheal.utils.CommonUtils.abbreviate;
import static org.tarik.autoheal.utils.JsonUtils.createObjectMapper;

/**
 * Execution sandbox reached over HTTP. The script is posted as JSON and the sandbox answers with the execution
 * outcome once the script finished.
 */
public class RemoteExecutionSandbox implements ExecutionSandbox {
    private static final Logger LOG = LoggerFactory.getLogger(RemoteExecutionSandbox.class);
    private static final Set<Integer> TIMEOUT_STATUS_CODES = Set.of(408, 504);
    private static final int MAX_LOGGED_BODY_LENGTH = 500;
    private final HttpClient httpClient;
    private final URI endpoint;
    private final long graceMillis;
    private final ObjectMapper mapper = createObjectMapper();

    public RemoteExecutionSandbox(@NotNull HttpClient httpClient, @NotNull URI endpoint, long graceMillis) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.graceMillis = graceMillis;
    }

    public static RemoteExecutionSandbox fromConfig() {
        var httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        return new RemoteExecutionSandbox(httpClient, URI.create(AgentConfig.getExecutionSandboxUrl()),
                AgentConfig.getExecutionGraceMillis());
    }

    @Override
    public SandboxResponse execute(@NotNull SandboxRequest request) {
        var httpRequest = HttpRequest.newBuilder(endpoint)
                .timeout(Duration.ofMillis(request.timeoutMs() + graceMillis))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(request)))
                .build();

        long start = currentTimeMillis();
        HttpResponse<String> httpResponse;
        try {
            httpResponse = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new SandboxTimeoutException("Sandbox didn't answer within %d ms".formatted(request.timeoutMs()),
                    currentTimeMillis() - start);
        } catch (IOException e) {
            throw new ServiceException("Couldn't reach the execution sandbox at %s".formatted(endpoint), EXECUTION, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceException("Interrupted while waiting for the execution sandbox", EXECUTION, e);
        }
        long elapsed = currentTimeMillis() - start;

        int statusCode = httpResponse.statusCode();
        if (TIMEOUT_STATUS_CODES.contains(statusCode)) {
            throw new SandboxTimeoutException("Sandbox reported a timeout with HTTP status %d".formatted(statusCode),
                    elapsed);
        }
        if (statusCode < 200 || statusCode >= 300) {
            throw new ServiceException("Sandbox answered with HTTP status %d: %s".formatted(statusCode,
                    abbreviate(httpResponse.body(), MAX_LOGGED_BODY_LENGTH)), EXECUTION);
        }

        var response = parse(httpResponse.body());
        if (response.status() == SandboxResponse.Status.TIMED_OUT) {
            throw new SandboxTimeoutException("Script execution timed out after %d ms".formatted(response.durationMs()),
                    response.durationMs());
        }
        LOG.debug("Sandbox finished the script with status '{}' in {} ms", response.status().value(),
                response.durationMs());
        return response;
    }

    private String toJson(SandboxRequest request) {
        var payload = mapper.createObjectNode()
                .put("script_code", request.scriptCode())
                .put("headless", request.headless())
                .put("browser_type", request.browserType().name().toLowerCase(Locale.ROOT))
                .put("timeout_ms", request.timeoutMs());
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ServiceException("Couldn't serialize the sandbox request", EXECUTION, e);
        }
    }

    private SandboxResponse parse(String body) {
        try {
            var response = mapper.readValue(body, SandboxResponse.class);
            if (response == null) {
                throw new ServiceException("Sandbox returned an empty body", EXECUTION);
            }
            return response;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ServiceException("Sandbox returned a malformed response: %s".formatted(
                    abbreviate(body, MAX_LOGGED_BODY_LENGTH)), EXECUTION, e);
        }
    }
}
