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
package org.tarik.autoheal.dto;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.tarik.autoheal.exceptions.ConfigurationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

import static java.time.Instant.now;
import static org.tarik.autoheal.utils.CommonUtils.isBlank;

/**
 * Natural-language automation task together with the options of the run executing it.
 */
public record Task(@NotNull String id,
                   @NotNull String description,
                   @Nullable String url,
                   @NotNull TaskConfig config,
                   @NotNull Instant createdAt) {
    private static final Set<String> SUPPORTED_URL_SCHEMES = Set.of("http", "https");

    public static Task of(String description, @Nullable String url, TaskConfig config) {
        return new Task(UUID.randomUUID().toString(), description, url, config, now());
    }

    public static Task of(String description, @Nullable String url) {
        return of(description, url, TaskConfig.defaults());
    }

    /**
     * Rejects a task which can't start a run. Called before any cost is incurred.
     *
     * @throws ConfigurationException if the description is blank, the URL isn't an absolute http(s) URL or the
     *                                configuration is invalid
     */
    public void validate() {
        if (isBlank(id)) {
            throw new ConfigurationException("Task ID must not be blank");
        }
        if (isBlank(description)) {
            throw new ConfigurationException("Task description must not be blank");
        }
        if (url != null) {
            validateUrl(url);
        }
        if (config == null) {
            throw new ConfigurationException("Task configuration must be set");
        }
        config.validate();
    }

    private static void validateUrl(String url) {
        try {
            var uri = new URI(url.trim());
            if (!uri.isAbsolute() || uri.getScheme() == null
                    || !SUPPORTED_URL_SCHEMES.contains(uri.getScheme().toLowerCase()) || isBlank(uri.getHost())) {
                throw new ConfigurationException("Target URL must be an absolute http(s) URL, got '%s'".formatted(url));
            }
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Target URL '%s' is malformed: %s".formatted(url, e.getMessage()), e);
        }
    }
}
