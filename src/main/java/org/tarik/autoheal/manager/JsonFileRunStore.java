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
package org.tarik.autoheal.manager;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.autoheal.dto.RunResult;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkArgument;
import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static org.tarik.autoheal.utils.JsonUtils.createObjectMapper;

/**
 * Keeps each run result in {@code <root>/<task ID>/run_result.json}, next to the artifacts of the same run. Task IDs
 * are used as directory names, so only letters, digits, dots, dashes and underscores are accepted.
 */
public class JsonFileRunStore implements RunStore {
    private static final Logger LOG = LoggerFactory.getLogger(JsonFileRunStore.class);
    private static final Pattern TASK_ID = Pattern.compile("[A-Za-z0-9._-]+");
    static final String RESULT_FILE_NAME = "run_result.json";
    private final ObjectMapper mapper = createObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final Path rootDir;

    public JsonFileRunStore(@NotNull Path rootDir) {
        this.rootDir = rootDir;
    }

    @Override
    public void save(@NotNull RunResult result) {
        checkArgument(isValidTaskId(result.taskId()), "Task ID '%s' can't be used as a directory name",
                result.taskId());
        var file = resultFile(result.taskId());
        try {
            Files.createDirectories(file.getParent());
            var tempFile = file.resolveSibling(RESULT_FILE_NAME + ".tmp");
            mapper.writeValue(tempFile.toFile(), result);
            Files.move(tempFile, file, REPLACE_EXISTING, ATOMIC_MOVE);
            LOG.debug("Saved the result of task {} to {}", result.taskId(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Couldn't save the result of task %s to %s".formatted(
                    result.taskId(), file), e);
        }
    }

    @Override
    public Optional<RunResult> load(@NotNull String taskId) {
        if (!isValidTaskId(taskId)) {
            return Optional.empty();
        }
        var file = resultFile(taskId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), RunResult.class));
        } catch (JsonProcessingException e) {
            LOG.warn("Result file {} of task {} is corrupted", file, taskId, e);
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Couldn't read the result of task %s from %s".formatted(taskId, file), e);
        }
    }

    private Path resultFile(String taskId) {
        return rootDir.resolve(taskId).resolve(RESULT_FILE_NAME);
    }

    private static boolean isValidTaskId(String taskId) {
        return taskId != null && TASK_ID.matcher(taskId).matches() && !taskId.contains("..")
                && !taskId.equals(".");
    }
}
