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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Map;
import java.util.TreeMap;

import static java.math.BigDecimal.ZERO;
import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Keeps the daily spend in a JSON file of the form {@code {"2025-06-01": 0.0421}}. The file is rewritten through a
 * temporary sibling and an atomic move, so a crash never leaves it half-written.
 */
public class JsonFileDailySpendStore implements DailySpendStore {
    private static final Logger LOG = LoggerFactory.getLogger(JsonFileDailySpendStore.class);
    private static final TypeReference<TreeMap<String, BigDecimal>> CONTENT_TYPE = new TypeReference<>() {
    };
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final Path file;

    public JsonFileDailySpendStore(@NotNull Path file) {
        this.file = file;
    }

    @Override
    public synchronized BigDecimal load(LocalDate day) {
        return readAll().getOrDefault(day.toString(), ZERO);
    }

    @Override
    public synchronized void save(LocalDate day, BigDecimal spent) {
        var content = readAll();
        content.put(day.toString(), spent);
        try {
            var parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            var tempFile = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writeValue(tempFile.toFile(), content);
            Files.move(tempFile, file, REPLACE_EXISTING, ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Couldn't save daily spend to %s".formatted(file), e);
        }
    }

    private Map<String, BigDecimal> readAll() {
        if (!Files.exists(file)) {
            return new TreeMap<>();
        }
        try {
            return mapper.readValue(file.toFile(), CONTENT_TYPE);
        } catch (JsonProcessingException e) {
            LOG.warn("Daily spend file {} is corrupted, starting from an empty history", file, e);
            return new TreeMap<>();
        } catch (IOException e) {
            throw new UncheckedIOException("Couldn't read daily spend from %s".formatted(file), e);
        }
    }
}
