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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.tarik.autoheal.dto.Attempt;
import org.tarik.autoheal.dto.RunResult;
import org.tarik.autoheal.dto.RunStatus;
import org.tarik.autoheal.dto.Task;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.math.BigDecimal.ZERO;
import static java.time.Instant.now;
import static java.util.Optional.ofNullable;

/**
 * A task with its append-only attempt history. Finalized exactly once, immutable afterwards.
 */
public class Run {
    private final Task task;
    private final List<Attempt> attempts = new ArrayList<>();
    private final Instant startedAt;
    private RunStatus finalStatus;
    private String stopReason;
    private Instant finishedAt;

    public Run(@NotNull Task task) {
        this.task = task;
        this.startedAt = now();
    }

    public synchronized void addAttempt(@NotNull Attempt attempt) {
        checkState(finalStatus == null, "Run of task '%s' is already finalized", task.id());
        checkArgument(attempt.ordinal() == attempts.size() + 1, "Expected attempt ordinal %s, got %s",
                attempts.size() + 1, attempt.ordinal());
        attempts.add(attempt);
    }

    public synchronized void finalizeRun(@NotNull RunStatus status, @Nullable String reason) {
        checkState(finalStatus == null, "Run of task '%s' is already finalized with status %s", task.id(),
                finalStatus);
        this.finalStatus = status;
        this.stopReason = reason;
        this.finishedAt = now();
    }

    public Task getTask() {
        return task;
    }

    public synchronized List<Attempt> getAttempts() {
        return Collections.unmodifiableList(new ArrayList<>(attempts));
    }

    public synchronized Optional<Attempt> getLastAttempt() {
        return attempts.isEmpty() ? Optional.empty() : Optional.of(attempts.get(attempts.size() - 1));
    }

    public synchronized int getNextOrdinal() {
        return attempts.size() + 1;
    }

    public synchronized BigDecimal getTotalCost() {
        return attempts.stream().map(Attempt::cost).reduce(ZERO, BigDecimal::add);
    }

    public synchronized Optional<RunStatus> getFinalStatus() {
        return ofNullable(finalStatus);
    }

    public synchronized boolean isFinalized() {
        return finalStatus != null;
    }

    public synchronized RunResult toResult() {
        checkState(finalStatus != null, "Run of task '%s' isn't finalized yet", task.id());
        var artifactHandles = attempts.stream()
                .flatMap(attempt -> attempt.trace().artifactHandles().stream())
                .toList();
        var summaries = attempts.stream().map(Attempt::toSummary).toList();
        return new RunResult(task.id(), task.description(), finalStatus, stopReason, getTotalCost(), summaries,
                artifactHandles, startedAt, finishedAt);
    }
}
