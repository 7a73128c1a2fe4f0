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
package org.tarik.autoheal.orchestrator;

import org.jetbrains.annotations.NotNull;
import org.tarik.autoheal.dto.RunResult;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * A run executing in the background.
 */
public class RunHandle {
    private final String taskId;
    private final CompletableFuture<RunResult> result;
    private final CancellationToken cancellationToken;

    RunHandle(@NotNull String taskId, @NotNull CompletableFuture<RunResult> result,
              @NotNull CancellationToken cancellationToken) {
        this.taskId = taskId;
        this.result = result;
        this.cancellationToken = cancellationToken;
    }

    public String getTaskId() {
        return taskId;
    }

    /**
     * Asks the run to stop. The run aborts the call in flight and finishes with the aborted status.
     */
    public void cancel() {
        cancellationToken.cancel();
    }

    public boolean isDone() {
        return result.isDone();
    }

    public CompletableFuture<RunResult> getResult() {
        return result;
    }

    public RunResult await(@NotNull Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return result.get(timeout.toMillis(), MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run of task %s failed unexpectedly".formatted(taskId), e.getCause());
        }
    }
}
