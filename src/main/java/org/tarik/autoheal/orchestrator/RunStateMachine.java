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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkState;
import static org.tarik.autoheal.orchestrator.RunState.*;

/**
 * Tracks the state of one run and rejects transitions which are not in the transition table. Any non-terminal
 * state may move to {@link RunState#STOPPED}, since a run can be cancelled at any point.
 */
public class RunStateMachine {
    private static final Logger LOG = LoggerFactory.getLogger(RunStateMachine.class);
    private static final Map<RunState, Set<RunState>> TRANSITIONS = createTransitionTable();
    private final String runId;
    private final List<RunState> history = new ArrayList<>();
    private RunState current = INIT;

    public RunStateMachine(@NotNull String runId) {
        this.runId = runId;
        history.add(INIT);
    }

    private static Map<RunState, Set<RunState>> createTransitionTable() {
        Map<RunState, Set<RunState>> table = new EnumMap<>(RunState.class);
        table.put(INIT, EnumSet.of(GENERATING, STOPPED));
        // a synthesis fault skips execution and goes straight to diagnosis
        table.put(GENERATING, EnumSet.of(EXECUTING, DIAGNOSING, STOPPED));
        table.put(EXECUTING, EnumSet.of(SUCCEEDED, DIAGNOSING, STOPPED));
        table.put(DIAGNOSING, EnumSet.of(REPAIRING, STOPPED));
        table.put(REPAIRING, EnumSet.of(GENERATING, STOPPED));
        table.put(SUCCEEDED, EnumSet.noneOf(RunState.class));
        table.put(STOPPED, EnumSet.noneOf(RunState.class));
        return Collections.unmodifiableMap(table);
    }

    public static boolean isAllowed(RunState from, RunState to) {
        return TRANSITIONS.get(from).contains(to);
    }

    public synchronized void transitionTo(@NotNull RunState next) {
        checkState(isAllowed(current, next), "Run %s can't move from %s to %s", runId, current, next);
        LOG.debug("Run {}: {} -> {}", runId, current, next);
        current = next;
        history.add(next);
    }

    public synchronized RunState current() {
        return current;
    }

    public synchronized boolean isTerminal() {
        return current.isTerminal();
    }

    public synchronized List<RunState> getHistory() {
        return List.copyOf(history);
    }
}
