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
package org.tarik.autoheal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.autoheal.dto.RunResult;
import org.tarik.autoheal.dto.Task;
import org.tarik.autoheal.error.ErrorClassifier;
import org.tarik.autoheal.manager.CostReport;
import org.tarik.autoheal.manager.DailySpendTracker;
import org.tarik.autoheal.manager.JsonFileRunStore;
import org.tarik.autoheal.manager.RunStore;
import org.tarik.autoheal.orchestrator.AutomationOrchestrator;
import org.tarik.autoheal.repair.QuickFixRepairer;
import org.tarik.autoheal.repair.RepairPlanner;
import org.tarik.autoheal.repair.RuleBasedQuickFixRepairer;
import org.tarik.autoheal.services.LlmScriptSynthesisService;
import org.tarik.autoheal.services.RemoteExecutionSandbox;

import java.util.Arrays;
import java.util.concurrent.Executors;

import static org.tarik.autoheal.AgentConfig.getExecutionGraceMillis;
import static org.tarik.autoheal.AgentConfig.getRunStoreDir;
import static org.tarik.autoheal.AgentConfig.isQuickFixesEnabled;

/**
 * Wires the configured services into one process-wide orchestrator. The daily spend tracker is created once, so
 * every run of the process shares the same daily budget.
 */
public class Agent {
    private static final Logger LOG = LoggerFactory.getLogger(Agent.class);
    private static DailySpendTracker dailySpendTracker;
    private static AutomationOrchestrator orchestrator;
    private static RunStore runStore;

    public static synchronized AutomationOrchestrator getOrchestrator() {
        if (orchestrator == null) {
            orchestrator = new AutomationOrchestrator(
                    LlmScriptSynthesisService.fromConfig(),
                    RemoteExecutionSandbox.fromConfig(),
                    new ErrorClassifier(),
                    new RepairPlanner(),
                    isQuickFixesEnabled() ? new RuleBasedQuickFixRepairer() : QuickFixRepairer.none(),
                    getDailySpendTracker(),
                    getRunStore(),
                    Executors.newCachedThreadPool(),
                    getExecutionGraceMillis());
            Runtime.getRuntime().addShutdownHook(new Thread(Agent::shutdown, "agent-shutdown"));
        }
        return orchestrator;
    }

    public static synchronized DailySpendTracker getDailySpendTracker() {
        if (dailySpendTracker == null) {
            dailySpendTracker = DailySpendTracker.fromConfig();
        }
        return dailySpendTracker;
    }

    public static synchronized RunStore getRunStore() {
        if (runStore == null) {
            runStore = new JsonFileRunStore(getRunStoreDir());
        }
        return runStore;
    }

    public static RunResult executeTask(Task task) {
        return getOrchestrator().execute(task);
    }

    public static CostReport getCostReport() {
        return getDailySpendTracker().getReport();
    }

    private static synchronized void shutdown() {
        if (orchestrator != null) {
            orchestrator.close();
        }
        if (dailySpendTracker != null) {
            LOG.info("Shutting down, {}", dailySpendTracker.getReport());
            dailySpendTracker.close();
        }
    }

    /**
     * Runs a single task from the command line: {@code <task description> [target URL]}.
     */
    public static void main(String[] args) {
        if (args.length == 0) {
            LOG.error("Usage: Agent <task description> [target URL]");
            System.exit(2);
        }
        var url = args.length > 1 ? args[args.length - 1] : null;
        var description = args.length > 1 ? String.join(" ", Arrays.copyOf(args, args.length - 1)) : args[0];
        var result = executeTask(Task.of(description, url));
        System.exit(result.succeeded() ? 0 : 1);
    }
}
