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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tarik.autoheal.AgentConfig.BrowserType;
import org.tarik.autoheal.dto.AttemptSummary;
import org.tarik.autoheal.dto.ErrorSignal;
import org.tarik.autoheal.dto.RunResult;
import org.tarik.autoheal.dto.RunStatus;
import org.tarik.autoheal.dto.Task;
import org.tarik.autoheal.dto.TaskConfig;
import org.tarik.autoheal.error.ErrorClassifier;
import org.tarik.autoheal.exceptions.ConfigurationException;
import org.tarik.autoheal.exceptions.SandboxTimeoutException;
import org.tarik.autoheal.exceptions.ServiceException;
import org.tarik.autoheal.manager.DailySpendTracker;
import org.tarik.autoheal.manager.InMemoryDailySpendStore;
import org.tarik.autoheal.manager.InMemoryRunStore;
import org.tarik.autoheal.repair.RepairPlanner;
import org.tarik.autoheal.repair.RuleBasedQuickFixRepairer;
import org.tarik.autoheal.services.ExecutionSandbox;
import org.tarik.autoheal.services.SandboxRequest;
import org.tarik.autoheal.services.SandboxResponse;
import org.tarik.autoheal.services.ScriptSynthesisService;
import org.tarik.autoheal.services.SynthesisRequest;
import org.tarik.autoheal.services.SynthesisResponse;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static java.math.BigDecimal.ZERO;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.tarik.autoheal.error.ErrorCategory.*;
import static org.tarik.autoheal.exceptions.ServiceException.ServiceKind.EXECUTION;
import static org.tarik.autoheal.exceptions.ServiceException.ServiceKind.SYNTHESIS;

class AutomationOrchestratorTest {
    private static final BigDecimal GENERATION_COST = new BigDecimal("0.02");
    private static final BigDecimal EXECUTION_COST = new BigDecimal("0.01");
    private static final String SELECTOR_FAILURE = "TimeoutError: waiting for selector '#submit' failed";

    private ScriptedSynthesisService synthesisService;
    private ScriptedSandbox sandbox;
    private DailySpendTracker dailySpendTracker;
    private InMemoryRunStore runStore;
    private ExecutorService executor;
    private AutomationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        synthesisService = new ScriptedSynthesisService();
        sandbox = new ScriptedSandbox();
        dailySpendTracker = new DailySpendTracker(new InMemoryDailySpendStore(), new BigDecimal("100.00"),
                ZoneOffset.UTC, Clock.systemUTC());
        runStore = new InMemoryRunStore();
        executor = Executors.newCachedThreadPool();
        orchestrator = orchestrator(dailySpendTracker);
    }

    private AutomationOrchestrator orchestrator(DailySpendTracker tracker) {
        return new AutomationOrchestrator(synthesisService, sandbox, new ErrorClassifier(), new RepairPlanner(),
                new RuleBasedQuickFixRepairer(), tracker, runStore, executor, 50);
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
    }

    private static TaskConfig config(int maxRepairAttempts) {
        return new TaskConfig(true, BrowserType.CHROMIUM, 5_000, maxRepairAttempts, true, new BigDecimal("1.00"),
                60_000, 2, 2);
    }

    private static Task task(TaskConfig config) {
        return Task.of("Log in and open the dashboard", "https://example.com/login", config);
    }

    private static SandboxResponse success() {
        return SandboxResponse.success(List.of("done"), List.of("screenshot-1.png"), 120, EXECUTION_COST);
    }

    private static SandboxResponse failure(String message) {
        return SandboxResponse.failure(ErrorSignal.of(message), List.of(), List.of(), 80, EXECUTION_COST);
    }

    private static void assertCostsAddUp(RunResult result) {
        var sum = result.attempts().stream().map(AttemptSummary::cost).reduce(ZERO, BigDecimal::add);
        assertThat(result.totalCost()).isEqualByComparingTo(sum);
        for (int i = 0; i < result.attempts().size(); i++) {
            assertThat(result.attempts().get(i).ordinal()).isEqualTo(i + 1);
        }
    }

    @Test
    @DisplayName("A task succeeding on the first execution costs one generation and one execution")
    void shouldSucceedOnFirstAttempt() {
        // Given
        sandbox.then(AutomationOrchestratorTest::success);

        // When
        var result = orchestrator.execute(task(config(3)));

        // Then
        assertThat(result.finalStatus()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(result.stopReason()).isNull();
        assertThat(result.attempts()).hasSize(1);
        assertThat(result.attempts().get(0).scriptVersion()).isEqualTo(1);
        assertThat(result.attempts().get(0).diagnosisCategory()).isNull();
        assertThat(result.totalCost()).isEqualByComparingTo("0.03");
        assertThat(result.artifactHandles()).containsExactly("screenshot-1.png");
        assertThat(dailySpendTracker.getSpentToday()).isEqualByComparingTo("0.03");
        assertThat(dailySpendTracker.getReserved()).isEqualByComparingTo("0");
        assertThat(dailySpendTracker.getReport().sessionSpendBySource())
                .containsKeys("test-model", "execution-sandbox");
        assertThat(runStore.load(result.taskId())).contains(result);
    }

    @Test
    @DisplayName("A selector failure is repaired and the second script version succeeds")
    void shouldRepairSelectorFailure() {
        // Given
        sandbox.then(() -> failure(SELECTOR_FAILURE)).then(AutomationOrchestratorTest::success);

        // When
        var result = orchestrator.execute(task(config(3)));

        // Then
        assertThat(result.finalStatus()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(result.attempts()).hasSize(2);
        assertThat(result.attempts().get(0).diagnosisCategory()).isEqualTo(SELECTOR_NOT_FOUND);
        assertThat(result.attempts().get(1).scriptVersion()).isEqualTo(2);
        assertThat(result.totalCost()).isEqualByComparingTo("0.06");
        assertCostsAddUp(result);

        var repairRequest = synthesisService.requests.get(1);
        assertThat(repairRequest.isRepair()).isTrue();
        assertThat(repairRequest.priorScript()).isEqualTo("script 1");
        assertThat(repairRequest.repairHint()).contains("selector_not_found").contains("#submit");
        assertThat(sandbox.requests.get(1).scriptCode()).isEqualTo("script 2");
    }

    @Test
    @DisplayName("Four classifiable failures exhaust three repairs")
    void shouldStopWhenAttemptLimitIsReached() {
        // Given
        sandbox.then(() -> failure(SELECTOR_FAILURE))
                .then(() -> failure("net::ERR_CONNECTION_REFUSED at https://example.com/login"))
                .then(() -> failure("AssertionError: expected 'Dashboard' but got 'Login'"))
                .then(() -> failure("TypeError: page.clickk is not a function"));

        // When
        var result = orchestrator.execute(task(config(3)));

        // Then
        assertThat(result.finalStatus()).isEqualTo(RunStatus.ATTEMPT_LIMIT_EXHAUSTED);
        assertThat(result.attempts()).extracting(AttemptSummary::diagnosisCategory)
                .containsExactly(SELECTOR_NOT_FOUND, NETWORK_ERROR, ASSERTION_FAILURE, SCRIPT_RUNTIME_ERROR);
        assertThat(result.attempts()).extracting(AttemptSummary::scriptVersion).containsExactly(1, 2, 3, 4);
        assertThat(result.stopReason()).startsWith("attempt_limit_exhausted");
        assertCostsAddUp(result);
    }

    @Test
    @DisplayName("A second reservation exceeding the run ceiling stops the run after the first attempt")
    void shouldStopWhenRunBudgetIsExhausted() {
        // Given
        synthesisService.estimate = new BigDecimal("0.03");
        synthesisService.cost = new BigDecimal("0.03");
        sandbox.executionCost = ZERO;
        sandbox.then(() -> failure(SELECTOR_FAILURE));
        var config = config(3).withMaxCostPerRun(new BigDecimal("0.05"));

        // When
        var result = orchestrator.execute(task(config));

        // Then
        assertThat(result.finalStatus()).isEqualTo(RunStatus.BUDGET_EXHAUSTED);
        assertThat(result.attempts()).hasSize(1);
        assertThat(result.totalCost()).isEqualByComparingTo("0.03");
        assertThat(synthesisService.requests).hasSize(1);
        assertThat(dailySpendTracker.getReserved()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("A first reservation exceeding the run ceiling ends the run without attempts")
    void shouldNotCreateAttemptWhenFirstReservationIsDenied() {
        // Given
        synthesisService.estimate = new BigDecimal("2.00");

        // When
        var result = orchestrator.execute(task(config(3)));

        // Then
        assertThat(result.finalStatus()).isEqualTo(RunStatus.BUDGET_EXHAUSTED);
        assertThat(result.attempts()).isEmpty();
        assertThat(result.totalCost()).isEqualByComparingTo("0");
        assertThat(synthesisService.requests).isEmpty();
    }

    @Test
    @DisplayName("With no repairs allowed the first failure ends the run")
    void shouldNotRepairWhenNoRepairsAllowed() {
        // Given
        sandbox.then(() -> failure(SELECTOR_FAILURE));

        // When
        var result = orchestrator.execute(task(config(0)));

        // Then
        assertThat(result.finalStatus()).isEqualTo(RunStatus.ATTEMPT_LIMIT_EXHAUSTED);
        assertThat(result.attempts()).hasSize(1);
    }

    @Test
    @DisplayName("Disabled auto-heal reports the first failure as failed")
    void shouldFailWithoutRepairWhenAutoHealDisabled() {
        // Given
        sandbox.then(() -> failure(SELECTOR_FAILURE));

        // When
        var result = orchestrator.execute(task(config(3).withAutoHeal(false)));

        // Then
        assertThat(result.finalStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(result.stopReason()).startsWith("auto_heal_disabled");
        assertThat(result.attempts()).hasSize(1);
    }

    @Test
    @DisplayName("A failing synthesis becomes an attempt without a script and two of them in a row are unrecoverable")
    void shouldStopAfterConsecutiveSynthesisFaults() {
        // Given
        synthesisService.then(() -> {
            throw new ServiceException("model unavailable", SYNTHESIS);
        }).then(() -> {
            throw new ServiceException("model unavailable", SYNTHESIS);
        });

        // When
        var result = orchestrator.execute(task(config(3)));

        // Then
        assertThat(result.finalStatus()).isEqualTo(RunStatus.UNRECOVERABLE);
        assertThat(result.attempts()).hasSize(2);
        assertThat(result.attempts()).extracting(AttemptSummary::scriptVersion).containsOnlyNulls();
        assertThat(result.attempts()).extracting(AttemptSummary::diagnosisCategory).containsOnly(UNKNOWN);
        assertThat(result.totalCost()).isEqualByComparingTo("0");
        assertThat(sandbox.requests).isEmpty();
        assertThat(dailySpendTracker.getReserved()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("A sandbox fault is diagnosed as unknown and the generation cost is still billed")
    void shouldBillGenerationWhenSandboxFails() {
        // Given
        sandbox.then(() -> {
            throw new ServiceException("sandbox unavailable", EXECUTION);
        }).then(AutomationOrchestratorTest::success);

        // When
        var result = orchestrator.execute(task(config(3)));

        // Then
        assertThat(result.finalStatus()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(result.attempts().get(0).diagnosisCategory()).isEqualTo(UNKNOWN);
        assertThat(result.attempts().get(0).cost()).isEqualByComparingTo(GENERATION_COST);
        assertCostsAddUp(result);
    }

    @Test
    @DisplayName("A timeout reported by the sandbox is classified as a timeout")
    void shouldClassifySandboxTimeout() {
        // Given
        sandbox.then(() -> {
            throw new SandboxTimeoutException("Script execution timed out after 5000 ms", 5_000);
        }).then(AutomationOrchestratorTest::success);

        // When
        var result = orchestrator.execute(task(config(3)));

        // Then
        assertThat(result.finalStatus()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(result.attempts().get(0).diagnosisCategory()).isEqualTo(TIMEOUT);
        assertThat(synthesisService.requests.get(1).repairHint()).contains("timeout");
    }

    @Test
    @DisplayName("A navigation timeout is fixed without calling the synthesis service")
    void shouldExecuteQuickFixAfterTimeout() {
        // Given
        synthesisService.then(() -> new SynthesisResponse(
                "await page.goto(\"https://example.com/login\")\nawait page.click('#submit')", GENERATION_COST,
                "test-model"));
        sandbox.then(() -> {
            throw new SandboxTimeoutException("Script execution timed out after 5000 ms", 5_000);
        }).then(AutomationOrchestratorTest::success);

        // When
        var result = orchestrator.execute(task(config(3)));

        // Then
        assertThat(result.finalStatus()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(result.attempts()).extracting(AttemptSummary::scriptVersion).containsExactly(1, 2);
        assertThat(result.attempts().get(1).cost()).isEqualByComparingTo(EXECUTION_COST);
        assertThat(result.totalCost()).isEqualByComparingTo("0.03");
        assertThat(synthesisService.requests).hasSize(1);
        assertThat(sandbox.requests.get(1).scriptCode())
                .contains("page.goto(\"https://example.com/login\", timeout=60000, wait_until='domcontentloaded')")
                .contains("await page.click('#submit')");
        assertThat(dailySpendTracker.getReserved()).isEqualByComparingTo("0");
        assertCostsAddUp(result);
    }

    @Test
    @DisplayName("A quick-fixed script which fails again is repaired by the synthesis service")
    void shouldFallBackToSynthesisWhenQuickFixFails() {
        // Given
        synthesisService.then(() -> new SynthesisResponse("await page.goto(\"https://example.com/login\")",
                GENERATION_COST, "test-model"));
        sandbox.then(() -> {
            throw new SandboxTimeoutException("Script execution timed out after 5000 ms", 5_000);
        }).then(() -> {
            throw new SandboxTimeoutException("Script execution timed out after 5000 ms", 5_000);
        }).then(AutomationOrchestratorTest::success);

        // When
        var result = orchestrator.execute(task(config(3)));

        // Then
        assertThat(result.finalStatus()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(result.attempts()).extracting(AttemptSummary::scriptVersion).containsExactly(1, 2, 3);
        assertThat(synthesisService.requests).hasSize(2);
        assertThat(synthesisService.requests.get(1).priorScript()).contains("timeout=60000");
        assertCostsAddUp(result);
    }

    @Test
    @DisplayName("Concurrent runs sharing one daily budget never spend more than the daily ceiling")
    void shouldNotOverspendDailyBudgetWithConcurrentRuns() throws Exception {
        // Given
        var sharedTracker = new DailySpendTracker(new InMemoryDailySpendStore(), new BigDecimal("0.10"),
                ZoneOffset.UTC, Clock.systemUTC());
        var sharedOrchestrator = orchestrator(sharedTracker);
        synthesisService.estimate = new BigDecimal("0.03");
        synthesisService.cost = new BigDecimal("0.03");
        sandbox.executionEstimate = new BigDecimal("0.03");
        sandbox.executionCost = new BigDecimal("0.03");
        for (int i = 0; i < 4; i++) {
            sandbox.then(() -> {
                sleep(50);
                return success();
            });
        }

        // When
        var handles = new ArrayList<RunHandle>();
        for (int i = 0; i < 4; i++) {
            handles.add(sharedOrchestrator.start(task(config(3))));
        }
        var results = new ArrayList<RunResult>();
        for (var handle : handles) {
            results.add(handle.await(Duration.ofSeconds(10)));
        }

        // Then
        assertThat(sharedTracker.getSpentToday()).isLessThanOrEqualTo(new BigDecimal("0.10"));
        assertThat(sharedTracker.getSpentToday()).isEqualByComparingTo("0.06");
        assertThat(sharedTracker.getReserved()).isEqualByComparingTo("0");
        assertThat(results).filteredOn(result -> result.finalStatus() == RunStatus.SUCCEEDED).hasSize(1);
        assertThat(results).filteredOn(result -> result.finalStatus() == RunStatus.BUDGET_EXHAUSTED)
                .hasSize(3)
                .allSatisfy(result -> assertThat(result.attempts()).isEmpty());
        var totalCost = results.stream().map(RunResult::totalCost).reduce(ZERO, BigDecimal::add);
        assertThat(totalCost).isEqualByComparingTo(sharedTracker.getSpentToday());
    }

    @Test
    @DisplayName("A sandbox exceeding the timeout plus grace period is abandoned and classified as a timeout")
    void shouldAbandonHangingSandbox() {
        // Given
        sandbox.then(() -> {
            sleep(10_000);
            return success();
        }).then(AutomationOrchestratorTest::success);
        var config = config(3).withTimeoutMillis(100);

        // When
        var result = orchestrator.execute(task(config));

        // Then
        assertThat(result.finalStatus()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(result.attempts().get(0).diagnosisCategory()).isEqualTo(TIMEOUT);
        assertThat(result.attempts().get(0).cost()).isEqualByComparingTo(GENERATION_COST);
    }

    @Test
    @DisplayName("Cancelling a run during execution aborts it and keeps the paid generation")
    void shouldAbortCancelledRun() throws Exception {
        // Given
        var executionStarted = new CountDownLatch(1);
        sandbox.then(() -> {
            executionStarted.countDown();
            sleep(10_000);
            return success();
        });
        var handle = orchestrator.start(task(config(3)));
        assertThat(executionStarted.await(5, TimeUnit.SECONDS)).isTrue();

        // When
        handle.cancel();
        var result = handle.await(Duration.ofSeconds(5));

        // Then
        assertThat(result.finalStatus()).isEqualTo(RunStatus.ABORTED);
        assertThat(result.stopReason()).startsWith("cancelled");
        assertThat(result.attempts()).hasSize(1);
        assertThat(result.attempts().get(0).diagnosisCategory()).isEqualTo(UNKNOWN);
        assertThat(result.totalCost()).isEqualByComparingTo(GENERATION_COST);
        assertThat(handle.getTaskId()).isEqualTo(result.taskId());
    }

    @Test
    @DisplayName("A run exceeding its deadline is aborted")
    void shouldAbortRunAfterDeadline() {
        // Given
        synthesisService.then(() -> {
            sleep(10_000);
            return new SynthesisResponse("script", GENERATION_COST, "test-model");
        });
        var config = config(3).withRunDeadlineMillis(200);

        // When
        var result = orchestrator.execute(task(config));

        // Then
        assertThat(result.finalStatus()).isEqualTo(RunStatus.ABORTED);
        assertThat(result.stopReason()).startsWith("deadline_exceeded");
        assertThat(result.attempts()).isEmpty();
        assertThat(dailySpendTracker.getReserved()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("An invalid task is rejected before a run exists")
    void shouldRejectInvalidTaskBeforeRunning() {
        // Given
        var config = config(3).withTimeoutMillis(0);

        // When / Then
        assertThatThrownBy(() -> orchestrator.execute(task(config))).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> orchestrator.execute(Task.of(" ", null, config(3))))
                .isInstanceOf(ConfigurationException.class);
        assertThat(synthesisService.requests).isEmpty();
        assertThat(dailySpendTracker.getSpentToday()).isEqualByComparingTo("0");
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceException("Interrupted", EXECUTION, e);
        }
    }

    private static class ScriptedSynthesisService implements ScriptSynthesisService {
        private final Deque<Supplier<SynthesisResponse>> outcomes = new ArrayDeque<>();
        private final List<SynthesisRequest> requests = new CopyOnWriteArrayList<>();
        private volatile BigDecimal estimate = GENERATION_COST;
        private volatile BigDecimal cost = GENERATION_COST;

        ScriptedSynthesisService then(Supplier<SynthesisResponse> outcome) {
            outcomes.add(outcome);
            return this;
        }

        @Override
        public BigDecimal estimateCost(SynthesisRequest request) {
            return estimate;
        }

        @Override
        public synchronized SynthesisResponse synthesize(SynthesisRequest request) {
            requests.add(request);
            var outcome = outcomes.poll();
            if (outcome != null) {
                return outcome.get();
            }
            return new SynthesisResponse("script " + requests.size(), cost, "test-model");
        }
    }

    private static class ScriptedSandbox implements ExecutionSandbox {
        private final Deque<Supplier<SandboxResponse>> outcomes = new ArrayDeque<>();
        private final List<SandboxRequest> requests = new CopyOnWriteArrayList<>();
        private volatile BigDecimal executionCost = EXECUTION_COST;
        private volatile BigDecimal executionEstimate = ZERO;

        ScriptedSandbox then(Supplier<SandboxResponse> outcome) {
            outcomes.add(outcome);
            return this;
        }

        @Override
        public BigDecimal estimateCost(long timeoutMs) {
            return executionEstimate;
        }

        @Override
        public SandboxResponse execute(SandboxRequest request) {
            requests.add(request);
            Supplier<SandboxResponse> outcome;
            synchronized (outcomes) {
                outcome = outcomes.poll();
            }
            if (outcome == null) {
                throw new IllegalStateException("No scripted sandbox outcome left");
            }
            var response = outcome.get();
            return new SandboxResponse(response.status(), response.logs(), response.artifactHandles(),
                    response.durationMs(), response.errorSignal(), executionCost);
        }
    }
}
