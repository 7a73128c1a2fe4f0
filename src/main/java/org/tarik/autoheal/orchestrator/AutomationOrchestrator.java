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
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.autoheal.dto.Attempt;
import org.tarik.autoheal.dto.Diagnosis;
import org.tarik.autoheal.dto.ExecutionTrace;
import org.tarik.autoheal.dto.RunResult;
import org.tarik.autoheal.dto.RunStatus;
import org.tarik.autoheal.dto.ScriptArtifact;
import org.tarik.autoheal.dto.Task;
import org.tarik.autoheal.dto.TaskConfig;
import org.tarik.autoheal.error.ErrorCategory;
import org.tarik.autoheal.error.ErrorClassifier;
import org.tarik.autoheal.exceptions.ConfigurationException;
import org.tarik.autoheal.exceptions.SandboxTimeoutException;
import org.tarik.autoheal.manager.CostLedger;
import org.tarik.autoheal.manager.DailySpendTracker;
import org.tarik.autoheal.manager.RunStore;
import org.tarik.autoheal.model.Run;
import org.tarik.autoheal.repair.QuickFixRepairer;
import org.tarik.autoheal.repair.QuickFixRepairer.QuickFix;
import org.tarik.autoheal.repair.RepairDecision;
import org.tarik.autoheal.repair.RepairPlanner;
import org.tarik.autoheal.repair.StopReason;
import org.tarik.autoheal.services.ExecutionSandbox;
import org.tarik.autoheal.services.SandboxRequest;
import org.tarik.autoheal.services.SandboxResponse;
import org.tarik.autoheal.services.ScriptSynthesisService;
import org.tarik.autoheal.services.SynthesisRequest;
import org.tarik.autoheal.services.SynthesisResponse;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;

import static java.lang.System.nanoTime;
import static java.math.BigDecimal.ZERO;
import static java.time.Instant.now;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.NANOSECONDS;
import static org.tarik.autoheal.orchestrator.RunState.*;
import static org.tarik.autoheal.utils.CommonUtils.abbreviate;

/**
 * Drives a task through the generate, execute, diagnose and repair cycle until an attempt succeeds or a stop
 * condition is reached. Attempts of a run are strictly sequential, different runs may execute concurrently and
 * only share the {@link DailySpendTracker}.
 * <p>
 * The only exception leaving {@link #execute(Task)} is a {@link ConfigurationException} for an invalid task,
 * thrown before any run exists. Every other failure ends up in the attempt history or in the terminal status.
 * <p>
 * Both external calls run on the given executor so that they can be abandoned when the run is cancelled or its
 * deadline expires. The executor must not be bounded below two threads per concurrently executing run.
 * <p>
 * A failed script is first offered to the {@link QuickFixRepairer}. A quick fix is executed without calling the
 * synthesis service, so only the execution is reserved and paid for. Every finished run is saved to the
 * {@link RunStore}.
 */
public class AutomationOrchestrator implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AutomationOrchestrator.class);
    private static final String EXECUTION_COST_SOURCE = "execution-sandbox";
    static final String QUICK_FIX_SOURCE = "quick-fix";
    private static final int MAX_FAULT_MESSAGE_LENGTH = 500;
    private final ScriptSynthesisService synthesisService;
    private final ExecutionSandbox executionSandbox;
    private final ErrorClassifier errorClassifier;
    private final RepairPlanner repairPlanner;
    private final QuickFixRepairer quickFixRepairer;
    private final DailySpendTracker dailySpendTracker;
    private final RunStore runStore;
    private final ExecutorService executor;
    private final long executionGraceMillis;

    public AutomationOrchestrator(@NotNull ScriptSynthesisService synthesisService,
                                  @NotNull ExecutionSandbox executionSandbox,
                                  @NotNull ErrorClassifier errorClassifier,
                                  @NotNull RepairPlanner repairPlanner,
                                  @NotNull QuickFixRepairer quickFixRepairer,
                                  @NotNull DailySpendTracker dailySpendTracker,
                                  @NotNull RunStore runStore,
                                  @NotNull ExecutorService executor,
                                  long executionGraceMillis) {
        this.synthesisService = synthesisService;
        this.executionSandbox = executionSandbox;
        this.errorClassifier = errorClassifier;
        this.repairPlanner = repairPlanner;
        this.quickFixRepairer = quickFixRepairer;
        this.dailySpendTracker = dailySpendTracker;
        this.runStore = runStore;
        this.executor = executor;
        this.executionGraceMillis = Math.max(0, executionGraceMillis);
    }

    /**
     * Runs the task to completion on the calling thread.
     *
     * @throws ConfigurationException if the task or its configuration is invalid
     */
    public RunResult execute(@NotNull Task task) {
        return execute(task, new CancellationToken());
    }

    public RunResult execute(@NotNull Task task, @NotNull CancellationToken cancellationToken) {
        task.validate();
        return runLoop(task, cancellationToken);
    }

    /**
     * Validates the task synchronously and runs it in the background.
     *
     * @throws ConfigurationException if the task or its configuration is invalid
     */
    public RunHandle start(@NotNull Task task) {
        task.validate();
        var cancellationToken = new CancellationToken();
        var result = CompletableFuture.supplyAsync(() -> runLoop(task, cancellationToken), executor);
        return new RunHandle(task.id(), result, cancellationToken);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private RunResult runLoop(Task task, CancellationToken cancellationToken) {
        var config = task.config();
        var run = new Run(task);
        var context = new RunContext(task, run, new RunStateMachine(task.id()),
                new CostLedger(dailySpendTracker, config.maxCostPerRun()), cancellationToken,
                nanoTime() + MILLISECONDS.toNanos(config.runDeadlineMillis()));
        LOG.info("Starting run of task '{}' ({})", task.description(), task.id());

        try {
            while (true) {
                context.stateMachine.transitionTo(GENERATING);
                var abortReason = checkAborted(context);
                if (abortReason != null) {
                    return stop(context, abortReason, "Run stopped before attempt %d".formatted(run.getNextOrdinal()));
                }

                var outcome = runAttempt(context);
                if (outcome.attempt == null) {
                    return stop(context, outcome.stopReason, outcome.stopDetails);
                }

                var attempt = outcome.attempt;
                run.addAttempt(attempt);
                logAttempt(task, attempt);
                if (attempt.isSuccess()) {
                    context.stateMachine.transitionTo(SUCCEEDED);
                    run.finalizeRun(RunStatus.SUCCEEDED, null);
                    return finish(run);
                }
                if (outcome.stopReason != null) {
                    return stop(context, outcome.stopReason, outcome.stopDetails);
                }

                context.stateMachine.transitionTo(REPAIRING);
                var decision = repairPlanner.plan(run.getAttempts(), attempt.diagnosis(), config);
                if (decision instanceof RepairDecision.Stop stopDecision) {
                    return stop(context, stopDecision.reason(), stopDecision.details());
                }
                var retry = (RepairDecision.RetryWithRepair) decision;
                context.prepareRepair(attempt, retry.hint());
                offerQuickFix(context, attempt);
            }
        } catch (RuntimeException e) {
            LOG.error("Run of task {} failed unexpectedly", task.id(), e);
            context.ledger.release();
            if (!run.isFinalized()) {
                if (!context.stateMachine.isTerminal()) {
                    context.stateMachine.transitionTo(STOPPED);
                }
                run.finalizeRun(StopReason.INTERNAL_ERROR.runStatus(), "%s: %s".formatted(
                        StopReason.INTERNAL_ERROR.value(), e.getMessage()));
            }
            return finish(run);
        }
    }

    private AttemptOutcome runAttempt(RunContext context) {
        var config = context.task.config();
        int ordinal = context.run.getNextOrdinal();
        Instant startedAt = now();

        ScriptArtifact script;
        var quickFix = context.takeQuickFix();
        if (quickFix != null) {
            BigDecimal estimate;
            try {
                estimate = executionSandbox.estimateCost(config.timeoutMillis());
            } catch (RuntimeException e) {
                LOG.error("Couldn't estimate the execution cost of attempt {} of task {}", ordinal,
                        context.task.id(), e);
                return AttemptOutcome.of(infrastructureFaultAttempt(context, ordinal, null,
                        "Execution sandbox failed: " + e.getMessage(), e, ZERO, startedAt));
            }
            if (!context.ledger.reserve(estimate)) {
                return budgetExhausted(context, estimate, ordinal);
            }
            script = new ScriptArtifact(context.nextScriptVersion++, quickFix.code(), context.sourceDiagnosis,
                    QUICK_FIX_SOURCE, ZERO, now());
            LOG.info("Attempt {} of task {} executes quick fix v{}: {}", ordinal, context.task.id(),
                    script.version(), quickFix.description());
        } else {
            var synthesisRequest = context.nextSynthesisRequest();
            BigDecimal estimate;
            try {
                estimate = synthesisService.estimateCost(synthesisRequest)
                        .add(executionSandbox.estimateCost(config.timeoutMillis()));
            } catch (RuntimeException e) {
                LOG.error("Couldn't estimate the cost of attempt {} of task {}", ordinal, context.task.id(), e);
                return AttemptOutcome.of(infrastructureFaultAttempt(context, ordinal, null,
                        "Script synthesis failed: " + e.getMessage(), e, ZERO, startedAt));
            }

            if (!context.ledger.reserve(estimate)) {
                return budgetExhausted(context, estimate, ordinal);
            }

            SynthesisResponse synthesisResponse;
            try {
                synthesisResponse = awaitCall(() -> synthesisService.synthesize(synthesisRequest), context,
                        Long.MAX_VALUE);
            } catch (RunAbortedException e) {
                context.ledger.release();
                return AttemptOutcome.stopped(e.reason,
                        "Script synthesis of attempt %d was abandoned".formatted(ordinal));
            } catch (ExecutionException | TimeoutException e) {
                context.ledger.release();
                var cause = e instanceof ExecutionException ? e.getCause() : e;
                LOG.error("Script synthesis for attempt {} of task {} failed", ordinal, context.task.id(), cause);
                return AttemptOutcome.of(infrastructureFaultAttempt(context, ordinal, null,
                        "Script synthesis failed: " + cause.getMessage(), cause, ZERO, startedAt));
            }

            script = new ScriptArtifact(context.nextScriptVersion++, synthesisResponse.scriptCode(),
                    context.sourceDiagnosis, synthesisResponse.modelName(), synthesisResponse.cost(), now());
        }

        context.stateMachine.transitionTo(EXECUTING);
        var sandboxRequest = new SandboxRequest(script.code(), config.headless(), config.browserType(),
                config.timeoutMillis());
        long executionBound = config.timeoutMillis() + executionGraceMillis;
        long executionStart = nanoTime();

        SandboxResponse sandboxResponse;
        try {
            sandboxResponse = awaitCall(() -> executionSandbox.execute(sandboxRequest), context, executionBound);
        } catch (RunAbortedException e) {
            // the script exists and was paid for, only the execution result is discarded
            context.ledger.record(script.generationCost(), script.modelName());
            var trace = ExecutionTrace.synthetic("Execution abandoned: " + e.reason.value(), null,
                    elapsedMillis(executionStart));
            var diagnosis = infrastructureDiagnosis("Execution was abandoned before it finished", trace);
            context.stateMachine.transitionTo(DIAGNOSING);
            var attempt = new Attempt(ordinal, script, trace, diagnosis, script.generationCost(), startedAt, now());
            return AttemptOutcome.abandoned(attempt, e.reason,
                    "Execution of attempt %d was abandoned".formatted(ordinal));
        } catch (TimeoutException e) {
            context.ledger.record(script.generationCost(), script.modelName());
            var trace = ExecutionTrace.synthetic("Execution timed out: no result within %d ms (timeout %d ms)"
                    .formatted(executionBound, config.timeoutMillis()), null, elapsedMillis(executionStart));
            return AttemptOutcome.of(diagnosedAttempt(context, ordinal, script, trace, script.generationCost(),
                    startedAt));
        } catch (ExecutionException e) {
            context.ledger.record(script.generationCost(), script.modelName());
            var cause = e.getCause();
            if (cause instanceof SandboxTimeoutException timeout) {
                var duration = Math.max(timeout.getElapsedMillis(), config.timeoutMillis());
                var trace = ExecutionTrace.synthetic("Execution timed out: " + timeout.getMessage(), null, duration);
                return AttemptOutcome.of(diagnosedAttempt(context, ordinal, script, trace, script.generationCost(),
                        startedAt));
            }
            LOG.error("Execution sandbox failed on attempt {} of task {}", ordinal, context.task.id(), cause);
            return AttemptOutcome.of(infrastructureFaultAttempt(context, ordinal, script,
                    "Execution sandbox failed: " + cause.getMessage(), cause, script.generationCost(), startedAt));
        }

        // one commit for both costs, a concurrent run can't be granted a reservation in between
        var costs = new LinkedHashMap<String, BigDecimal>();
        costs.put(script.modelName(), script.generationCost());
        costs.merge(EXECUTION_COST_SOURCE, sandboxResponse.cost(), BigDecimal::add);
        context.ledger.record(costs);
        var cost = script.generationCost().add(sandboxResponse.cost());
        var trace = sandboxResponse.toTrace();
        if (trace.isSuccess()) {
            return AttemptOutcome.of(new Attempt(ordinal, script, trace, null, cost, startedAt, now()));
        }
        return AttemptOutcome.of(diagnosedAttempt(context, ordinal, script, trace, cost, startedAt));
    }

    private static AttemptOutcome budgetExhausted(RunContext context, BigDecimal estimate, int ordinal) {
        return AttemptOutcome.stopped(StopReason.BUDGET_EXHAUSTED,
                "Reservation of $%s for attempt %d was denied, run spend $%s of $%s".formatted(
                        estimate.toPlainString(), ordinal, context.ledger.getRunSpend().toPlainString(),
                        context.ledger.getPerRunCeiling().toPlainString()));
    }

    private void offerQuickFix(RunContext context, Attempt failedAttempt) {
        if (failedAttempt.script() == null) {
            return;
        }
        try {
            quickFixRepairer.tryFix(failedAttempt.script().code(), failedAttempt.diagnosis())
                    .ifPresent(context::setQuickFix);
        } catch (RuntimeException e) {
            LOG.warn("Quick fix of attempt {} of task {} failed, the script will be repaired by the model",
                    failedAttempt.ordinal(), context.task.id(), e);
        }
    }

    private Attempt diagnosedAttempt(RunContext context, int ordinal, ScriptArtifact script, ExecutionTrace trace,
                                     BigDecimal cost, Instant startedAt) {
        context.stateMachine.transitionTo(DIAGNOSING);
        var diagnosis = errorClassifier.classify(trace, context.task.config().timeoutMillis());
        return new Attempt(ordinal, script, trace, diagnosis, cost, startedAt, now());
    }

    private Attempt infrastructureFaultAttempt(RunContext context, int ordinal, @Nullable ScriptArtifact script,
                                               String message, Throwable fault, BigDecimal cost, Instant startedAt) {
        context.stateMachine.transitionTo(DIAGNOSING);
        var trace = ExecutionTrace.synthetic(abbreviate(message, MAX_FAULT_MESSAGE_LENGTH), stackTraceOf(fault), 0);
        var diagnosis = infrastructureDiagnosis("External service failed", trace);
        return new Attempt(ordinal, script, trace, diagnosis, cost, startedAt, now());
    }

    private static Diagnosis infrastructureDiagnosis(String summary, ExecutionTrace trace) {
        var evidence = trace.errorSignal() == null ? "" : trace.errorSignal().message();
        return new Diagnosis(ErrorCategory.UNKNOWN, summary, evidence, 0.0,
                "Regenerate the script, the previous attempt produced no usable execution result");
    }

    private <T> T awaitCall(Callable<T> call, RunContext context, long callBoundMillis)
            throws RunAbortedException, ExecutionException, TimeoutException {
        Future<T> future = executor.submit(call);
        context.cancellationToken.register(future);
        try {
            long remainingRunNanos = context.deadlineNanos - nanoTime();
            if (remainingRunNanos <= 0) {
                future.cancel(true);
                throw new RunAbortedException(StopReason.DEADLINE_EXCEEDED);
            }
            return future.get(Math.min(remainingRunNanos, MILLISECONDS.toNanos(callBoundMillis)), NANOSECONDS);
        } catch (CancellationException e) {
            throw new RunAbortedException(StopReason.CANCELLED);
        } catch (TimeoutException e) {
            future.cancel(true);
            if (nanoTime() - context.deadlineNanos >= 0) {
                throw new RunAbortedException(StopReason.DEADLINE_EXCEEDED);
            }
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RunAbortedException(StopReason.CANCELLED);
        } finally {
            context.cancellationToken.clear();
        }
    }

    @Nullable
    private static StopReason checkAborted(RunContext context) {
        if (context.cancellationToken.isCancelled() || Thread.currentThread().isInterrupted()) {
            return StopReason.CANCELLED;
        }
        if (nanoTime() - context.deadlineNanos >= 0) {
            return StopReason.DEADLINE_EXCEEDED;
        }
        return null;
    }

    private RunResult stop(RunContext context, StopReason reason, String details) {
        context.stateMachine.transitionTo(STOPPED);
        LOG.warn("Run of task {} stopped: {} ({})", context.task.id(), reason.value(), details);
        context.run.finalizeRun(reason.runStatus(), "%s: %s".formatted(reason.value(), details));
        return finish(context.run);
    }

    private RunResult finish(Run run) {
        var result = run.toResult();
        LOG.info("Run finished:\n{}", result);
        try {
            runStore.save(result);
        } catch (UncheckedIOException | IllegalArgumentException e) {
            LOG.error("Couldn't save the result of task {}", result.taskId(), e);
        }
        return result;
    }

    private static void logAttempt(Task task, Attempt attempt) {
        if (attempt.isSuccess()) {
            LOG.info("Attempt {} of task {} succeeded, cost ${}", attempt.ordinal(), task.id(),
                    attempt.cost().toPlainString());
        } else {
            LOG.info("Attempt {} of task {} failed with {} (confidence {}), cost ${}", attempt.ordinal(), task.id(),
                    attempt.diagnosis().category().value(), attempt.diagnosis().confidence(),
                    attempt.cost().toPlainString());
        }
    }

    private static long elapsedMillis(long startNanos) {
        return NANOSECONDS.toMillis(nanoTime() - startNanos);
    }

    @Nullable
    private static String stackTraceOf(Throwable throwable) {
        if (throwable == null) {
            return null;
        }
        var writer = new StringWriter();
        throwable.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    private static class RunContext {
        private final Task task;
        private final Run run;
        private final RunStateMachine stateMachine;
        private final CostLedger ledger;
        private final CancellationToken cancellationToken;
        private final long deadlineNanos;
        private int nextScriptVersion = 1;
        private ScriptArtifact latestScript;
        private Diagnosis sourceDiagnosis;
        private String repairHint;
        private QuickFix pendingQuickFix;

        private RunContext(Task task, Run run, RunStateMachine stateMachine, CostLedger ledger,
                           CancellationToken cancellationToken, long deadlineNanos) {
            this.task = task;
            this.run = run;
            this.stateMachine = stateMachine;
            this.ledger = ledger;
            this.cancellationToken = cancellationToken;
            this.deadlineNanos = deadlineNanos;
        }

        private SynthesisRequest nextSynthesisRequest() {
            if (repairHint == null) {
                return SynthesisRequest.initial(task.description(), task.url());
            }
            return SynthesisRequest.repair(task.description(), task.url(),
                    latestScript == null ? null : latestScript.code(), repairHint);
        }

        // a failed synthesis has no script, the repair then builds on the last script which did exist
        private void prepareRepair(Attempt failedAttempt, String hint) {
            if (failedAttempt.script() != null) {
                latestScript = failedAttempt.script();
            }
            sourceDiagnosis = failedAttempt.diagnosis();
            repairHint = hint;
            pendingQuickFix = null;
        }

        private void setQuickFix(QuickFix quickFix) {
            pendingQuickFix = quickFix;
        }

        @Nullable
        private QuickFix takeQuickFix() {
            var quickFix = pendingQuickFix;
            pendingQuickFix = null;
            return quickFix;
        }
    }

    private static class AttemptOutcome {
        private final Attempt attempt;
        private final StopReason stopReason;
        private final String stopDetails;

        private AttemptOutcome(@Nullable Attempt attempt, @Nullable StopReason stopReason,
                               @Nullable String stopDetails) {
            this.attempt = attempt;
            this.stopReason = stopReason;
            this.stopDetails = stopDetails;
        }

        static AttemptOutcome of(Attempt attempt) {
            return new AttemptOutcome(attempt, null, null);
        }

        static AttemptOutcome stopped(StopReason reason, String details) {
            return new AttemptOutcome(null, reason, details);
        }

        static AttemptOutcome abandoned(Attempt attempt, StopReason reason, String details) {
            return new AttemptOutcome(attempt, reason, details);
        }
    }

    private static class RunAbortedException extends Exception {
        private final StopReason reason;

        private RunAbortedException(StopReason reason) {
            super(reason.value());
            this.reason = reason;
        }
    }
}
