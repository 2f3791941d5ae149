package uz.greenwhite.federation.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.federation.error.ErrorKind;
import uz.greenwhite.federation.error.ExternalServiceException;
import uz.greenwhite.federation.error.FederationException;
import uz.greenwhite.federation.error.WorkflowExecutionFailedException;
import uz.greenwhite.federation.metrics.FederationMetrics;
import uz.greenwhite.federation.proxy.Backoff;
import uz.greenwhite.federation.workflow.model.ExecutionError;
import uz.greenwhite.federation.workflow.model.FederatedWorkflow;
import uz.greenwhite.federation.workflow.model.RetryPolicy;
import uz.greenwhite.federation.workflow.model.StepExecution;
import uz.greenwhite.federation.workflow.model.StepStatus;
import uz.greenwhite.federation.workflow.model.WorkflowConfig;
import uz.greenwhite.federation.workflow.model.WorkflowExecution;
import uz.greenwhite.federation.workflow.model.WorkflowStep;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the steps of one execution.
 *
 * Steps run in waves: every step whose dependencies have completed is ready,
 * and up to {@code max_parallel_executions} ready steps are dispatched together.
 * Cancellation is checked before every dispatch. The first failed step fails the
 * execution once the rest of its wave has settled; later steps are not dispatched.
 *
 * The execution context is a JSON object {@code {input, steps: {<id>: output}, vars}}
 * that input mappings read from and output mappings write to.
 */
@Slf4j
@Component
public class WorkflowExecutor {

    private final StepDispatcher dispatcher;
    private final ExecutionTracker tracker;
    private final FederationMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public WorkflowExecutor(StepDispatcher dispatcher, ExecutionTracker tracker, FederationMetrics metrics,
                            ObjectMapper objectMapper, Clock clock) {
        this.dispatcher = dispatcher;
        this.tracker = tracker;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @return the execution result {@code {steps, outputs}}
     * @throws WorkflowExecutionFailedException when a step fails or the workflow times out;
     *                                          {@code details.code} carries the error code
     * @throws CancellationException            when cancellation was observed at a step boundary
     */
    public JsonNode run(FederatedWorkflow workflow, UUID executionId, JsonNode input) {
        WorkflowConfig config = workflow.getConfig() != null ? workflow.getConfig() : WorkflowConfig.DEFAULT;
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(config.getTimeoutSeconds());

        ObjectNode context = objectMapper.createObjectNode();
        context.set("input", input == null ? NullNode.getInstance() : input.deepCopy());
        ObjectNode stepOutputs = context.putObject("steps");
        ObjectNode vars = context.putObject("vars");

        List<WorkflowStep> remaining = new ArrayList<>(workflow.getSteps());
        Set<String> completed = new HashSet<>();
        boolean budgetWarned = false;

        while (!remaining.isEmpty()) {
            List<WorkflowStep> wave = remaining.stream()
                    .filter(step -> completed.containsAll(step.getDependencies()))
                    .limit(config.getMaxParallelExecutions())
                    .toList();
            if (wave.isEmpty()) {
                throw failure("unsatisfiable step dependencies", ExecutionError.EXECUTION_FAILED, null, null);
            }

            Map<WorkflowStep, CompletableFuture<StepOutcome>> running = new LinkedHashMap<>();
            Map<WorkflowStep, StepExecution> started = new LinkedHashMap<>();
            Map<WorkflowStep, AtomicInteger> retries = new LinkedHashMap<>();
            for (WorkflowStep step : wave) {
                if (tracker.isCancelled(executionId)) {
                    // steps already dispatched in this wave finish on their own, their results are dropped
                    throw new CancellationException("Execution " + executionId + " cancelled before step " + step.getId());
                }
                StepExecution record = StepExecution.builder()
                        .stepId(step.getId())
                        .providerId(step.getProviderId())
                        .status(StepStatus.RUNNING)
                        .startedAt(clock.instant())
                        .build();
                tracker.updateRunning(executionId, e -> withStep(e, record));
                started.put(step, record);
                retries.put(step, new AtomicInteger());
                running.put(step, attempt(invocation(executionId, step, context), retryPolicy(step, config),
                        1, retries.get(step)));
            }

            WorkflowExecutionFailedException firstFailure = null;
            for (Map.Entry<WorkflowStep, CompletableFuture<StepOutcome>> entry : running.entrySet()) {
                WorkflowStep step = entry.getKey();
                StepExecution record = started.get(step);
                try {
                    StepOutcome outcome = await(entry.getValue(), deadline, step, config);
                    JsonNode output = outcome.getOutput() == null ? NullNode.getInstance() : outcome.getOutput();
                    stepOutputs.set(step.getId(), output);
                    applyOutputMapping(step, output, vars);
                    completed.add(step.getId());

                    StepExecution done = record.toBuilder()
                            .status(StepStatus.COMPLETED)
                            .endedAt(clock.instant())
                            .result(output)
                            .cost(outcome.getCost())
                            .retryAttempts(retries.get(step).get())
                            .build();
                    tracker.updateRunning(executionId, e -> withStep(e, done).toBuilder()
                            .resourceUsage(e.getResourceUsage().plus(outcome.getResourceUsage()))
                            .totalCost(e.getTotalCost() + outcome.getCost())
                            .build());
                    log.info("Step {} of execution {} completed (retries={}, cost={})",
                            step.getId(), executionId, done.getRetryAttempts(), outcome.getCost());

                    budgetWarned = checkBudget(workflow, step, executionId, outcome.getCost(), budgetWarned);

                } catch (StepFailedException e) {
                    Throwable cause = e.getCause();
                    int retryCount = retries.get(step).get();
                    String code = cause instanceof FederationException ? ExecutionError.STEP_FAILED : ExecutionError.INTERNAL_ERROR;
                    StepExecution failed = record.toBuilder()
                            .status(StepStatus.FAILED)
                            .endedAt(clock.instant())
                            .error(ExecutionError.builder()
                                    .code(cause instanceof FederationException fe ? fe.getKind().getCode() : ErrorKind.INTERNAL.getCode())
                                    .message(cause.getMessage())
                                    .occurredAt(clock.instant())
                                    .build())
                            .retryAttempts(retryCount)
                            .build();
                    tracker.updateRunning(executionId, ex -> withStep(ex, failed));
                    log.warn("Step {} of execution {} failed after {} attempt(s): {}",
                            step.getId(), executionId, retryCount + 1, cause.getMessage());
                    if (firstFailure == null) {
                        firstFailure = failure("step " + step.getId() + " failed: " + cause.getMessage(),
                                code, step, cause);
                    }
                }
            }
            if (firstFailure != null) {
                throw firstFailure;
            }
            remaining.removeAll(wave);
        }

        ObjectNode result = objectMapper.createObjectNode();
        result.set("steps", stepOutputs);
        result.set("outputs", vars);
        return result;
    }

    private CompletableFuture<StepOutcome> attempt(StepInvocation invocation, RetryPolicy policy,
                                                   int attempt, AtomicInteger retries) {
        CompletableFuture<StepOutcome> dispatched;
        try {
            dispatched = dispatcher.submit(invocation);
        } catch (RuntimeException e) {
            dispatched = CompletableFuture.failedFuture(e);
        }

        return dispatched.exceptionallyCompose(error -> {
            Throwable cause = unwrap(error);
            WorkflowStep step = invocation.getStep();
            if (attempt >= policy.getMaxAttempts() || !isRetryable(cause)
                    || tracker.isCancelled(invocation.getExecutionId())) {
                return CompletableFuture.<StepOutcome>failedFuture(cause);
            }
            Duration delay = Backoff.delay(attempt, policy.getInitialDelayMs(), policy.getMaxDelayMs(),
                    policy.getBackoffMultiplier(), policy.isExponentialBackoff(), false);
            retries.incrementAndGet();
            metrics.getWorkflowStepRetry().increment();
            log.warn("Retrying step {} of execution {} in {}ms (attempt {}/{}): {}",
                    step.getId(), invocation.getExecutionId(), delay.toMillis(),
                    attempt + 1, policy.getMaxAttempts(), cause.getMessage());
            return CompletableFuture
                    .supplyAsync(() -> null, CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS))
                    .thenCompose(ignored -> attempt(invocation, policy, attempt + 1, retries));
        });
    }

    private StepOutcome await(CompletableFuture<StepOutcome> future, long deadline,
                              WorkflowStep step, WorkflowConfig config) {
        try {
            return future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw failure("workflow timed out after " + config.getTimeoutSeconds() + "s",
                    ExecutionError.WORKFLOW_TIMEOUT, step, e);
        } catch (ExecutionException e) {
            throw new StepFailedException(unwrap(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("interrupted while waiting for step " + step.getId(),
                    ExecutionError.EXECUTION_FAILED, step, e);
        }
    }

    private StepInvocation invocation(UUID executionId, WorkflowStep step, ObjectNode context) {
        Long timeoutSeconds = step.getConfig() != null ? step.getConfig().getTimeoutSeconds() : null;
        return StepInvocation.builder()
                .executionId(executionId)
                .step(step)
                .input(resolveInput(step, context))
                .timeout(timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : null)
                .build();
    }

    /**
     * Without an input mapping the step gets its {@code body} parameter, or the workflow input.
     */
    private JsonNode resolveInput(WorkflowStep step, ObjectNode context) {
        Map<String, String> mapping = step.getInputMapping();
        if (mapping == null || mapping.isEmpty()) {
            Object body = step.getConfig() != null ? step.getConfig().getParameters().get("body") : null;
            return body != null ? objectMapper.valueToTree(body) : context.get("input");
        }
        ObjectNode input = objectMapper.createObjectNode();
        mapping.forEach((field, pointer) -> {
            JsonNode value = context.at(pointer);
            if (value.isMissingNode()) {
                log.debug("Input mapping {} <- {} of step {} resolved to nothing", field, pointer, step.getId());
                input.putNull(field);
            } else {
                input.set(field, value.deepCopy());
            }
        });
        return input;
    }

    private void applyOutputMapping(WorkflowStep step, JsonNode output, ObjectNode vars) {
        if (step.getOutputMapping() == null) {
            return;
        }
        step.getOutputMapping().forEach((name, pointer) -> {
            JsonNode value = output.at(pointer);
            vars.set(name, value.isMissingNode() ? NullNode.getInstance() : value.deepCopy());
        });
    }

    private boolean checkBudget(FederatedWorkflow workflow, WorkflowStep step, UUID executionId,
                                double stepCost, boolean alreadyWarned) {
        Double stepBudget = step.getConfig() != null ? step.getConfig().getCostBudget() : null;
        if (stepBudget != null && stepCost > stepBudget) {
            log.warn("Step {} of execution {} exceeded its cost budget: {} > {}",
                    step.getId(), executionId, stepCost, stepBudget);
        }
        Double budget = workflow.getConfig() != null ? workflow.getConfig().getCostBudget() : null;
        if (budget == null || alreadyWarned) {
            return alreadyWarned;
        }
        double total = tracker.find(executionId).map(WorkflowExecution::getTotalCost).orElse(0.0);
        if (total > budget) {
            log.warn("Execution {} of workflow {} exceeded its cost budget: {} > {}",
                    executionId, workflow.getId(), total, budget);
            return true;
        }
        return false;
    }

    private static RetryPolicy retryPolicy(WorkflowStep step, WorkflowConfig config) {
        if (step.getRetryConfig() != null) {
            return step.getRetryConfig();
        }
        return config.getRetryPolicy() != null ? config.getRetryPolicy() : RetryPolicy.DEFAULT;
    }

    private static boolean isRetryable(Throwable cause) {
        return cause instanceof ExternalServiceException ese && ese.isRetryable();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static WorkflowExecution withStep(WorkflowExecution execution, StepExecution step) {
        List<StepExecution> steps = new ArrayList<>(execution.getStepExecutions());
        steps.removeIf(s -> s.getStepId().equals(step.getStepId()));
        steps.add(step);
        return execution.toBuilder().clearStepExecutions().stepExecutions(steps).build();
    }

    private static WorkflowExecutionFailedException failure(String reason, String code,
                                                            WorkflowStep step, Throwable cause) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("code", code);
        if (step != null) {
            details.put("step_id", step.getId());
            if (step.getProviderId() != null) {
                details.put("provider_id", step.getProviderId());
            }
        }
        return new WorkflowExecutionFailedException(reason, details, cause);
    }

    /**
     * Failure of one step after its retries; carries the last cause.
     */
    private static class StepFailedException extends RuntimeException {
        StepFailedException(Throwable cause) {
            super(cause);
        }
    }
}
