package uz.greenwhite.federation.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uz.greenwhite.federation.error.FederationException;
import uz.greenwhite.federation.error.ResourceNotFoundException;
import uz.greenwhite.federation.error.WorkflowExecutionFailedException;
import uz.greenwhite.federation.error.WorkflowStateConflictException;
import uz.greenwhite.federation.metrics.FederationMetrics;
import uz.greenwhite.federation.model.ComponentHealth;
import uz.greenwhite.federation.storage.WorkflowRepository;
import uz.greenwhite.federation.workflow.model.ExecutionError;
import uz.greenwhite.federation.workflow.model.ExecutionEvent;
import uz.greenwhite.federation.workflow.model.FederatedWorkflow;
import uz.greenwhite.federation.workflow.model.ResourceUsage;
import uz.greenwhite.federation.workflow.model.WorkflowConfig;
import uz.greenwhite.federation.workflow.model.WorkflowDefinition;
import uz.greenwhite.federation.workflow.model.WorkflowExecution;
import uz.greenwhite.federation.workflow.model.WorkflowStatus;
import uz.greenwhite.federation.workflow.model.WorkflowUpdate;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * Lifecycle of federated workflows: define, execute, cancel, inspect.
 *
 * Each workflow owns one execution. {@link #executeWorkflow} runs it on the
 * calling thread and never throws for a failing run: the failure is recorded
 * on the execution, which ends in FAILED.
 */
@Slf4j
@Service
public class WorkflowEngine {

    private final WorkflowRepository repository;
    private final ExecutionTracker tracker;
    private final WorkflowExecutor executor;
    private final WorkflowValidator validator;
    private final FederationMetrics metrics;
    private final Clock clock;

    private final AtomicLong totalExecutions = new AtomicLong();
    private final AtomicLong completedExecutions = new AtomicLong();
    private final AtomicLong failedExecutions = new AtomicLong();
    private final AtomicLong cancelledExecutions = new AtomicLong();

    public WorkflowEngine(WorkflowRepository repository,
                          ExecutionTracker tracker,
                          WorkflowExecutor executor,
                          WorkflowValidator validator,
                          FederationMetrics metrics,
                          Clock clock) {
        this.repository = repository;
        this.tracker = tracker;
        this.executor = executor;
        this.validator = validator;
        this.metrics = metrics;
        this.clock = clock;
    }

    public FederatedWorkflow createWorkflow(WorkflowDefinition definition) {
        validator.validate(definition.getName(), definition.getSteps(), definition.getConfig());

        Instant now = clock.instant();
        UUID executionId = UUID.randomUUID();
        FederatedWorkflow workflow = FederatedWorkflow.builder()
                .id(UUID.randomUUID())
                .clientId(definition.getClientId())
                .name(definition.getName())
                .description(definition.getDescription())
                .steps(definition.getSteps())
                .config(definition.getConfig() != null ? definition.getConfig() : WorkflowConfig.DEFAULT)
                .status(WorkflowStatus.PENDING)
                .executionId(executionId)
                .createdAt(now)
                .updatedAt(now)
                .build();

        repository.saveWorkflow(workflow);
        tracker.register(WorkflowExecution.builder()
                .id(executionId)
                .workflowId(workflow.getId())
                .status(WorkflowStatus.PENDING)
                .createdAt(now)
                .resourceUsage(ResourceUsage.ZERO)
                .totalCost(0.0)
                .build());

        log.info("Workflow created: {} '{}' ({} steps, client={})",
                workflow.getId(), workflow.getName(), workflow.getSteps().size(), workflow.getClientId());
        return workflow;
    }

    public WorkflowExecution executeWorkflow(UUID workflowId) {
        return executeWorkflow(workflowId, null);
    }

    /**
     * @throws ResourceNotFoundException      for an unknown workflow
     * @throws WorkflowStateConflictException when the execution is not PENDING
     */
    public WorkflowExecution executeWorkflow(UUID workflowId, JsonNode input) {
        FederatedWorkflow workflow = getWorkflow(workflowId);
        UUID executionId = workflow.getExecutionId();

        WorkflowExecution running = tracker.transition(workflowId, executionId, WorkflowStatus.RUNNING, "execute",
                e -> e.toBuilder().startedAt(clock.instant()).build());
        totalExecutions.incrementAndGet();

        long start = System.nanoTime();
        try {
            JsonNode result = executor.run(workflow, executionId, input);
            finish(workflow, executionId, WorkflowStatus.COMPLETED, "completed",
                    e -> e.toBuilder().result(result).endedAt(clock.instant()).build());

        } catch (CancellationException e) {
            log.info("Workflow {} stopped dispatching after cancellation", workflowId);

        } catch (WorkflowExecutionFailedException e) {
            Object code = e.getDetails().getOrDefault("code", ExecutionError.EXECUTION_FAILED);
            fail(workflow, executionId, String.valueOf(code), e, null);

        } catch (FederationException e) {
            fail(workflow, executionId, e.getKind().getCode(), e, null);

        } catch (RuntimeException e) {
            log.error("Unexpected error in workflow {} execution {}", workflowId, executionId, e);
            fail(workflow, executionId, ExecutionError.INTERNAL_ERROR, e, stackTrace(e));

        } finally {
            metrics.getWorkflowExecutionTimer().record(Duration.ofNanos(System.nanoTime() - start));
        }

        WorkflowExecution finished = tracker.get(executionId);
        log.info("Workflow {} execution {} finished: {} (started {})",
                workflowId, executionId, finished.getStatus(), running.getStartedAt());
        return finished;
    }

    /**
     * Cancel a PENDING or RUNNING execution. Steps already dispatched run to completion,
     * but their results are discarded and no further steps are dispatched.
     */
    public WorkflowExecution cancelWorkflow(UUID workflowId) {
        FederatedWorkflow workflow = getWorkflow(workflowId);
        WorkflowExecution cancelled = tracker.transition(workflowId, workflow.getExecutionId(),
                WorkflowStatus.CANCELLED, "cancel",
                e -> e.toBuilder().endedAt(clock.instant()).build());
        cancelledExecutions.incrementAndGet();
        metrics.getWorkflowCancelled().increment();
        return cancelled;
    }

    public WorkflowStatus getStatus(UUID workflowId) {
        return getExecution(workflowId).getStatus();
    }

    public FederatedWorkflow getWorkflow(UUID workflowId) {
        return repository.findWorkflow(workflowId)
                .orElseThrow(() -> new ResourceNotFoundException("Workflow", workflowId));
    }

    public WorkflowExecution getExecution(UUID workflowId) {
        return tracker.get(getWorkflow(workflowId).getExecutionId());
    }

    public List<ExecutionEvent> getExecutionHistory(UUID workflowId) {
        return repository.events(getWorkflow(workflowId).getExecutionId());
    }

    /**
     * @param clientId null lists every client's workflows
     */
    public List<FederatedWorkflow> listWorkflows(String clientId) {
        return repository.findWorkflows(w -> clientId == null || clientId.equals(w.getClientId()));
    }

    /**
     * Only allowed while the execution is still PENDING. The merged definition is re-validated.
     *
     * @throws WorkflowStateConflictException once the execution has left PENDING
     */
    public FederatedWorkflow updateWorkflow(UUID workflowId, WorkflowUpdate update) {
        FederatedWorkflow current = getWorkflow(workflowId);
        WorkflowStatus status = tracker.get(current.getExecutionId()).getStatus();
        if (status != WorkflowStatus.PENDING) {
            throw new WorkflowStateConflictException(workflowId, status, "update");
        }

        FederatedWorkflow.FederatedWorkflowBuilder builder = current.toBuilder();
        if (update.getName() != null) {
            builder.name(update.getName());
        }
        if (update.getDescription() != null) {
            builder.description(update.getDescription());
        }
        if (update.getSteps() != null) {
            builder.clearSteps().steps(update.getSteps());
        }
        if (update.getConfig() != null) {
            builder.config(update.getConfig());
        }
        FederatedWorkflow updated = builder.updatedAt(clock.instant()).build();

        validator.validate(updated.getName(), updated.getSteps(), updated.getConfig());
        tracker.saveWhilePending(updated, "update");
        log.info("Workflow updated: {} '{}'", workflowId, updated.getName());
        return updated;
    }

    /**
     * Refused while the execution is RUNNING.
     */
    public void deleteWorkflow(UUID workflowId) {
        FederatedWorkflow workflow = getWorkflow(workflowId);
        tracker.deleteUnlessRunning(workflowId, workflow.getExecutionId());
        log.info("Workflow deleted: {}", workflowId);
    }

    public ComponentHealth health() {
        long completed = completedExecutions.get();
        long failed = failedExecutions.get();
        long finished = completed + failed;

        Map<String, Object> counters = new LinkedHashMap<>();
        counters.put("total_executions", totalExecutions.get());
        counters.put("completed_executions", completed);
        counters.put("failed_executions", failed);
        counters.put("cancelled_executions", cancelledExecutions.get());
        counters.put("running_executions", tracker.countByStatus(WorkflowStatus.RUNNING));
        counters.put("pending_executions", tracker.countByStatus(WorkflowStatus.PENDING));

        double successRate = ComponentHealth.successRate(completed, finished);
        return ComponentHealth.builder()
                .component("workflow_engine")
                .status(finished > 0 && successRate < 50.0 ? ComponentHealth.DEGRADED : ComponentHealth.HEALTHY)
                .successRate(successRate)
                .counters(counters)
                .checkedAt(clock.instant())
                .build();
    }

    public Map<String, Number> metrics() {
        Map<String, Number> values = new LinkedHashMap<>();
        values.put("workflow_executions_total", totalExecutions.get());
        values.put("workflow_executions_completed_total", completedExecutions.get());
        values.put("workflow_executions_failed_total", failedExecutions.get());
        values.put("workflow_executions_cancelled_total", cancelledExecutions.get());
        values.put("workflow_executions_running", tracker.countByStatus(WorkflowStatus.RUNNING));
        return values;
    }

    private void fail(FederatedWorkflow workflow, UUID executionId, String code,
                      Exception cause, String stackTrace) {
        ExecutionError.ExecutionErrorBuilder error = ExecutionError.builder()
                .code(code)
                .message(cause.getMessage())
                .stackTrace(stackTrace)
                .occurredAt(clock.instant());
        if (cause instanceof FederationException fe) {
            error.details(fe.getDetails());
        }
        ExecutionError executionError = error.build();

        finish(workflow, executionId, WorkflowStatus.FAILED, "failed",
                e -> e.toBuilder().error(executionError).endedAt(executionError.getOccurredAt()).build());
        log.warn("Workflow {} execution {} failed [{}]: {}", workflow.getId(), executionId, code, cause.getMessage());
    }

    /**
     * Terminal transition from RUNNING. A concurrent cancel wins: the outcome is then dropped.
     */
    private void finish(FederatedWorkflow workflow, UUID executionId, WorkflowStatus status, String operation,
                        UnaryOperator<WorkflowExecution> change) {
        try {
            tracker.transition(workflow.getId(), executionId, status, operation, change);
        } catch (WorkflowStateConflictException e) {
            log.info("Workflow {} outcome {} dropped: {}", workflow.getId(), status, e.getMessage());
            return;
        }
        if (status == WorkflowStatus.COMPLETED) {
            completedExecutions.incrementAndGet();
            metrics.getWorkflowCompleted().increment();
        } else if (status == WorkflowStatus.FAILED) {
            failedExecutions.incrementAndGet();
            metrics.getWorkflowFailed().increment();
        }
    }

    private static String stackTrace(Throwable e) {
        StringWriter writer = new StringWriter();
        e.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
