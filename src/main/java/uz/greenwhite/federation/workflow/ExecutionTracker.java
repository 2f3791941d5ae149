package uz.greenwhite.federation.workflow;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.federation.error.ResourceNotFoundException;
import uz.greenwhite.federation.error.WorkflowStateConflictException;
import uz.greenwhite.federation.storage.WorkflowRepository;
import uz.greenwhite.federation.workflow.model.ExecutionEvent;
import uz.greenwhite.federation.workflow.model.FederatedWorkflow;
import uz.greenwhite.federation.workflow.model.WorkflowExecution;
import uz.greenwhite.federation.workflow.model.WorkflowStatus;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Live executions, one immutable snapshot per id.
 *
 * Each change runs inside {@link ConcurrentHashMap#compute} for that id only,
 * is persisted in the same critical section, and publishes a complete new
 * snapshot. Terminal snapshots are never replaced.
 *
 * The owning workflow record's status is written in the same section, so it
 * always matches the execution. Only PENDING and RUNNING executions stay in
 * memory; terminal ones are read back from the repository.
 */
@Slf4j
@Component
public class ExecutionTracker {

    private final WorkflowRepository repository;
    private final Clock clock;
    private final Map<UUID, WorkflowExecution> executions = new ConcurrentHashMap<>();

    public ExecutionTracker(WorkflowRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public void register(WorkflowExecution execution) {
        executions.compute(execution.getId(), (id, existing) -> {
            repository.saveExecution(execution);
            return execution;
        });
    }

    public Optional<WorkflowExecution> find(UUID executionId) {
        WorkflowExecution live = executions.get(executionId);
        if (live != null) {
            return Optional.of(live);
        }
        return repository.findExecution(executionId);
    }

    public WorkflowExecution get(UUID executionId) {
        return find(executionId).orElseThrow(() -> new ResourceNotFoundException("Execution", executionId));
    }

    public boolean isCancelled(UUID executionId) {
        return find(executionId).map(e -> e.getStatus() == WorkflowStatus.CANCELLED).orElse(false);
    }

    /**
     * Status transition. Fails with a conflict when {@code next} is not reachable from the current status.
     */
    public WorkflowExecution transition(UUID workflowId, UUID executionId, WorkflowStatus next,
                                        String operation, UnaryOperator<WorkflowExecution> change) {
        WorkflowExecution[] previous = new WorkflowExecution[1];
        WorkflowExecution[] updated = new WorkflowExecution[1];
        executions.compute(executionId, (id, current) -> {
            WorkflowExecution base = current != null ? current : load(id);
            if (!base.getStatus().canTransitionTo(next)) {
                throw new WorkflowStateConflictException(workflowId, base.getStatus(), operation);
            }
            previous[0] = base;
            updated[0] = change.apply(base).toBuilder().status(next).build();
            repository.saveExecution(updated[0]);
            repository.findWorkflow(workflowId).ifPresent(workflow -> repository.saveWorkflow(
                    workflow.toBuilder().status(next).updatedAt(clock.instant()).build()));
            return next.isTerminal() ? null : updated[0];
        });

        repository.appendEvent(ExecutionEvent.builder()
                .executionId(executionId)
                .from(previous[0].getStatus())
                .to(next)
                .message(operation)
                .timestamp(clock.instant())
                .build());
        log.info("Execution {} of workflow {}: {} -> {}", executionId, workflowId, previous[0].getStatus(), next);
        return updated[0];
    }

    /**
     * Saves a changed workflow record while the execution is still PENDING.
     * A concurrent execute or cancel either runs before, and the save is refused, or waits for it.
     */
    public void saveWhilePending(FederatedWorkflow workflow, String operation) {
        guarded(workflow.getId(), workflow.getExecutionId(), operation,
                status -> status == WorkflowStatus.PENDING, false,
                () -> repository.saveWorkflow(workflow));
    }

    /**
     * Deletes the workflow and its execution unless the execution is RUNNING.
     */
    public void deleteUnlessRunning(UUID workflowId, UUID executionId) {
        guarded(workflowId, executionId, "delete",
                status -> status != WorkflowStatus.RUNNING, true,
                () -> {
                    repository.deleteExecution(executionId);
                    repository.deleteWorkflow(workflowId);
                });
    }

    /**
     * Non-status change of a running execution (step records, usage).
     *
     * @return false when the execution is no longer running and the change was dropped
     */
    public boolean updateRunning(UUID executionId, UnaryOperator<WorkflowExecution> change) {
        boolean[] applied = new boolean[1];
        executions.computeIfPresent(executionId, (id, current) -> {
            if (current.getStatus() != WorkflowStatus.RUNNING) {
                return current;
            }
            WorkflowExecution result = change.apply(current);
            repository.saveExecution(result);
            applied[0] = true;
            return result;
        });
        if (!applied[0]) {
            log.debug("Update for execution {} dropped, no longer running", executionId);
        }
        return applied[0];
    }

    public long countByStatus(WorkflowStatus status) {
        return executions.values().stream().filter(e -> e.getStatus() == status).count();
    }

    /**
     * Executions held in memory, i.e. those not yet terminal.
     */
    public int size() {
        return executions.size();
    }

    private void guarded(UUID workflowId, UUID executionId, String operation,
                         Predicate<WorkflowStatus> allowed, boolean evict, Runnable action) {
        executions.compute(executionId, (id, current) -> {
            WorkflowExecution base = current != null ? current : load(id);
            if (!allowed.test(base.getStatus())) {
                throw new WorkflowStateConflictException(workflowId, base.getStatus(), operation);
            }
            action.run();
            return evict ? null : current;
        });
    }

    private WorkflowExecution load(UUID executionId) {
        return repository.findExecution(executionId)
                .orElseThrow(() -> new ResourceNotFoundException("Execution", executionId));
    }
}
