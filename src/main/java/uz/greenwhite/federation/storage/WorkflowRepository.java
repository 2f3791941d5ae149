package uz.greenwhite.federation.storage;

import uz.greenwhite.federation.workflow.model.ExecutionEvent;
import uz.greenwhite.federation.workflow.model.FederatedWorkflow;
import uz.greenwhite.federation.workflow.model.WorkflowExecution;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Durable store of workflow definitions, their executions and execution status history.
 */
public interface WorkflowRepository {

    void saveWorkflow(FederatedWorkflow workflow);

    Optional<FederatedWorkflow> findWorkflow(UUID id);

    List<FederatedWorkflow> findWorkflows(Predicate<FederatedWorkflow> filter);

    void deleteWorkflow(UUID id);

    void saveExecution(WorkflowExecution execution);

    Optional<WorkflowExecution> findExecution(UUID id);

    void deleteExecution(UUID id);

    void appendEvent(ExecutionEvent event);

    /**
     * Oldest first.
     */
    List<ExecutionEvent> events(UUID executionId);
}
