package uz.greenwhite.federation.storage;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import uz.greenwhite.federation.workflow.model.ExecutionEvent;
import uz.greenwhite.federation.workflow.model.FederatedWorkflow;
import uz.greenwhite.federation.workflow.model.WorkflowExecution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

@Repository
@ConditionalOnProperty(name = "federation.storage.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryWorkflowRepository implements WorkflowRepository {

    private final Map<UUID, FederatedWorkflow> workflows = new ConcurrentHashMap<>();
    private final Map<UUID, WorkflowExecution> executions = new ConcurrentHashMap<>();
    private final Map<UUID, List<ExecutionEvent>> events = new ConcurrentHashMap<>();

    @Override
    public void saveWorkflow(FederatedWorkflow workflow) {
        workflows.put(workflow.getId(), workflow);
    }

    @Override
    public Optional<FederatedWorkflow> findWorkflow(UUID id) {
        return Optional.ofNullable(workflows.get(id));
    }

    @Override
    public List<FederatedWorkflow> findWorkflows(Predicate<FederatedWorkflow> filter) {
        return workflows.values().stream()
                .filter(filter)
                .sorted(Comparator.comparing(FederatedWorkflow::getCreatedAt))
                .toList();
    }

    @Override
    public void deleteWorkflow(UUID id) {
        workflows.remove(id);
    }

    @Override
    public void saveExecution(WorkflowExecution execution) {
        executions.put(execution.getId(), execution);
    }

    @Override
    public Optional<WorkflowExecution> findExecution(UUID id) {
        return Optional.ofNullable(executions.get(id));
    }

    @Override
    public void deleteExecution(UUID id) {
        executions.remove(id);
        events.remove(id);
    }

    @Override
    public void appendEvent(ExecutionEvent event) {
        events.computeIfAbsent(event.getExecutionId(), id -> Collections.synchronizedList(new ArrayList<>()))
                .add(event);
    }

    @Override
    public List<ExecutionEvent> events(UUID executionId) {
        List<ExecutionEvent> entries = events.get(executionId);
        if (entries == null) {
            return List.of();
        }
        synchronized (entries) {
            return new ArrayList<>(entries);
        }
    }
}
