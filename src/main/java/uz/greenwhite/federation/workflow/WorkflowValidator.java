package uz.greenwhite.federation.workflow;

import org.springframework.stereotype.Component;
import uz.greenwhite.federation.error.ValidationException;
import uz.greenwhite.federation.workflow.model.RetryPolicy;
import uz.greenwhite.federation.workflow.model.WorkflowConfig;
import uz.greenwhite.federation.workflow.model.WorkflowStep;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a definition in a fixed order: name, steps, step graph, config.
 * The first problem found is reported, naming the offending field.
 */
@Component
public class WorkflowValidator {

    public void validate(String name, List<WorkflowStep> steps, WorkflowConfig config) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name", "Workflow name is required");
        }
        if (steps == null || steps.isEmpty()) {
            throw new ValidationException("steps", "Workflow must have at least one step");
        }

        Map<String, WorkflowStep> byId = new HashMap<>();
        for (WorkflowStep step : steps) {
            if (step == null) {
                throw new ValidationException("steps", "Steps must not contain null entries");
            }
            if (step.getId() == null || step.getId().isBlank()) {
                throw new ValidationException("steps", "Every step needs an id");
            }
            if (byId.put(step.getId(), step) != null) {
                throw new ValidationException("steps", "Duplicate step id: " + step.getId());
            }
            if (step.getStepType() == null) {
                throw new ValidationException("steps", "Step " + step.getId() + " has no step_type");
            }
            if ((step.getProviderId() == null || step.getProviderId().isBlank()) && !step.getStepType().isLocal()) {
                throw new ValidationException("steps",
                        "Step " + step.getId() + " of type " + step.getStepType() + " requires a provider_id");
            }
            if (step.getRetryConfig() != null) {
                validateRetry("steps", step.getRetryConfig());
            }
            validatePointers(step, step.getInputMapping());
            validatePointers(step, step.getOutputMapping());
        }

        for (WorkflowStep step : steps) {
            for (String dependency : step.getDependencies()) {
                if (!byId.containsKey(dependency)) {
                    throw new ValidationException("steps",
                            "Step " + step.getId() + " depends on unknown step " + dependency);
                }
            }
        }
        detectCycles(steps, byId);

        if (config != null) {
            if (config.getTimeoutSeconds() <= 0) {
                throw new ValidationException("config.timeout", "Timeout must be positive");
            }
            if (config.getMaxParallelExecutions() <= 0) {
                throw new ValidationException("config.max_parallel_executions", "Must be at least 1");
            }
            if (config.getCostBudget() != null && config.getCostBudget() < 0) {
                throw new ValidationException("config.cost_budget", "Cost budget must not be negative");
            }
            if (config.getRetryPolicy() != null) {
                validateRetry("config.retry_policy", config.getRetryPolicy());
            }
        }
    }

    private void validatePointers(WorkflowStep step, Map<String, String> mapping) {
        if (mapping == null) {
            return;
        }
        mapping.forEach((field, pointer) -> {
            if (pointer == null || !(pointer.isEmpty() || pointer.startsWith("/"))) {
                throw new ValidationException("steps",
                        "Step " + step.getId() + " mapping '" + field + "' must be a JSON pointer, got: " + pointer);
            }
        });
    }

    private void validateRetry(String field, RetryPolicy policy) {
        if (policy.getMaxAttempts() < 1) {
            throw new ValidationException(field, "max_attempts must be at least 1");
        }
        if (policy.getInitialDelayMs() < 0 || policy.getMaxDelayMs() < policy.getInitialDelayMs()) {
            throw new ValidationException(field, "Delays must satisfy 0 <= initial_delay <= max_delay");
        }
    }

    /**
     * Depth-first search; a step met again while still on the stack closes a cycle.
     */
    private void detectCycles(List<WorkflowStep> steps, Map<String, WorkflowStep> byId) {
        Set<String> done = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        for (WorkflowStep step : steps) {
            visit(step.getId(), byId, done, onStack);
        }
    }

    private void visit(String id, Map<String, WorkflowStep> byId, Set<String> done, Set<String> onStack) {
        if (done.contains(id)) {
            return;
        }
        if (!onStack.add(id)) {
            throw new ValidationException("steps", "Dependency cycle through step " + id);
        }
        for (String dependency : byId.get(id).getDependencies()) {
            visit(dependency, byId, done, onStack);
        }
        onStack.remove(id);
        done.add(id);
    }
}
