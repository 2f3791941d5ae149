package uz.greenwhite.federation.error;

import uz.greenwhite.federation.workflow.model.WorkflowStatus;

import java.util.Map;
import java.util.UUID;

/**
 * Operation refused because of the execution's current status,
 * e.g. executing a workflow whose execution is already terminal.
 */
public class WorkflowStateConflictException extends FederationException {

    public WorkflowStateConflictException(UUID workflowId, WorkflowStatus status, String operation) {
        super(ErrorKind.CONFLICT,
                "Cannot " + operation + " workflow " + workflowId + " in status " + status,
                Map.of("workflowId", workflowId.toString(), "status", status.name()), null);
    }
}
