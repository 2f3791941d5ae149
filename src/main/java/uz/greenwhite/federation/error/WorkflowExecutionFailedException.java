package uz.greenwhite.federation.error;

import java.util.Map;

public class WorkflowExecutionFailedException extends FederationException {

    public WorkflowExecutionFailedException(String reason) {
        super(ErrorKind.WORKFLOW_EXECUTION_FAILED, "Workflow execution failed: " + reason);
    }

    public WorkflowExecutionFailedException(String reason, Map<String, Object> details, Throwable cause) {
        super(ErrorKind.WORKFLOW_EXECUTION_FAILED, "Workflow execution failed: " + reason, details, cause);
    }
}
