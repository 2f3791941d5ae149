package uz.greenwhite.federation.workflow.model;

/**
 * Pending -> Running -> {Completed, Failed, Cancelled}. Pending may also be cancelled directly.
 */
public enum WorkflowStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(WorkflowStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == CANCELLED;
            case RUNNING -> next.isTerminal();
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
