package uz.greenwhite.federation.workflow.model;

public enum WorkflowPriority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}
