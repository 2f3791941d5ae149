package uz.greenwhite.federation.workflow.model;

public enum StepStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
