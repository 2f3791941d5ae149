package uz.greenwhite.federation.workflow.model;

public enum ExecutionEnvironment {
    DEVELOPMENT,
    TESTING,
    STAGING,
    PRODUCTION
}
