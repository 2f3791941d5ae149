package uz.greenwhite.federation.workflow.model;

public enum StepType {
    LLM_INFERENCE,
    DATA_TRANSFORMATION,
    API_CALL,
    DATABASE_OPERATION,
    FILE_OPERATION,
    NOTIFICATION,
    CONDITIONAL,
    LOOP,
    PARALLEL,
    CUSTOM;

    /**
     * Types that may run without a provider: their mapped input becomes their output.
     */
    public boolean isLocal() {
        return this == DATA_TRANSFORMATION;
    }
}
