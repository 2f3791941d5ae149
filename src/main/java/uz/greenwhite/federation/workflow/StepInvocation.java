package uz.greenwhite.federation.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import uz.greenwhite.federation.workflow.model.WorkflowStep;

import java.time.Duration;
import java.util.UUID;

@Value
@Builder
public class StepInvocation {
    UUID executionId;
    WorkflowStep step;
    JsonNode input;

    /**
     * Per attempt; null means the proxy default.
     */
    Duration timeout;
}
