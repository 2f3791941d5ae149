package uz.greenwhite.federation.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import uz.greenwhite.federation.workflow.model.ResourceUsage;

@Value
@Builder
public class StepOutcome {
    JsonNode output;
    double cost;

    @Builder.Default
    ResourceUsage resourceUsage = ResourceUsage.ZERO;
}
