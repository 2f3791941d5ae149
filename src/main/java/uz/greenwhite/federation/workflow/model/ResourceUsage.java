package uz.greenwhite.federation.workflow.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ResourceUsage {

    public static final ResourceUsage ZERO = ResourceUsage.builder().build();

    long cpuTimeMs;
    long memoryUsedBytes;
    long networkIoBytes;
    long diskIoBytes;
    long apiCalls;

    public ResourceUsage plus(ResourceUsage other) {
        return ResourceUsage.builder()
                .cpuTimeMs(cpuTimeMs + other.cpuTimeMs)
                .memoryUsedBytes(Math.max(memoryUsedBytes, other.memoryUsedBytes))
                .networkIoBytes(networkIoBytes + other.networkIoBytes)
                .diskIoBytes(diskIoBytes + other.diskIoBytes)
                .apiCalls(apiCalls + other.apiCalls)
                .build();
    }
}
