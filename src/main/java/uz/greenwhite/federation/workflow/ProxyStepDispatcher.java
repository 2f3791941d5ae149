package uz.greenwhite.federation.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;
import uz.greenwhite.federation.config.WorkflowProperties;
import uz.greenwhite.federation.proxy.ProxyRequest;
import uz.greenwhite.federation.proxy.ProxyResponse;
import uz.greenwhite.federation.proxy.ProxyService;
import uz.greenwhite.federation.workflow.model.ResourceUsage;
import uz.greenwhite.federation.workflow.model.WorkflowStep;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs provider steps as proxy calls on the dedicated step pool.
 * Local steps complete immediately with their input as output.
 * Each submit sends exactly one HTTP request: the step's retry policy in
 * {@link WorkflowExecutor} is the only retry loop.
 */
@Slf4j
@Component
public class ProxyStepDispatcher implements StepDispatcher {

    private final ProxyService proxyService;
    private final ThreadPoolTaskExecutor executor;
    private final WorkflowProperties properties;

    public ProxyStepDispatcher(ProxyService proxyService,
                               @Qualifier("workflowStepExecutor") ThreadPoolTaskExecutor executor,
                               WorkflowProperties properties) {
        this.proxyService = proxyService;
        this.executor = executor;
        this.properties = properties;
    }

    @Override
    public CompletableFuture<StepOutcome> submit(StepInvocation invocation) {
        WorkflowStep step = invocation.getStep();
        if (step.getProviderId() == null || step.getProviderId().isBlank()) {
            return CompletableFuture.completedFuture(StepOutcome.builder()
                    .output(invocation.getInput())
                    .build());
        }
        return CompletableFuture.supplyAsync(() -> call(invocation), executor);
    }

    private StepOutcome call(StepInvocation invocation) {
        WorkflowStep step = invocation.getStep();
        Map<String, Object> parameters = step.getConfig() != null && step.getConfig().getParameters() != null
                ? step.getConfig().getParameters()
                : Map.of();
        String path = String.valueOf(parameters.getOrDefault("path", properties.getDefaultStepPath()));
        String method = String.valueOf(parameters.getOrDefault("method", properties.getDefaultStepMethod()));

        log.debug("Dispatching step {} of execution {} -> {} {} {}",
                step.getId(), invocation.getExecutionId(), step.getProviderId(), method, path);

        ProxyResponse response = proxyService.proxyRequest(ProxyRequest.builder()
                .serverId(step.getProviderId())
                .path(path)
                .method(HttpMethod.valueOf(method.toUpperCase()))
                .body(invocation.getInput())
                .timeout(invocation.getTimeout())
                .maxAttempts(1)
                .build());

        return StepOutcome.builder()
                .output(response.getBody())
                .cost(cost(response))
                .resourceUsage(ResourceUsage.builder()
                        .cpuTimeMs(response.getLatencyMs())
                        .networkIoBytes(size(invocation.getInput()) + size(response.getBody()))
                        .apiCalls(response.getAttempts())
                        .build())
                .build();
    }

    private double cost(ProxyResponse response) {
        String header = response.getHeaders().entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(properties.getCostHeader()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
        if (header == null) {
            return properties.getDefaultCostPerCall();
        }
        try {
            return Double.parseDouble(header.trim());
        } catch (NumberFormatException e) {
            log.warn("Unparseable {} header from {}: {}", properties.getCostHeader(), response.getServerId(), header);
            return properties.getDefaultCostPerCall();
        }
    }

    private static long size(JsonNode node) {
        return node == null ? 0 : node.toString().length();
    }
}
