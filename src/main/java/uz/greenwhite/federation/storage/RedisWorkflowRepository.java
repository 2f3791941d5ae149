package uz.greenwhite.federation.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;
import uz.greenwhite.federation.config.StorageProperties;
import uz.greenwhite.federation.workflow.model.ExecutionEvent;
import uz.greenwhite.federation.workflow.model.FederatedWorkflow;
import uz.greenwhite.federation.workflow.model.WorkflowExecution;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

@Slf4j
@Repository
@ConditionalOnProperty(name = "federation.storage.type", havingValue = "redis")
public class RedisWorkflowRepository implements WorkflowRepository {

    private static final String WORKFLOW_PREFIX = "federation:workflow:";
    private static final String WORKFLOW_INDEX = "federation:workflow:ids";
    private static final String EXECUTION_PREFIX = "federation:execution:";
    private static final String EVENTS_PREFIX = "federation:execution:events:";

    private final StringRedisTemplate redisTemplate;
    private final RedisJson json;
    private final StorageProperties storageProperties;

    public RedisWorkflowRepository(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                   StorageProperties storageProperties) {
        this.redisTemplate = redisTemplate;
        this.json = new RedisJson(objectMapper);
        this.storageProperties = storageProperties;
    }

    // ==================== WORKFLOWS ====================

    @Override
    public void saveWorkflow(FederatedWorkflow workflow) {
        String key = WORKFLOW_PREFIX + workflow.getId();
        redisTemplate.opsForValue().set(key, json.write(workflow), storageProperties.getRedisTtlHours(), TimeUnit.HOURS);
        redisTemplate.opsForSet().add(WORKFLOW_INDEX, workflow.getId().toString());
        log.debug("Workflow saved: {} -> {}", key, workflow.getStatus());
    }

    @Override
    public Optional<FederatedWorkflow> findWorkflow(UUID id) {
        String value = redisTemplate.opsForValue().get(WORKFLOW_PREFIX + id);
        return Optional.ofNullable(json.read(value, FederatedWorkflow.class));
    }

    @Override
    public List<FederatedWorkflow> findWorkflows(Predicate<FederatedWorkflow> filter) {
        Set<String> ids = redisTemplate.opsForSet().members(WORKFLOW_INDEX);
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return ids.stream()
                .map(id -> {
                    Optional<FederatedWorkflow> workflow = findWorkflow(UUID.fromString(id));
                    if (workflow.isEmpty()) {
                        // expired by TTL
                        redisTemplate.opsForSet().remove(WORKFLOW_INDEX, id);
                    }
                    return workflow.orElse(null);
                })
                .filter(Objects::nonNull)
                .filter(filter)
                .sorted(Comparator.comparing(FederatedWorkflow::getCreatedAt))
                .toList();
    }

    @Override
    public void deleteWorkflow(UUID id) {
        redisTemplate.delete(WORKFLOW_PREFIX + id);
        redisTemplate.opsForSet().remove(WORKFLOW_INDEX, id.toString());
        log.debug("Workflow deleted: {}", id);
    }

    // ==================== EXECUTIONS ====================

    @Override
    public void saveExecution(WorkflowExecution execution) {
        String key = EXECUTION_PREFIX + execution.getId();
        redisTemplate.opsForValue().set(key, json.write(execution), storageProperties.getRedisTtlHours(), TimeUnit.HOURS);
        log.debug("Execution saved: {} -> {}", key, execution.getStatus());
    }

    @Override
    public Optional<WorkflowExecution> findExecution(UUID id) {
        String value = redisTemplate.opsForValue().get(EXECUTION_PREFIX + id);
        return Optional.ofNullable(json.read(value, WorkflowExecution.class));
    }

    @Override
    public void deleteExecution(UUID id) {
        redisTemplate.delete(List.of(EXECUTION_PREFIX + id, EVENTS_PREFIX + id));
    }

    @Override
    public void appendEvent(ExecutionEvent event) {
        String key = EVENTS_PREFIX + event.getExecutionId();
        redisTemplate.opsForList().rightPush(key, json.write(event));
        redisTemplate.expire(key, Duration.ofHours(storageProperties.getRedisTtlHours()));
    }

    @Override
    public List<ExecutionEvent> events(UUID executionId) {
        List<String> values = redisTemplate.opsForList().range(EVENTS_PREFIX + executionId, 0, -1);
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .map(value -> json.read(value, ExecutionEvent.class))
                .filter(Objects::nonNull)
                .toList();
    }
}
