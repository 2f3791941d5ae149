package uz.greenwhite.federation.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uz.greenwhite.federation.error.ExternalServiceException;
import uz.greenwhite.federation.error.ResourceNotFoundException;
import uz.greenwhite.federation.error.ValidationException;
import uz.greenwhite.federation.error.WorkflowStateConflictException;
import uz.greenwhite.federation.metrics.FederationMetrics;
import uz.greenwhite.federation.storage.InMemoryWorkflowRepository;
import uz.greenwhite.federation.support.MutableClock;
import uz.greenwhite.federation.workflow.model.ExecutionError;
import uz.greenwhite.federation.workflow.model.ExecutionEvent;
import uz.greenwhite.federation.workflow.model.FederatedWorkflow;
import uz.greenwhite.federation.workflow.model.RetryPolicy;
import uz.greenwhite.federation.workflow.model.StepExecution;
import uz.greenwhite.federation.workflow.model.StepStatus;
import uz.greenwhite.federation.workflow.model.StepType;
import uz.greenwhite.federation.workflow.model.WorkflowConfig;
import uz.greenwhite.federation.workflow.model.WorkflowDefinition;
import uz.greenwhite.federation.workflow.model.WorkflowExecution;
import uz.greenwhite.federation.workflow.model.WorkflowStatus;
import uz.greenwhite.federation.workflow.model.WorkflowStep;
import uz.greenwhite.federation.workflow.model.WorkflowUpdate;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowEngineTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, JsonNode> inputs = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

    private Function<StepInvocation, CompletableFuture<StepOutcome>> behaviour;
    private Consumer<FederatedWorkflow> onWorkflowSaved = workflow -> { };
    private ExecutionTracker tracker;
    private WorkflowEngine engine;

    @BeforeEach
    void setUp() {
        behaviour = invocation -> CompletableFuture.completedFuture(StepOutcome.builder()
                .output(objectMapper.createObjectNode().put("step", invocation.getStep().getId()))
                .cost(1.5)
                .build());

        StepDispatcher dispatcher = invocation -> {
            String id = invocation.getStep().getId();
            inputs.put(id, invocation.getInput());
            calls.computeIfAbsent(id, k -> new AtomicInteger()).incrementAndGet();
            return behaviour.apply(invocation);
        };

        MutableClock clock = MutableClock.ticking();
        FederationMetrics metrics = new FederationMetrics(new SimpleMeterRegistry());
        InMemoryWorkflowRepository repository = new InMemoryWorkflowRepository() {
            @Override
            public void saveWorkflow(FederatedWorkflow workflow) {
                super.saveWorkflow(workflow);
                onWorkflowSaved.accept(workflow);
            }
        };
        tracker = new ExecutionTracker(repository, clock);
        WorkflowExecutor executor = new WorkflowExecutor(dispatcher, tracker, metrics, objectMapper, clock);
        engine = new WorkflowEngine(repository, tracker, executor, new WorkflowValidator(), metrics, clock);
    }

    private static WorkflowStep step(String id, String... dependencies) {
        return WorkflowStep.builder()
                .id(id)
                .name("step " + id)
                .stepType(StepType.API_CALL)
                .providerId("search")
                .dependencies(List.of(dependencies))
                .retryConfig(RetryPolicy.builder().maxAttempts(3).initialDelayMs(1).maxDelayMs(5).build())
                .build();
    }

    private FederatedWorkflow create(WorkflowStep... steps) {
        return create(WorkflowConfig.DEFAULT, steps);
    }

    private FederatedWorkflow create(WorkflowConfig config, WorkflowStep... steps) {
        return engine.createWorkflow(WorkflowDefinition.builder()
                .clientId("client-a")
                .name("pipeline")
                .steps(List.of(steps))
                .config(config)
                .build());
    }

    @Test
    void createdWorkflowIsPending() {
        FederatedWorkflow workflow = create(step("a"));

        assertThat(workflow.getStatus()).isEqualTo(WorkflowStatus.PENDING);
        assertThat(engine.getStatus(workflow.getId())).isEqualTo(WorkflowStatus.PENDING);
        assertThat(engine.listWorkflows("client-a")).extracting(FederatedWorkflow::getId)
                .containsExactly(workflow.getId());
        assertThat(engine.listWorkflows("client-b")).isEmpty();
    }

    @Test
    void invalidDefinitionIsNotStored() {
        assertThatThrownBy(() -> create(step("a", "b"), step("b", "a")))
                .isInstanceOf(ValidationException.class);
        assertThat(engine.listWorkflows(null)).isEmpty();
    }

    @Test
    void successfulRunCompletesWithOrderedTimestamps() {
        FederatedWorkflow workflow = create(step("a"), step("b", "a"));

        WorkflowExecution execution = engine.executeWorkflow(workflow.getId());

        assertThat(execution.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(execution.getStartedAt()).isNotNull();
        assertThat(execution.getEndedAt()).isAfter(execution.getStartedAt());
        assertThat(execution.getStepExecutions()).extracting(StepExecution::getStatus)
                .containsOnly(StepStatus.COMPLETED);
        assertThat(execution.getTotalCost()).isEqualTo(3.0);
        assertThat(execution.getResult().get("steps").get("b").get("step").asText()).isEqualTo("b");
        assertThat(engine.getWorkflow(workflow.getId()).getStatus()).isEqualTo(WorkflowStatus.COMPLETED);

        List<ExecutionEvent> history = engine.getExecutionHistory(workflow.getId());
        assertThat(history).extracting(ExecutionEvent::getTo)
                .containsExactly(WorkflowStatus.RUNNING, WorkflowStatus.COMPLETED);
    }

    @Test
    void mappingsFlowBetweenSteps() throws Exception {
        behaviour = invocation -> CompletableFuture.completedFuture(StepOutcome.builder()
                .output(objectMapper.createObjectNode().put("hits", 3))
                .build());
        WorkflowStep first = step("a").toBuilder()
                .inputMapping(Map.of("query", "/input/q"))
                .outputMapping(Map.of("hit_count", "/hits"))
                .build();
        WorkflowStep second = step("b", "a").toBuilder()
                .inputMapping(Map.of("count", "/vars/hit_count", "previous", "/steps/a/hits"))
                .build();
        FederatedWorkflow workflow = create(first, second);

        WorkflowExecution execution = engine.executeWorkflow(workflow.getId(), objectMapper.readTree("{\"q\":\"java\"}"));

        assertThat(inputs.get("a").get("query").asText()).isEqualTo("java");
        assertThat(inputs.get("b").get("count").asInt()).isEqualTo(3);
        assertThat(inputs.get("b").get("previous").asInt()).isEqualTo(3);
        assertThat(execution.getResult().get("outputs").get("hit_count").asInt()).isEqualTo(3);
    }

    @Test
    void secondExecuteIsAConflict() {
        FederatedWorkflow workflow = create(step("a"));
        engine.executeWorkflow(workflow.getId());

        assertThatThrownBy(() -> engine.executeWorkflow(workflow.getId()))
                .isInstanceOf(WorkflowStateConflictException.class);
        assertThat(calls.get("a").get()).isEqualTo(1);
    }

    @Test
    void failingStepFailsExecutionAndSkipsDependents() {
        behaviour = invocation -> invocation.getStep().getId().equals("a")
                ? CompletableFuture.failedFuture(new ExternalServiceException("search", "HTTP 400", 400, false))
                : CompletableFuture.completedFuture(StepOutcome.builder().build());
        FederatedWorkflow workflow = create(step("a"), step("b", "a"));

        WorkflowExecution execution = engine.executeWorkflow(workflow.getId());

        assertThat(execution.getStatus()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(execution.getError().getCode()).isEqualTo(ExecutionError.STEP_FAILED);
        assertThat(execution.getError().getDetails()).containsEntry("step_id", "a");
        assertThat(execution.getEndedAt()).isAfter(execution.getStartedAt());
        assertThat(calls).doesNotContainKey("b");
        assertThat(execution.getStepExecutions()).singleElement().satisfies(s -> {
            assertThat(s.getStatus()).isEqualTo(StepStatus.FAILED);
            assertThat(s.getError().getCode()).isEqualTo("EXTERNAL_SERVICE_ERROR");
            assertThat(s.getRetryAttempts()).isZero();
        });
    }

    @Test
    void unexpectedErrorIsRecordedAsInternal() {
        behaviour = invocation -> {
            throw new IllegalStateException("dispatcher crashed");
        };
        FederatedWorkflow workflow = create(step("a"));

        WorkflowExecution execution = engine.executeWorkflow(workflow.getId());

        assertThat(execution.getStatus()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(execution.getError().getCode()).isEqualTo(ExecutionError.INTERNAL_ERROR);
        assertThat(execution.getError().getMessage()).contains("dispatcher crashed");
    }

    @Test
    void retryableFailureIsRetried() {
        AtomicInteger attempts = new AtomicInteger();
        behaviour = invocation -> attempts.incrementAndGet() < 3
                ? CompletableFuture.failedFuture(new ExternalServiceException("search", "HTTP 503", 503, true))
                : CompletableFuture.completedFuture(StepOutcome.builder().output(objectMapper.createObjectNode()).build());
        FederatedWorkflow workflow = create(step("a"));

        WorkflowExecution execution = engine.executeWorkflow(workflow.getId());

        assertThat(execution.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(execution.getStepExecutions().get(0).getRetryAttempts()).isEqualTo(2);
        assertThat(calls.get("a").get()).isEqualTo(3);
    }

    @Test
    void retriesStopAtMaxAttempts() {
        behaviour = invocation ->
                CompletableFuture.failedFuture(new ExternalServiceException("search", "HTTP 503", 503, true));
        FederatedWorkflow workflow = create(step("a"));

        WorkflowExecution execution = engine.executeWorkflow(workflow.getId());

        assertThat(execution.getStatus()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(calls.get("a").get()).isEqualTo(3);
    }

    @Test
    void workflowTimeoutFailsExecution() {
        behaviour = invocation -> new CompletableFuture<>();
        FederatedWorkflow workflow = create(WorkflowConfig.builder().timeoutSeconds(1).build(), step("a"));

        WorkflowExecution execution = engine.executeWorkflow(workflow.getId());

        assertThat(execution.getStatus()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(execution.getError().getCode()).isEqualTo(ExecutionError.WORKFLOW_TIMEOUT);
    }

    @Test
    void cancelWhileRunningStopsFurtherSteps() throws Exception {
        CountDownLatch firstDispatched = new CountDownLatch(1);
        CompletableFuture<StepOutcome> firstResult = new CompletableFuture<>();
        behaviour = invocation -> {
            if (invocation.getStep().getId().equals("a")) {
                firstDispatched.countDown();
                return firstResult;
            }
            return CompletableFuture.completedFuture(StepOutcome.builder().build());
        };
        FederatedWorkflow workflow = create(step("a"), step("b", "a"));

        ExecutorService runner = Executors.newSingleThreadExecutor();
        try {
            Future<WorkflowExecution> run = runner.submit(() -> engine.executeWorkflow(workflow.getId()));
            assertThat(firstDispatched.await(5, TimeUnit.SECONDS)).isTrue();

            WorkflowExecution cancelled = engine.cancelWorkflow(workflow.getId());
            assertThat(cancelled.getStatus()).isEqualTo(WorkflowStatus.CANCELLED);

            firstResult.complete(StepOutcome.builder().output(objectMapper.createObjectNode()).build());
            WorkflowExecution finished = run.get(5, TimeUnit.SECONDS);

            assertThat(finished.getStatus()).isEqualTo(WorkflowStatus.CANCELLED);
            assertThat(calls).doesNotContainKey("b");
            assertThat(engine.getStatus(workflow.getId())).isEqualTo(WorkflowStatus.CANCELLED);
            assertThat(engine.getWorkflow(workflow.getId()).getStatus()).isEqualTo(WorkflowStatus.CANCELLED);
        } finally {
            runner.shutdownNow();
        }
    }

    @Test
    void cancelledWorkflowCannotBeExecutedOrCancelledAgain() {
        FederatedWorkflow workflow = create(step("a"));
        engine.cancelWorkflow(workflow.getId());

        assertThatThrownBy(() -> engine.executeWorkflow(workflow.getId()))
                .isInstanceOf(WorkflowStateConflictException.class);
        assertThatThrownBy(() -> engine.cancelWorkflow(workflow.getId()))
                .isInstanceOf(WorkflowStateConflictException.class);
        assertThat(calls).isEmpty();
    }

    @Test
    void updateIsOnlyAllowedWhilePending() {
        FederatedWorkflow workflow = create(step("a"));

        FederatedWorkflow renamed = engine.updateWorkflow(workflow.getId(),
                WorkflowUpdate.builder().name("renamed").build());
        assertThat(renamed.getName()).isEqualTo("renamed");
        assertThat(renamed.getSteps()).hasSize(1);

        assertThatThrownBy(() -> engine.updateWorkflow(workflow.getId(),
                WorkflowUpdate.builder().steps(List.of()).build()))
                .isInstanceOf(ValidationException.class);

        engine.executeWorkflow(workflow.getId());
        assertThatThrownBy(() -> engine.updateWorkflow(workflow.getId(),
                WorkflowUpdate.builder().name("late").build()))
                .isInstanceOf(WorkflowStateConflictException.class);
    }

    @Test
    void deleteRemovesWorkflowAndExecution() {
        FederatedWorkflow workflow = create(step("a"));
        engine.executeWorkflow(workflow.getId());

        engine.deleteWorkflow(workflow.getId());

        assertThatThrownBy(() -> engine.getWorkflow(workflow.getId()))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThat(engine.listWorkflows(null)).isEmpty();
    }

    @Test
    void cancelRacingWithStartLeavesRecordCancelled() throws Exception {
        CompletableFuture<WorkflowExecution> cancelled = new CompletableFuture<>();
        ExecutorService canceller = Executors.newSingleThreadExecutor();
        onWorkflowSaved = saved -> {
            if (saved.getStatus() == WorkflowStatus.RUNNING && !cancelled.isDone()) {
                canceller.execute(() -> {
                    try {
                        cancelled.complete(engine.cancelWorkflow(saved.getId()));
                    } catch (RuntimeException e) {
                        cancelled.completeExceptionally(e);
                    }
                });
            }
        };
        behaviour = invocation -> cancelled.thenApply(c -> StepOutcome.builder()
                .output(objectMapper.createObjectNode())
                .build());
        FederatedWorkflow workflow = create(step("a"), step("b", "a"));

        ExecutorService runner = Executors.newSingleThreadExecutor();
        try {
            WorkflowExecution finished = runner.submit(() -> engine.executeWorkflow(workflow.getId()))
                    .get(5, TimeUnit.SECONDS);

            assertThat(cancelled.get(5, TimeUnit.SECONDS).getStatus()).isEqualTo(WorkflowStatus.CANCELLED);
            assertThat(finished.getStatus()).isEqualTo(WorkflowStatus.CANCELLED);
            assertThat(engine.getWorkflow(workflow.getId()).getStatus()).isEqualTo(WorkflowStatus.CANCELLED);
            assertThat(calls).doesNotContainKey("b");
        } finally {
            runner.shutdownNow();
            canceller.shutdownNow();
        }
    }

    @Test
    void updateAfterCancelIsRefusedAndRecordKeepsStatus() {
        FederatedWorkflow workflow = create(step("a"));
        engine.cancelWorkflow(workflow.getId());

        assertThatThrownBy(() -> engine.updateWorkflow(workflow.getId(),
                WorkflowUpdate.builder().name("late").build()))
                .isInstanceOf(WorkflowStateConflictException.class);
        FederatedWorkflow stored = engine.getWorkflow(workflow.getId());
        assertThat(stored.getStatus()).isEqualTo(WorkflowStatus.CANCELLED);
        assertThat(stored.getName()).isEqualTo("pipeline");
    }

    @Test
    void finishedExecutionsLeaveTheLiveSet() {
        FederatedWorkflow done = create(step("a"));
        FederatedWorkflow waiting = create(step("a"));
        assertThat(tracker.size()).isEqualTo(2);

        engine.executeWorkflow(done.getId());
        assertThat(tracker.size()).isEqualTo(1);
        assertThat(engine.getExecution(done.getId()).getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(engine.getExecution(done.getId()).getStepExecutions()).hasSize(1);

        engine.cancelWorkflow(waiting.getId());
        assertThat(tracker.size()).isZero();
        assertThat(engine.getStatus(waiting.getId())).isEqualTo(WorkflowStatus.CANCELLED);
        assertThat(engine.health().getCounters()).containsEntry("pending_executions", 0L);

        engine.deleteWorkflow(done.getId());
        assertThatThrownBy(() -> engine.getWorkflow(done.getId()))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void healthCountsOutcomes() {
        engine.executeWorkflow(create(step("a")).getId());
        behaviour = invocation ->
                CompletableFuture.failedFuture(new ExternalServiceException("search", "HTTP 400", 400, false));
        engine.executeWorkflow(create(step("a")).getId());

        assertThat(engine.health().getCounters())
                .containsEntry("completed_executions", 1L)
                .containsEntry("failed_executions", 1L);
        assertThat(engine.health().getSuccessRate()).isEqualTo(50.0);
    }
}
