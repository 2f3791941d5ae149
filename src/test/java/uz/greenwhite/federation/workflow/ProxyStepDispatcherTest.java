package uz.greenwhite.federation.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import uz.greenwhite.federation.config.ProxyProperties;
import uz.greenwhite.federation.config.WorkflowProperties;
import uz.greenwhite.federation.metrics.FederationMetrics;
import uz.greenwhite.federation.proxy.ConnectionPool;
import uz.greenwhite.federation.proxy.ProxyService;
import uz.greenwhite.federation.proxy.RequestRouter;
import uz.greenwhite.federation.storage.InMemoryWorkflowRepository;
import uz.greenwhite.federation.support.MutableClock;
import uz.greenwhite.federation.translation.McpTranslatorConfig;
import uz.greenwhite.federation.translation.ProtocolTranslator;
import uz.greenwhite.federation.translation.TranslatorRegistry;
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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Steps running against a real proxy over a stubbed provider.
 */
class ProxyStepDispatcherTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<ClientRequest> sent = new CopyOnWriteArrayList<>();

    private Function<ClientRequest, ClientResponse> provider;
    private ThreadPoolTaskExecutor stepPool;
    private WorkflowEngine engine;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.ticking();
        FederationMetrics metrics = new FederationMetrics(new SimpleMeterRegistry());

        ProxyProperties proxyProperties = new ProxyProperties();
        proxyProperties.getRetry().setBaseDelayMs(1);
        proxyProperties.getRetry().setMaxDelayMs(5);
        proxyProperties.getRetry().setEnableJitter(false);
        proxyProperties.validate();

        ConnectionPool pool = new ConnectionPool(proxyProperties, CircuitBreakerRegistry.ofDefaults(), clock);
        pool.register("search", "http://search:8080", McpTranslatorConfig.V1);

        McpTranslatorConfig translators = new McpTranslatorConfig();
        ProtocolTranslator translator = new ProtocolTranslator(new TranslatorRegistry(
                List.of(translators.mcpV1ToV2Translator(), translators.mcpV2ToV1Translator())));

        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    sent.add(request);
                    return Mono.just(provider.apply(request));
                })
                .build();
        ProxyService proxyService = new ProxyService(webClient, pool, new RequestRouter(proxyProperties),
                translator, proxyProperties, metrics, objectMapper, clock);

        stepPool = new ThreadPoolTaskExecutor();
        stepPool.setCorePoolSize(2);
        stepPool.setThreadNamePrefix("step-test-");
        stepPool.initialize();

        StepDispatcher dispatcher = new ProxyStepDispatcher(proxyService, stepPool, new WorkflowProperties());
        InMemoryWorkflowRepository repository = new InMemoryWorkflowRepository();
        ExecutionTracker tracker = new ExecutionTracker(repository, clock);
        WorkflowExecutor executor = new WorkflowExecutor(dispatcher, tracker, metrics, objectMapper, clock);
        engine = new WorkflowEngine(repository, tracker, executor, new WorkflowValidator(), metrics, clock);
    }

    @AfterEach
    void tearDown() {
        stepPool.shutdown();
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header("Content-Type", "application/json")
                .body(body)
                .build();
    }

    private FederatedWorkflow create(WorkflowStep step) {
        return engine.createWorkflow(WorkflowDefinition.builder()
                .clientId("client-a")
                .name("single")
                .steps(List.of(step))
                .config(WorkflowConfig.DEFAULT)
                .build());
    }

    private static WorkflowStep searchStep(int maxAttempts) {
        return WorkflowStep.builder()
                .id("lookup")
                .name("lookup")
                .stepType(StepType.API_CALL)
                .providerId("search")
                .retryConfig(RetryPolicy.builder().maxAttempts(maxAttempts).initialDelayMs(1).maxDelayMs(5).build())
                .build();
    }

    @Test
    void singleAttemptPolicySendsOneRequest() {
        provider = request -> json(HttpStatus.SERVICE_UNAVAILABLE, "{}");
        FederatedWorkflow workflow = create(searchStep(1));

        WorkflowExecution execution = engine.executeWorkflow(workflow.getId());

        assertThat(execution.getStatus()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(sent).hasSize(1);
        assertThat(execution.getStepExecutions()).singleElement()
                .extracting(StepExecution::getRetryAttempts).isEqualTo(0);
    }

    @Test
    void stepPolicyIsTheOnlyRetryLoop() {
        provider = request -> json(HttpStatus.SERVICE_UNAVAILABLE, "{}");
        FederatedWorkflow workflow = create(searchStep(2));

        WorkflowExecution execution = engine.executeWorkflow(workflow.getId());

        assertThat(execution.getStatus()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(sent).hasSize(2);
        assertThat(execution.getStepExecutions()).singleElement()
                .extracting(StepExecution::getRetryAttempts).isEqualTo(1);
    }

    @Test
    void stepWithoutConfigUsesDefaultPath() {
        provider = request -> json(HttpStatus.OK, "{\"hits\":2}");
        FederatedWorkflow workflow = create(searchStep(1).toBuilder().config(null).build());

        WorkflowExecution execution = engine.executeWorkflow(workflow.getId());

        assertThat(execution.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(sent).hasSize(1);
        assertThat(sent.get(0).url().toString()).isEqualTo("http://search:8080/mcp/execute");
        assertThat(execution.getStepExecutions()).singleElement()
                .extracting(StepExecution::getStatus).isEqualTo(StepStatus.COMPLETED);
    }
}
