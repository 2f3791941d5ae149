package uz.greenwhite.federation.translation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uz.greenwhite.federation.config.TranslationProperties;
import uz.greenwhite.federation.error.SchemaTranslationFailedException;
import uz.greenwhite.federation.error.ValidationException;
import uz.greenwhite.federation.metrics.FederationMetrics;
import uz.greenwhite.federation.storage.InMemoryTranslationRepository;
import uz.greenwhite.federation.support.MutableClock;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaTranslationEngineTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SchemaTranslationEngine engine;
    private InMemoryTranslationRepository repository;

    @BeforeEach
    void setUp() {
        McpTranslatorConfig config = new McpTranslatorConfig();
        TranslatorRegistry registry = new TranslatorRegistry(
                List.of(config.mcpV1ToV2Translator(), config.mcpV2ToV1Translator()));
        TranslationProperties properties = new TranslationProperties();
        properties.setHistoryLimit(3);
        repository = new InMemoryTranslationRepository();
        engine = new SchemaTranslationEngine(new ProtocolTranslator(registry), registry,
                new TranslationCache(properties), repository, properties,
                new FederationMetrics(new SimpleMeterRegistry()), MutableClock.ticking());
    }

    private SchemaTranslationRequest request(String json) throws Exception {
        return SchemaTranslationRequest.builder()
                .sourceVersion("v1.0")
                .targetVersion("v2.0")
                .sourceData(objectMapper.readTree(json))
                .clientId("client-a")
                .build();
    }

    @Test
    void translatesAndStoresRecord() throws Exception {
        SchemaTranslationResponse response = engine.translateSchema(request("{\"tool\":\"search\",\"session\":\"s\"}"));

        assertThat(response.getTranslatedData().get("method").asText()).isEqualTo("search");
        assertThat(response.getMetadata().isCached()).isFalse();
        assertThat(response.getMetadata().getTranslator()).isEqualTo("McpV1ToV2Translator");
        assertThat(response.getMetadata().getDroppedFields()).containsExactly("session");

        SchemaTranslationRecord record = engine.getTranslation(response.getMetadata().getTranslationId()).orElseThrow();
        assertThat(record.getClientId()).isEqualTo("client-a");
        assertThat(record.versionPair()).isEqualTo("v1.0->v2.0");
    }

    @Test
    void repeatedRequestIsServedFromCache() throws Exception {
        SchemaTranslationResponse first = engine.translateSchema(request("{\"tool\":\"search\"}"));
        long sizeAfterFirst = engine.cacheSize();

        SchemaTranslationResponse second = engine.translateSchema(request("{\"tool\":\"search\"}"));

        assertThat(second.getMetadata().isCached()).isTrue();
        assertThat(second.getMetadata().getTranslationId()).isEqualTo(first.getMetadata().getTranslationId());
        assertThat(second.getTranslatedData()).isEqualTo(first.getTranslatedData());
        assertThat(engine.cacheSize()).isEqualTo(sizeAfterFirst).isEqualTo(1);
        assertThat(engine.metrics())
                .containsEntry("translation_cache_hits_total", 1L)
                .containsEntry("translation_cache_misses_total", 1L);
        assertThat(engine.listTranslations(null)).hasSize(1);
    }

    @Test
    void cacheKeyIsDeterministicAndSensitiveToEveryPart() throws Exception {
        SchemaTranslationRequest base = request("{\"tool\":\"search\"}");

        assertThat(SchemaTranslationEngine.cacheKey(base))
                .isEqualTo(SchemaTranslationEngine.cacheKey(request("{\"tool\":\"search\"}")))
                .startsWith("schema_translation:");
        assertThat(SchemaTranslationEngine.cacheKey(base))
                .isNotEqualTo(SchemaTranslationEngine.cacheKey(base.toBuilder().clientId("client-b").build()))
                .isNotEqualTo(SchemaTranslationEngine.cacheKey(base.toBuilder().targetVersion("v1.0").build()))
                .isNotEqualTo(SchemaTranslationEngine.cacheKey(request("{\"tool\":\"other\"}")));
    }

    @Test
    void missingVersionsAreRejected() {
        assertThatThrownBy(() -> engine.translateSchema(SchemaTranslationRequest.builder()
                .targetVersion("v2.0").build()))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getField()).isEqualTo("source_version"));

        assertThatThrownBy(() -> engine.translateSchema(SchemaTranslationRequest.builder()
                .sourceVersion("v1.0").targetVersion(" ").build()))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getField()).isEqualTo("target_version"));
    }

    @Test
    void unsupportedPairIsRecordedAsFailedAndNotCached() throws Exception {
        SchemaTranslationRequest request = request("{\"tool\":\"search\"}").toBuilder().targetVersion("v9.0").build();

        assertThatThrownBy(() -> engine.translateSchema(request))
                .isInstanceOf(SchemaTranslationFailedException.class);

        assertThat(engine.cacheSize()).isZero();
        assertThat(repository.history("v1.0->v9.0"))
                .singleElement()
                .satisfies(h -> {
                    assertThat(h.isSuccess()).isFalse();
                    assertThat(h.getError()).contains("No translator available");
                });
        assertThat(engine.health().getCounters()).containsEntry("failed_translations", 1L);
    }

    @Test
    void historyIsCappedAndNewestFirst() throws Exception {
        for (int i = 0; i < 5; i++) {
            engine.translateSchema(request("{\"tool\":\"t" + i + "\"}"));
        }

        List<TranslationHistoryRecord> history = repository.history("v1.0->v2.0");
        assertThat(history).hasSize(3);
        assertThat(history.get(0).getTimestamp()).isAfter(history.get(2).getTimestamp());

        TranslationPerformance performance = engine.performance().get(0);
        assertThat(performance.getVersionPair()).isEqualTo("v1.0->v2.0");
        assertThat(performance.getSamples()).isEqualTo(3);
        assertThat(performance.getFailed()).isZero();
    }

    @Test
    void sameVersionTranslationIsIdentity() throws Exception {
        JsonNode data = objectMapper.readTree("{\"x\":1}");

        SchemaTranslationResponse response = engine.translateSchema(SchemaTranslationRequest.builder()
                .sourceVersion("v2.0").targetVersion("v2.0").sourceData(data).build());

        assertThat(response.getTranslatedData()).isEqualTo(data);
        assertThat(response.getMetadata().getTranslator()).isEqualTo("identity");
    }
}
