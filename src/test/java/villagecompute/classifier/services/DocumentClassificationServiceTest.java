package villagecompute.classifier.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static villagecompute.classifier.services.ClassifierTestFixtures.CONTRACT_ANSWER;
import static villagecompute.classifier.services.ClassifierTestFixtures.SUPPLY_AGREEMENT;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import jakarta.validation.Validation;
import villagecompute.classifier.api.types.CascadeOutcomeType;
import villagecompute.classifier.api.types.ClassificationResultType;
import villagecompute.classifier.api.types.ConfidenceLevel;
import villagecompute.classifier.api.types.LabelScoreType;
import villagecompute.classifier.api.types.ModelUsed;
import villagecompute.classifier.api.types.RetrievalContextType;
import villagecompute.classifier.api.types.ValidatorOutcomeType;
import villagecompute.classifier.integration.ai.ModelHandle;
import villagecompute.classifier.integration.ai.ModelHandles;
import villagecompute.classifier.integration.store.EmbeddingStoreSimilarityStore;
import villagecompute.classifier.integration.store.SimilarityCollection;
import villagecompute.classifier.integration.validator.ZeroShotValidatorClient;
import villagecompute.classifier.observability.ClassificationMetrics;

/**
 * End-to-end tests for {@link DocumentClassificationService} with every service wired for real. Only the chat
 * models, the embedding model and the zero-shot validator are mocked.
 */
class DocumentClassificationServiceTest {

    private TaxonomyRegistry registry;
    private EmbeddingModel embeddingModel;
    private ChatModel primaryModel;
    private ChatModel fallbackApiModel;
    private ChatModel fallbackLocalModel;
    private ZeroShotValidatorClient validatorClient;
    private ClassificationMetrics metrics;
    private EmbeddingStoreSimilarityStore store;
    private DocumentClassificationService service;

    @BeforeEach
    void setUp() {
        registry = ClassifierTestFixtures.registry();
        embeddingModel = mock(EmbeddingModel.class);
        when(embeddingModel.embed(anyString())).thenAnswer(
                inv -> Response.from(Embedding.from(ClassifierTestFixtures.letterVector(inv.getArgument(0)))));
        primaryModel = mock(ChatModel.class);
        fallbackApiModel = mock(ChatModel.class);
        fallbackLocalModel = mock(ChatModel.class);
        validatorClient = mock(ZeroShotValidatorClient.class);
        metrics = mock(ClassificationMetrics.class);
        store = new EmbeddingStoreSimilarityStore();

        EmbeddingService embeddingService = new EmbeddingService();
        embeddingService.embeddingModel = embeddingModel;

        SimilarityIndexService indexService = new SimilarityIndexService();
        indexService.taxonomyRegistry = registry;
        indexService.embeddingService = embeddingService;
        indexService.similarityStore = store;
        indexService.examplesResource = "taxonomy/curated-examples.json";
        indexService.objectMapper = new ObjectMapper();
        indexService.ensureSeeded();

        ContextRetrievalService retrievalService = new ContextRetrievalService();
        retrievalService.embeddingService = embeddingService;
        retrievalService.similarityStore = store;
        retrievalService.taxonomyRegistry = registry;
        retrievalService.thresholds = ClassifierTestFixtures.thresholds();
        retrievalService.similarityIndexService = indexService;

        ClassifierCascadeService cascade = new ClassifierCascadeService();
        cascade.modelHandles = new ModelHandles(handle("primary", primaryModel),
                handle("fallback-api", fallbackApiModel), handle("fallback-local", fallbackLocalModel));
        cascade.promptBuilder = ClassifierTestFixtures.promptBuilder(registry);
        cascade.scoringService = ClassifierTestFixtures.scoringService(registry);
        cascade.patternService = ClassifierTestFixtures.patternService(registry);
        cascade.taxonomyRegistry = registry;
        cascade.thresholds = ClassifierTestFixtures.thresholds();
        cascade.metrics = metrics;

        ValidationService validationService = new ValidationService();
        validationService.enabled = true;
        validationService.validatorClient = validatorClient;
        validationService.taxonomyRegistry = registry;

        ResultCombinerService combiner = new ResultCombinerService();
        combiner.scoringService = cascade.scoringService;
        combiner.similarityIndexService = indexService;

        service = new DocumentClassificationService();
        service.contextRetrievalService = retrievalService;
        service.cascadeService = cascade;
        service.validationService = validationService;
        service.resultCombinerService = combiner;
        service.metrics = metrics;
        service.validator = Validation.byDefaultProvider().configure()
                .messageInterpolator(new ParameterMessageInterpolator()).buildValidatorFactory().getValidator();
    }

    private static ModelHandle handle(String name, ChatModel model) {
        return new ModelHandle(name, () -> model, Duration.ofSeconds(1));
    }

    private void validatorAnswers(String category, double categoryScore, String documentType, double typeScore) {
        when(validatorClient.classify(anyString(), eq(registry.categoryNames())))
                .thenReturn(List.of(new LabelScoreType(category, categoryScore),
                        new LabelScoreType("General Legal", 0.05)));
        when(validatorClient.classify(anyString(), eq(registry.validatorDocumentTypes())))
                .thenReturn(List.of(new LabelScoreType(documentType, typeScore)));
    }

    @Test
    void testClassify_primaryAnswerIsAcceptedAndRemembered() {
        when(primaryModel.chat(anyString())).thenReturn(CONTRACT_ANSWER);
        validatorAnswers("Contract", 0.91, "Contract", 0.84);

        ClassificationResultType result = service.classify(SUPPLY_AGREEMENT, "supply.pdf");

        assertEquals("Contract", result.documentCategory());
        assertEquals("Contract", result.documentType());
        assertEquals(ModelUsed.PRIMARY, result.modelUsed());
        assertEquals(ConfidenceLevel.HIGH, result.confidenceLevel());
        assertFalse(result.needsHumanReview());
        assertTrue(result.validation().available());
        assertTrue(result.validation().categoryMatch());
        assertEquals(0.875, result.validation().overallConfidence(), 1e-9);
        assertEquals(1, store.count(SimilarityCollection.DOCUMENTS));
        verify(fallbackApiModel, never()).chat(anyString());
        verify(metrics).recordClassification(eq(result), any(Duration.class));
    }

    @Test
    void testClassify_sameDocumentTwiceKeepsOnePastDocument() {
        when(primaryModel.chat(anyString())).thenReturn(CONTRACT_ANSWER);
        validatorAnswers("Contract", 0.91, "Contract", 0.84);

        service.classify(SUPPLY_AGREEMENT, "supply.pdf");
        service.classify(SUPPLY_AGREEMENT, "supply.pdf");

        assertEquals(1, store.count(SimilarityCollection.DOCUMENTS));
        verify(metrics, times(2)).recordClassification(any(), any());
    }

    @Test
    void testClassify_validatorDisagreementStaysAdvisory() {
        when(primaryModel.chat(anyString())).thenReturn(CONTRACT_ANSWER);
        validatorAnswers("Litigation", 0.62, "Contract", 0.71);

        ClassificationResultType result = service.classify(SUPPLY_AGREEMENT, "supply.pdf");

        assertEquals("Contract", result.documentCategory());
        assertEquals(ConfidenceLevel.HIGH, result.confidenceLevel());
        assertFalse(result.needsHumanReview());
        assertTrue(result.uncertaintyFlags().contains("Validator suggests category 'Litigation' (score 0.62)"));
        assertFalse(result.validation().categoryMatch());
    }

    @Test
    void testClassify_emptyTextStillReturnsResult() {
        ClassificationResultType result = service.classify("", "blank.pdf");

        assertNotNull(result);
        assertTrue(registry.isCategory(result.documentCategory()));
        assertEquals(ModelUsed.PATTERN_BASED, result.modelUsed());
        assertEquals(ConfidenceLevel.UNCERTAIN, result.confidenceLevel());
        assertTrue(result.needsHumanReview());
        assertFalse(result.validation().available());
        assertEquals(0, store.count(SimilarityCollection.DOCUMENTS));
        verify(validatorClient, never()).classify(anyString(), anyList());
    }

    @Test
    void testClassify_nullInputsAreTreatedAsEmpty() {
        ClassificationResultType result = service.classify(null, null);

        assertTrue(registry.isCategory(result.documentCategory()));
        assertTrue(result.confidenceScore() >= 0.0 && result.confidenceScore() <= 1.0);
        assertTrue(result.needsHumanReview());
    }

    @Test
    void testClassify_embeddingOutageStillRunsModelsWithoutContext() {
        when(embeddingModel.embed(anyString())).thenThrow(new RuntimeException("Connection refused"));
        when(primaryModel.chat(anyString())).thenReturn(CONTRACT_ANSWER);
        validatorAnswers("Contract", 0.91, "Contract", 0.84);

        ClassificationResultType result = service.classify(SUPPLY_AGREEMENT, "supply.pdf");

        assertEquals(ModelUsed.PRIMARY, result.modelUsed());
        assertEquals("Contract", result.documentCategory());
        assertNull(result.diagnosticError());
        assertTrue(result.validation().available());
        assertEquals(0, store.count(SimilarityCollection.DOCUMENTS));
        verify(primaryModel).chat(anyString());
    }

    @Test
    void testClassify_resultOutsideScoreRangeIsReplacedByUnclassified() {
        ResultCombinerService combiner = mock(ResultCombinerService.class);
        when(combiner.combine(anyString(), anyString(), any(CascadeOutcomeType.class), any(ValidatorOutcomeType.class)))
                .thenReturn(new ClassificationResultType("Contract", "Contract", ConfidenceLevel.HIGH, 1.5, "",
                        Set.of(), List.of(), false, ModelUsed.PRIMARY, ConfidenceLevel.HIGH, List.of(),
                        ValidatorOutcomeType.unavailable("Validator disabled"), null));
        service.resultCombinerService = combiner;
        when(primaryModel.chat(anyString())).thenReturn(CONTRACT_ANSWER);
        validatorAnswers("Contract", 0.91, "Contract", 0.84);

        ClassificationResultType result = service.classify(SUPPLY_AGREEMENT, "supply.pdf");

        assertEquals(ClassificationResultType.NO_MATCH_CATEGORY, result.documentCategory());
        assertEquals(0.0, result.confidenceScore());
        assertTrue(result.needsHumanReview());
        assertTrue(result.diagnosticError().contains("confidenceScore"));
        verify(metrics).recordClassification(eq(result), any(Duration.class));
    }

    @Test
    void testClassify_returnsUnclassifiedWhenEmergencyAlsoFails() {
        ContextRetrievalService retrieval = mock(ContextRetrievalService.class);
        ClassifierCascadeService cascade = mock(ClassifierCascadeService.class);
        when(retrieval.retrieve(anyString())).thenReturn(RetrievalContextType.empty());
        when(cascade.run(anyString(), anyString(), any())).thenThrow(new IllegalStateException("cascade down"));
        when(cascade.emergency(anyString(), anyString(), anyList(), any()))
                .thenThrow(new IllegalStateException("pattern rules down"));
        service.contextRetrievalService = retrieval;
        service.cascadeService = cascade;

        ClassificationResultType result = service.classify(SUPPLY_AGREEMENT, "supply.pdf");

        assertEquals(ClassificationResultType.NO_MATCH_CATEGORY, result.documentCategory());
        assertEquals(ConfidenceLevel.UNCERTAIN, result.confidenceLevel());
        assertEquals(0.0, result.confidenceScore());
        assertTrue(result.needsHumanReview());
        assertEquals("IllegalStateException: cascade down", result.diagnosticError());
        verify(metrics).recordClassification(eq(result), any(Duration.class));
    }

    @Test
    void testClassify_metricsFailureDoesNotFailClassification() {
        when(primaryModel.chat(anyString())).thenReturn(CONTRACT_ANSWER);
        validatorAnswers("Contract", 0.91, "Contract", 0.84);
        doThrow(new IllegalStateException("registry closed")).when(metrics)
                .recordClassification(any(), any());

        ClassificationResultType result = service.classify(SUPPLY_AGREEMENT, "supply.pdf");

        assertEquals(ModelUsed.PRIMARY, result.modelUsed());
    }
}
