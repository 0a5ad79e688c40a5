package villagecompute.classifier.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static villagecompute.classifier.services.ClassifierTestFixtures.DAMAGED_SCAN;
import static villagecompute.classifier.services.ClassifierTestFixtures.SUPPLY_AGREEMENT;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.classifier.api.types.AlternativeClassificationType;
import villagecompute.classifier.api.types.ConfidenceLevel;
import villagecompute.classifier.api.types.HeuristicScoreType;
import villagecompute.classifier.api.types.QualityMetricsType;

/**
 * Unit tests for {@link HeuristicScoringService}.
 */
class HeuristicScoringServiceTest {

    private HeuristicScoringService service;

    @BeforeEach
    void setUp() {
        service = ClassifierTestFixtures.scoringService(ClassifierTestFixtures.registry());
    }

    @Test
    void testScore_wellFormedContractScoresHigh() {
        HeuristicScoreType score = service.score(SUPPLY_AGREEMENT, "Contract", "Contract");

        assertEquals(1.0, score.keywordConfidence(), 1e-9);
        assertTrue(score.qualityMetrics().hasStructure());
        assertTrue(score.qualityMetrics().wordCount() > 200);
        assertFalse(score.qualityMetrics().ocrQualityIssues());
        assertTrue(score.uncertaintyFlags().isEmpty(), "Unexpected flags: " + score.uncertaintyFlags());
        assertEquals(ConfidenceLevel.HIGH, ConfidenceLevel.fromScore(service.overallConfidence(score)));
    }

    @Test
    void testScore_shortDamagedScanIsUncertain() {
        HeuristicScoreType score = service.score(DAMAGED_SCAN, "General Legal", "Misc. Reference Material");

        assertEquals(30, score.qualityMetrics().wordCount());
        assertTrue(score.qualityMetrics().ocrQualityIssues());
        assertTrue(score.uncertaintyFlags().contains(HeuristicScoringService.FLAG_TOO_SHORT));
        assertTrue(score.uncertaintyFlags().contains(HeuristicScoringService.FLAG_OCR_ISSUES));
        assertEquals(0.0, service.overallConfidence(score));
    }

    @Test
    void testKeywordSubScore_saturatesAtThirtyPercent() {
        // Contract has 12 keywords: 4 matches reach the 30% saturation point (3.6)
        String fourHits = "agreement contract party breach";
        String twoHits = "agreement breach";

        assertEquals(1.0, service.keywordConfidence(fourHits, "Contract", null) * 2, 1e-9);
        assertEquals(2 / 3.6, service.keywordConfidence(twoHits, "Contract", null) * 2, 1e-9);
    }

    @Test
    void testKeywordConfidence_unknownLabelsScoreZero() {
        assertEquals(0.0, service.keywordConfidence("agreement contract", "Maritime", "Bill of Lading"));
    }

    @Test
    void testScore_emptyTextDegradesWithoutFailing() {
        HeuristicScoreType score = service.score("", "Contract", "Contract");

        assertEquals(0, score.qualityMetrics().wordCount());
        assertEquals(0.0, score.keywordConfidence());
        assertTrue(score.uncertaintyFlags().contains(HeuristicScoringService.FLAG_TOO_SHORT));
        assertFalse(score.uncertaintyFlags().contains(HeuristicScoringService.FLAG_OCR_ISSUES));
    }

    @Test
    void testScore_hedgingInModelResponseIsFlagged() {
        HeuristicScoreType score = service.score(SUPPLY_AGREEMENT, "Contract", "Contract",
                "Category: Contract; Type: Contract\nReasoning: This appears to be a supply agreement.");

        assertTrue(score.uncertaintyFlags().contains(HeuristicScoringService.FLAG_MODEL_HEDGING));
    }

    @Test
    void testScore_knownInconsistencyIsFlagged() {
        HeuristicScoreType score = service.score(SUPPLY_AGREEMENT, "Corporate", "Court Filing");

        assertTrue(score.uncertaintyFlags().contains("Court filing classified under Corporate category"));
    }

    @Test
    void testScore_mixedCategoryIndicators() {
        String text = "The visa petition, the patent royalty and the landlord lease were discussed at trial.";

        HeuristicScoreType score = service.score(text, "Litigation", "Legal Memo");

        assertTrue(score.uncertaintyFlags().contains(HeuristicScoringService.FLAG_MIXED_CATEGORIES));
    }

    @Test
    void testAnalyzeQuality_legalFormatting() {
        QualityMetricsType quality = service.analyzeQuality("""
                IN THE SUPERIOR COURT OF THE STATE OF CALIFORNIA
                Case No. 21-CV-0042
                JOHN DOE, Plaintiff, v. ACME LLC, Defendant.
                """);

        assertTrue(quality.hasLegalFormatting());
    }

    @Test
    void testAnalyzeQuality_ocrSignals() {
        assertTrue(service.analyzeQuality("The c0ntract was 1ll signed by the p0rty").ocrQualityIssues());
        assertTrue(service.analyzeQuality("a b c d e f g h i j k l m n o p q r s t").ocrQualityIssues());
        assertFalse(service.analyzeQuality("The seller (the \"Seller\").  Closing occurs... later.")
                .ocrQualityIssues());
    }

    @Test
    void testOverallConfidence_appliesBonusesAndPenalties() {
        QualityMetricsType quality = new QualityMetricsType(250, true, true, true);
        HeuristicScoreType score = new HeuristicScoreType(0.5, quality, Set.of("a", "b"));

        // 0.5 + 0.20 + 0.15 + 0.10 - 0.20 - 0.20
        assertEquals(0.55, service.overallConfidence(score), 1e-9);
    }

    @Test
    void testAlternatives_topTwoAboveThreshold() {
        String text = "The landlord and tenant signed a lease and deed. The employee salary and severance were "
                + "negotiated. A visa was mentioned once.";

        List<AlternativeClassificationType> alternatives = service.alternatives(text, "Contract");

        assertEquals(2, alternatives.size());
        assertEquals("Real Estate", alternatives.get(0).category());
        assertEquals("Employment", alternatives.get(1).category());
        assertTrue(alternatives.get(0).score() >= alternatives.get(1).score());
        assertTrue(alternatives.get(0).reason().contains("Real Estate"));
    }

    @Test
    void testAlternatives_excludesChosenCategory() {
        String text = "The landlord and tenant signed a lease and deed.";

        assertTrue(service.alternatives(text, "Real Estate").isEmpty());
    }
}
