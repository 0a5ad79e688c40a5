package villagecompute.classifier.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static villagecompute.classifier.services.ClassifierTestFixtures.DAMAGED_SCAN;
import static villagecompute.classifier.services.ClassifierTestFixtures.SUPPLY_AGREEMENT;
import static villagecompute.classifier.services.ClassifierTestFixtures.SWORN_STATEMENT;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.classifier.api.types.ConfidenceLevel;
import villagecompute.classifier.api.types.ModelUsed;
import villagecompute.classifier.api.types.RawClassificationType;

/**
 * Unit tests for {@link PatternClassificationService}.
 */
class PatternClassificationServiceTest {

    private PatternClassificationService service;

    @BeforeEach
    void setUp() {
        service = ClassifierTestFixtures.patternService(ClassifierTestFixtures.registry());
    }

    @Test
    void testClassify_swornStatementWithCorroboratingFilename() {
        RawClassificationType raw = service.classify(SWORN_STATEMENT, "lopez_affidavit.pdf", ModelUsed.PATTERN_BASED);

        assertEquals("Affidavit/Declaration", raw.documentType());
        // no category rule fires, so the type's fallback applies
        assertEquals("Litigation", raw.category());
        assertEquals(ConfidenceLevel.HIGH, raw.stageConfidence());
        assertEquals(0.8, raw.confidenceScore());
        assertEquals(ModelUsed.PATTERN_BASED, raw.modelUsed());
    }

    @Test
    void testClassify_swornStatementWithoutFilename() {
        RawClassificationType raw = service.classify(SWORN_STATEMENT, null, ModelUsed.PATTERN_BASED);

        assertEquals("Affidavit/Declaration", raw.documentType());
        assertEquals(ConfidenceLevel.MEDIUM, raw.stageConfidence());
    }

    @Test
    void testClassify_swornMarkersOutrankFormMarkers() {
        String text = "Form I-130 applicant statement. I declare under penalty of perjury that this affidavit is true.";

        RawClassificationType raw = service.classify(text, "scan.pdf", ModelUsed.PATTERN_BASED);

        assertEquals("Affidavit/Declaration", raw.documentType());
    }

    @Test
    void testClassify_contractTextDecidesTypeThenCategory() {
        RawClassificationType raw = service.classify(SUPPLY_AGREEMENT, "supply_agreement.pdf",
                ModelUsed.PATTERN_BASED);

        assertEquals("Contract", raw.documentType());
        assertEquals("Contract", raw.category());
        assertEquals(ConfidenceLevel.HIGH, raw.stageConfidence());
        assertTrue(raw.reasoning().startsWith("Pattern-based classification"));
    }

    @Test
    void testClassify_filenameOnlyWhenTextIsSilent() {
        RawClassificationType raw = service.classify("Scanned page without recognizable wording.",
                "2023_bank_statement.pdf", ModelUsed.PATTERN_BASED);

        assertEquals("Financial Document", raw.documentType());
        assertEquals(ConfidenceLevel.LOW, raw.stageConfidence());
    }

    @Test
    void testClassify_noSignalsFallsBackToDefaults() {
        RawClassificationType raw = service.classify(DAMAGED_SCAN, "", ModelUsed.PATTERN_BASED);

        assertEquals("Misc. Reference Material", raw.documentType());
        assertEquals("General Legal", raw.category());
        assertEquals(ConfidenceLevel.LOW, raw.stageConfidence());
        assertEquals(0.4, raw.confidenceScore());
    }

    @Test
    void testClassify_neverFailsOnNullInput() {
        RawClassificationType raw = service.classify(null, null, ModelUsed.EMERGENCY);

        assertNotNull(raw);
        assertEquals(ModelUsed.EMERGENCY, raw.modelUsed());
        assertEquals("General Legal", raw.category());
    }
}
