package villagecompute.classifier.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.classifier.api.types.LabelScoreType;
import villagecompute.classifier.api.types.ValidatorOutcomeType;
import villagecompute.classifier.exceptions.ValidatorException;
import villagecompute.classifier.integration.validator.ZeroShotValidatorClient;

class ValidationServiceTest {

    private TaxonomyRegistry registry;
    private ZeroShotValidatorClient client;
    private ValidationService service;

    @BeforeEach
    void setUp() {
        registry = ClassifierTestFixtures.registry();
        client = mock(ZeroShotValidatorClient.class);

        service = new ValidationService();
        service.enabled = true;
        service.validatorClient = client;
        service.taxonomyRegistry = registry;
    }

    @Test
    void testValidate_agreementOnBothLabels() {
        when(client.classify(anyString(), eq(registry.categoryNames())))
                .thenReturn(List.of(new LabelScoreType("Contract", 0.8), new LabelScoreType("Corporate", 0.1)));
        when(client.classify(anyString(), eq(registry.validatorDocumentTypes())))
                .thenReturn(List.of(new LabelScoreType("Contract", 0.6)));

        ValidatorOutcomeType outcome = service.validate("A supply agreement.", "Contract", "Contract");

        assertTrue(outcome.available());
        assertTrue(outcome.categoryMatch());
        assertTrue(outcome.docTypeMatch());
        assertFalse(outcome.disagreesOnCategory());
        assertEquals(0.7, outcome.overallConfidence(), 1e-9);
    }

    @Test
    void testValidate_reportsDisagreement() {
        when(client.classify(anyString(), eq(registry.categoryNames())))
                .thenReturn(List.of(new LabelScoreType("Litigation", 0.62)));
        when(client.classify(anyString(), eq(registry.validatorDocumentTypes())))
                .thenReturn(List.of(new LabelScoreType("Court Filing", 0.4)));

        ValidatorOutcomeType outcome = service.validate("A supply agreement.", "Contract", "Contract");

        assertTrue(outcome.disagreesOnCategory());
        assertFalse(outcome.docTypeMatch());
        assertEquals("Litigation", outcome.validatorCategory());
        assertEquals("Court Filing", outcome.validatorDocType());
    }

    @Test
    void testValidate_sendsLeadingThousandCharacters() {
        String text = "c".repeat(1000) + "d".repeat(200);
        when(client.classify(anyString(), anyList())).thenReturn(List.of(new LabelScoreType("Contract", 0.5)));

        service.validate(text, "Contract", "Contract");

        verify(client).classify("c".repeat(1000), registry.categoryNames());
        verify(client).classify("c".repeat(1000), registry.validatorDocumentTypes());
    }

    @Test
    void testValidate_disabledNeverCallsValidator() {
        service.enabled = false;

        ValidatorOutcomeType outcome = service.validate("text", "Contract", "Contract");

        assertFalse(outcome.available());
        assertFalse(outcome.disagreesOnCategory());
        verify(client, never()).classify(anyString(), anyList());
    }

    @Test
    void testValidate_blankTextIsUnavailable() {
        assertFalse(service.validate(" ", "Contract", "Contract").available());
        verify(client, never()).classify(anyString(), anyList());
    }

    @Test
    void testValidate_validatorFailureIsUnavailable() {
        when(client.classify(anyString(), anyList())).thenThrow(new ValidatorException("status 503"));

        ValidatorOutcomeType outcome = service.validate("text", "Contract", "Contract");

        assertFalse(outcome.available());
        assertEquals("status 503", outcome.unavailableReason());
    }
}
